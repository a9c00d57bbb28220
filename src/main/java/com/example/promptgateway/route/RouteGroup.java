package com.example.promptgateway.route;

import com.example.promptgateway.filters.models.FullContext;
import io.netty.handler.codec.http.FullHttpResponse;

import java.util.concurrent.CompletableFuture;

public interface RouteGroup {
    /**
     * @param subPath path below the group's mount point, {@code "/"} at the mount point itself
     * @return the response, completed with {@code null} when no route of the group matches
     */
    CompletableFuture<FullHttpResponse> handle(FullContext context, String subPath);
}
