package com.example.promptgateway.route;

import com.example.promptgateway.filters.models.FullContext;
import io.netty.handler.codec.http.FullHttpResponse;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Static mounting of the route groups: the info page at {@code /}, admin and proxy groups by prefix.
 */
@Component
public class RouteDispatcher {
    public static final String ADMIN_PREFIX = "/admin";
    public static final String PROXY_PREFIX = "/proxy";

    private final RouteGroup infoPageRoute;
    private final Map<String, RouteGroup> prefixedGroups = new LinkedHashMap<>();

    @Autowired
    public RouteDispatcher(@Qualifier("infoPageRoute") RouteGroup infoPageRoute,
                           @Qualifier("adminRoutes") RouteGroup adminRoutes,
                           @Qualifier("proxyRoutes") RouteGroup proxyRoutes) {
        this.infoPageRoute = infoPageRoute;
        prefixedGroups.put(ADMIN_PREFIX, adminRoutes);
        prefixedGroups.put(PROXY_PREFIX, proxyRoutes);
    }

    /**
     * A synchronous throw from a route is turned into a failed future so both kinds of failure take one path.
     */
    public CompletableFuture<FullHttpResponse> dispatch(FullContext context) {
        String path = context.getPath();
        try {
            if ("/".equals(path)) {
                return nonNull(infoPageRoute.handle(context, "/"));
            }
            for (Map.Entry<String, RouteGroup> entry : prefixedGroups.entrySet()) {
                String prefix = entry.getKey();
                if (path.equals(prefix) || path.startsWith(prefix + "/")) {
                    String subPath = path.length() == prefix.length() ? "/" : path.substring(prefix.length());
                    return nonNull(entry.getValue().handle(context, subPath));
                }
            }
            return CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static CompletableFuture<FullHttpResponse> nonNull(CompletableFuture<FullHttpResponse> future) {
        return future == null ? CompletableFuture.completedFuture(null) : future;
    }
}
