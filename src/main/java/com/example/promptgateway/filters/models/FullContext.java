package com.example.promptgateway.filters.models;

import com.fasterxml.jackson.databind.JsonNode;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.QueryStringDecoder;
import lombok.Data;

import java.net.SocketAddress;
import java.util.List;
import java.util.Map;

@Data
public class FullContext {
    private final FullHttpRequest request;
    private final SocketAddress remoteAddress;
    private final String path;
    private RequestContext requestContext;
    // 是否输出访问日志
    private boolean autoLogging;
    private JsonNode jsonBody;
    private Map<String, List<String>> formBody;

    public FullContext(FullHttpRequest request, SocketAddress remoteAddress) {
        this.request = request;
        this.remoteAddress = remoteAddress;
        this.path = new QueryStringDecoder(request.uri()).path();
    }
}
