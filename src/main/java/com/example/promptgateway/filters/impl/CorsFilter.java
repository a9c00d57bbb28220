package com.example.promptgateway.filters.impl;

import com.example.promptgateway.config.CorsConfig;
import com.example.promptgateway.filters.Filter;
import com.example.promptgateway.filters.FilterOutcome;
import com.example.promptgateway.filters.models.FullContext;
import com.example.promptgateway.netty.Responses;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Answers CORS preflights. The allow-origin header is added to every response in {@link #decorate}, which the
 * response writer calls, so responses produced before this stage carry it as well.
 */
@Component
public class CorsFilter implements Filter {
    private final CorsConfig corsConfig;

    @Autowired
    public CorsFilter(CorsConfig corsConfig) {
        this.corsConfig = corsConfig;
    }

    @Override
    public FilterOutcome filter(FullContext context) {
        FullHttpRequest request = context.getRequest();
        if (!corsConfig.isEnabled() || !HttpMethod.OPTIONS.equals(request.method())
                || !request.headers().contains(HttpHeaderNames.ACCESS_CONTROL_REQUEST_METHOD)) {
            return FilterOutcome.proceed();
        }
        FullHttpResponse response = Responses.empty(HttpResponseStatus.NO_CONTENT);
        String requestedHeaders = request.headers().get(HttpHeaderNames.ACCESS_CONTROL_REQUEST_HEADERS);
        response.headers()
                .set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_METHODS, corsConfig.getAllowMethods())
                .set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_HEADERS,
                        requestedHeaders != null ? requestedHeaders : corsConfig.getAllowHeaders())
                .set(HttpHeaderNames.ACCESS_CONTROL_MAX_AGE, corsConfig.getMaxAgeSeconds());
        return FilterOutcome.shortCircuit(response);
    }

    public void decorate(HttpResponse response) {
        if (corsConfig.isEnabled()) {
            response.headers().set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN, corsConfig.getAllowOrigin());
        }
    }
}
