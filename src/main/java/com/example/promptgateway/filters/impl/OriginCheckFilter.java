package com.example.promptgateway.filters.impl;

import com.example.promptgateway.config.GatewayConfig;
import com.example.promptgateway.filters.Filter;
import com.example.promptgateway.filters.FilterOutcome;
import com.example.promptgateway.filters.models.FullContext;
import com.example.promptgateway.netty.Responses;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rejects requests whose Origin or Referer contains one of the blocked origins.
 */
@Component
public class OriginCheckFilter implements Filter {
    private static final Logger logger = LoggerFactory.getLogger(OriginCheckFilter.class);

    private final GatewayConfig gatewayConfig;

    @Autowired
    public OriginCheckFilter(GatewayConfig gatewayConfig) {
        this.gatewayConfig = gatewayConfig;
    }

    @Override
    public FilterOutcome filter(FullContext context) {
        HttpHeaders headers = context.getRequest().headers();
        String origin = headers.get(HttpHeaderNames.ORIGIN);
        String referer = headers.get(HttpHeaderNames.REFERER);
        for (String blocked : gatewayConfig.getBlockedOrigins()) {
            if (blocked.isEmpty()) {
                continue;
            }
            if ((origin != null && origin.contains(blocked)) || (referer != null && referer.contains(blocked))) {
                logger.warn("拦截来自被屏蔽来源的请求 origin={} referer={}", origin, referer);
                Map<String, Object> error = new LinkedHashMap<>();
                error.put("type", "blocked_origin");
                error.put("message", gatewayConfig.getBlockMessage());
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("error", error);
                return FilterOutcome.shortCircuit(Responses.json(HttpResponseStatus.FORBIDDEN, body));
            }
        }
        return FilterOutcome.proceed();
    }
}
