package com.example.promptgateway.filters.impl;

import com.example.promptgateway.config.NettyConfig;
import com.example.promptgateway.filters.Filter;
import com.example.promptgateway.filters.FilterOutcome;
import com.example.promptgateway.filters.models.FullContext;
import com.example.promptgateway.filters.models.RequestContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.InetSocketAddress;
import java.net.SocketAddress;

/**
 * First stage of every request, health checks included: attaches arrival time and a zero retry counter.
 */
@Component
public class RequestContextFilter implements Filter {
    static final String X_FORWARDED_FOR = "X-Forwarded-For";

    private final NettyConfig nettyConfig;

    @Autowired
    public RequestContextFilter(NettyConfig nettyConfig) {
        this.nettyConfig = nettyConfig;
    }

    @Override
    public FilterOutcome filter(FullContext context) {
        if (context.getRequestContext() != null) {
            return FilterOutcome.fail(new IllegalStateException("Request context already initialized"));
        }
        context.setRequestContext(new RequestContext(System.currentTimeMillis(), resolveClientIp(context)));
        return FilterOutcome.proceed();
    }

    private String resolveClientIp(FullContext context) {
        // TODO 根据部署方式识别可信的反向代理，只信任其添加的转发头
        if (nettyConfig.isTrustProxy()) {
            String forwarded = context.getRequest().headers().get(X_FORWARDED_FOR);
            if (forwarded != null && !forwarded.isBlank()) {
                return forwarded.split(",")[0].trim();
            }
        }
        SocketAddress remote = context.getRemoteAddress();
        if (remote instanceof InetSocketAddress) {
            InetSocketAddress inet = (InetSocketAddress) remote;
            return inet.getAddress() != null ? inet.getAddress().getHostAddress() : inet.getHostString();
        }
        return remote == null ? null : remote.toString();
    }
}
