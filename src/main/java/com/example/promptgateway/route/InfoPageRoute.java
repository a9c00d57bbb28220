package com.example.promptgateway.route;

import com.example.promptgateway.buildInfo.BuildInfoHolder;
import com.example.promptgateway.config.GatewayConfig;
import com.example.promptgateway.filters.models.FullContext;
import com.example.promptgateway.keyPool.KeyPool;
import com.example.promptgateway.netty.Responses;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component("infoPageRoute")
public class InfoPageRoute implements RouteGroup {
    private final BuildInfoHolder buildInfoHolder;
    private final KeyPool keyPool;
    private final GatewayConfig gatewayConfig;

    @Autowired
    public InfoPageRoute(BuildInfoHolder buildInfoHolder, KeyPool keyPool, GatewayConfig gatewayConfig) {
        this.buildInfoHolder = buildInfoHolder;
        this.keyPool = keyPool;
        this.gatewayConfig = gatewayConfig;
    }

    @Override
    public CompletableFuture<FullHttpResponse> handle(FullContext context, String subPath) {
        if (!HttpMethod.GET.equals(context.getRequest().method())) {
            return CompletableFuture.completedFuture(null);
        }
        String host = context.getRequest().headers().get(HttpHeaderNames.HOST, "localhost");
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("uptime", ManagementFactory.getRuntimeMXBean().getUptime() / 1000);
        info.put("build", buildInfoHolder.get().getValue());
        Map<String, Object> endpoints = new LinkedHashMap<>();
        Map<String, Integer> keys = keyPool.isInitialized() ? keyPool.summary() : Map.of();
        keys.forEach((provider, count) -> {
            if (count > 0) {
                endpoints.put(provider, "http://" + host + RouteDispatcher.PROXY_PREFIX + "/" + provider);
            }
        });
        endpoints.put("kobold", "http://" + host + RouteDispatcher.PROXY_PREFIX + "/kobold");
        info.put("endpoints", endpoints);
        info.put("keys", keys);
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("gatekeeper", gatewayConfig.getGatekeeper().name().toLowerCase());
        config.put("queueMode", gatewayConfig.getQueueMode().name().toLowerCase());
        config.put("promptLogging", gatewayConfig.isPromptLogging());
        info.put("config", config);
        return CompletableFuture.completedFuture(Responses.json(HttpResponseStatus.OK, info));
    }
}
