package com.example.promptgateway.route;

import com.example.promptgateway.config.GatewayConfig;
import com.example.promptgateway.exception.GatewayException;
import com.example.promptgateway.filters.models.FullContext;
import com.example.promptgateway.keyPool.KeyPool;
import com.example.promptgateway.netty.Responses;
import com.example.promptgateway.requestQueue.RequestQueue;
import com.example.promptgateway.userStore.UserStore;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Client-facing proxy endpoints. Only the discovery endpoints live here; forwarding to upstream providers is
 * handled elsewhere.
 */
@Component("proxyRoutes")
public class ProxyRoutes implements RouteGroup {
    static final String KOBOLD_MODEL_PATH = "/kobold/api/v1/model";
    private static final Pattern MODELS_PATH = Pattern.compile("^/([a-z0-9_-]+)/v1/models$");

    private final GatewayConfig gatewayConfig;
    private final KeyPool keyPool;
    private final UserStore userStore;
    private final RequestQueue requestQueue;

    @Autowired
    public ProxyRoutes(GatewayConfig gatewayConfig, KeyPool keyPool, UserStore userStore, RequestQueue requestQueue) {
        this.gatewayConfig = gatewayConfig;
        this.keyPool = keyPool;
        this.userStore = userStore;
        this.requestQueue = requestQueue;
    }

    @Override
    public CompletableFuture<FullHttpResponse> handle(FullContext context, String subPath) {
        checkGatekeeper(context);
        if (!HttpMethod.GET.equals(context.getRequest().method())) {
            return CompletableFuture.completedFuture(null);
        }
        if (KOBOLD_MODEL_PATH.equals(subPath)) {
            return CompletableFuture.completedFuture(Responses.json(HttpResponseStatus.OK,
                    Map.of("result", "Connected to reverse proxy")));
        }
        Matcher matcher = MODELS_PATH.matcher(subPath);
        if (!matcher.matches()) {
            return CompletableFuture.completedFuture(null);
        }
        String provider = matcher.group(1);
        if (requestQueue.isRunning()) {
            return requestQueue.enqueue(context.getRequestContext(), () -> listModels(provider));
        }
        return CompletableFuture.completedFuture(listModels(provider));
    }

    private FullHttpResponse listModels(String provider) {
        int available = keyPool.available(provider);
        if (available == 0) {
            throw new GatewayException(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    "No keys available for provider " + provider);
        }
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("id", provider);
        model.put("object", "model");
        model.put("owned_by", provider);
        model.put("keys", available);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("object", "list");
        body.put("data", List.of(model));
        return Responses.json(HttpResponseStatus.OK, body);
    }

    private void checkGatekeeper(FullContext context) {
        String token = Credentials.clientToken(context.getRequest().headers());
        boolean allowed = switch (gatewayConfig.getGatekeeper()) {
            case NONE -> true;
            case PROXY_KEY -> token != null && token.equals(gatewayConfig.getProxyKey());
            case USER_TOKEN -> token != null && userStore.isInitialized() && userStore.getUser(token).isPresent();
        };
        if (!allowed) {
            throw new GatewayException(HttpResponseStatus.UNAUTHORIZED, "Unauthorized");
        }
    }
}
