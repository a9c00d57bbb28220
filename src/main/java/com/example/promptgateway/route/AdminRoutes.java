package com.example.promptgateway.route;

import com.example.promptgateway.config.Gatekeeper;
import com.example.promptgateway.config.GatewayConfig;
import com.example.promptgateway.exception.GatewayException;
import com.example.promptgateway.filters.models.FullContext;
import com.example.promptgateway.netty.Responses;
import com.example.promptgateway.userStore.User;
import com.example.promptgateway.userStore.UserStore;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * User token administration, guarded by the admin key.
 */
@Component("adminRoutes")
public class AdminRoutes implements RouteGroup {
    private static final Logger logger = LoggerFactory.getLogger(AdminRoutes.class);

    private final GatewayConfig gatewayConfig;
    private final UserStore userStore;

    @Autowired
    public AdminRoutes(GatewayConfig gatewayConfig, UserStore userStore) {
        this.gatewayConfig = gatewayConfig;
        this.userStore = userStore;
    }

    @Override
    public CompletableFuture<FullHttpResponse> handle(FullContext context, String subPath) {
        authorize(context);
        if (!"/users".equals(subPath)) {
            return CompletableFuture.completedFuture(null);
        }
        HttpMethod method = context.getRequest().method();
        if (HttpMethod.GET.equals(method)) {
            requireUserStore();
            List<User> users = userStore.getUsers();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("users", users);
            body.put("count", users.size());
            return CompletableFuture.completedFuture(Responses.json(HttpResponseStatus.OK, body));
        }
        if (HttpMethod.POST.equals(method)) {
            requireUserStore();
            User user = userStore.createUser();
            logger.info("管理员创建了新的用户 token");
            return CompletableFuture.completedFuture(Responses.json(HttpResponseStatus.CREATED,
                    Map.of("token", user.getToken())));
        }
        return CompletableFuture.completedFuture(null);
    }

    private void authorize(FullContext context) {
        String adminKey = gatewayConfig.getAdminKey();
        String token = Credentials.bearerToken(context.getRequest().headers());
        if (adminKey == null || adminKey.isBlank() || !adminKey.equals(token)) {
            throw new GatewayException(HttpResponseStatus.UNAUTHORIZED, "Unauthorized");
        }
    }

    private void requireUserStore() {
        if (gatewayConfig.getGatekeeper() != Gatekeeper.USER_TOKEN || !userStore.isInitialized()) {
            throw new GatewayException(HttpResponseStatus.BAD_REQUEST, "User token gatekeeper is not enabled");
        }
    }
}
