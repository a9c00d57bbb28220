package com.example.promptgateway.startup;

import com.example.promptgateway.config.BuildInfoConfig;
import com.example.promptgateway.config.Gatekeeper;
import com.example.promptgateway.config.GatewayConfig;
import com.example.promptgateway.config.NettyConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks the configuration before anything is started. A failure here aborts the process.
 */
@Component
public class ConfigValidator {
    private static final Logger logger = LoggerFactory.getLogger(ConfigValidator.class);

    private final NettyConfig nettyConfig;
    private final GatewayConfig gatewayConfig;
    private final BuildInfoConfig buildInfoConfig;

    @Autowired
    public ConfigValidator(NettyConfig nettyConfig, GatewayConfig gatewayConfig, BuildInfoConfig buildInfoConfig) {
        this.nettyConfig = nettyConfig;
        this.gatewayConfig = gatewayConfig;
        this.buildInfoConfig = buildInfoConfig;
    }

    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (nettyConfig.getPort() < 0 || nettyConfig.getPort() > 65535) {
            problems.add("netty.port must be between 0 and 65535, got " + nettyConfig.getPort());
        }
        if (nettyConfig.getMaxContentLength() <= 0) {
            problems.add("netty.max-content-length must be positive");
        }
        if (buildInfoConfig.getProbeTimeout() == null || buildInfoConfig.getProbeTimeout().isNegative()
                || buildInfoConfig.getProbeTimeout().isZero()) {
            problems.add("build-info.probe-timeout must be positive");
        }
        if (gatewayConfig.getGatekeeper() == null) {
            problems.add("gateway.gatekeeper must be set");
        } else if (gatewayConfig.getGatekeeper() == Gatekeeper.PROXY_KEY && isBlank(gatewayConfig.getProxyKey())) {
            problems.add("gateway.proxy-key is required when gatekeeper is proxy_key");
        } else if (gatewayConfig.getGatekeeper() == Gatekeeper.USER_TOKEN && isBlank(gatewayConfig.getAdminKey())) {
            problems.add("gateway.admin-key is required when gatekeeper is user_token");
        }
        if (gatewayConfig.getQueueMode() == null) {
            problems.add("gateway.queue-mode must be set");
        }
        if (gatewayConfig.isPromptLogging()) {
            if (gatewayConfig.getPromptLogFlushInterval() == null
                    || gatewayConfig.getPromptLogFlushInterval().toMillis() <= 0) {
                problems.add("gateway.prompt-log-flush-interval must be positive when prompt logging is enabled");
            }
            if (isBlank(gatewayConfig.getPromptLogFile())) {
                problems.add("gateway.prompt-log-file is required when prompt logging is enabled");
            }
        }
        return problems;
    }

    public void assertValid() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        boolean hasKeys = gatewayConfig.getKeys().values().stream().anyMatch(keys -> !keys.isEmpty());
        if (!hasKeys) {
            logger.warn("没有配置任何上游 key，代理请求将全部失败");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
