package com.example.promptgateway.startup;

import com.example.promptgateway.config.BuildInfoConfig;
import com.example.promptgateway.config.Gatekeeper;
import com.example.promptgateway.config.GatewayConfig;
import com.example.promptgateway.config.NettyConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigValidatorTest {
    private NettyConfig nettyConfig;
    private GatewayConfig gatewayConfig;
    private BuildInfoConfig buildInfoConfig;
    private ConfigValidator validator;

    @BeforeEach
    void setUp() {
        nettyConfig = new NettyConfig();
        gatewayConfig = new GatewayConfig();
        buildInfoConfig = new BuildInfoConfig();
        validator = new ConfigValidator(nettyConfig, gatewayConfig, buildInfoConfig);
    }

    @Test
    void defaultsAreValid() {
        assertThat(validator.validate()).isEmpty();
        validator.assertValid();
    }

    @Test
    void portOutOfRange() {
        nettyConfig.setPort(70000);

        assertThat(validator.validate()).singleElement().asString().contains("netty.port");
    }

    @Test
    void proxyKeyGatekeeperNeedsAKey() {
        gatewayConfig.setGatekeeper(Gatekeeper.PROXY_KEY);

        assertThatThrownBy(() -> validator.assertValid())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("gateway.proxy-key");

        gatewayConfig.setProxyKey("secret");
        assertThat(validator.validate()).isEmpty();
    }

    @Test
    void userTokenGatekeeperNeedsAnAdminKey() {
        gatewayConfig.setGatekeeper(Gatekeeper.USER_TOKEN);
        gatewayConfig.setAdminKey(" ");

        assertThat(validator.validate()).singleElement().asString().contains("gateway.admin-key");
    }

    @Test
    void promptLoggingNeedsAPositiveFlushInterval() {
        gatewayConfig.setPromptLogging(true);
        gatewayConfig.setPromptLogFlushInterval(Duration.ZERO);

        assertThat(validator.validate()).singleElement().asString().contains("prompt-log-flush-interval");
    }

    @Test
    void nonPositiveLimitsAreRejected() {
        nettyConfig.setMaxContentLength(0);
        buildInfoConfig.setProbeTimeout(Duration.ofSeconds(-1));

        assertThat(validator.validate()).hasSize(2);
    }
}
