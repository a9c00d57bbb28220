package com.example.promptgateway.filters.impl;

import cn.hutool.json.JSONObject;
import cn.hutool.json.JSONUtil;
import com.example.promptgateway.config.GatewayConfig;
import com.example.promptgateway.filters.FilterOutcome;
import com.example.promptgateway.filters.models.FullContext;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.util.CharsetUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OriginCheckFilterTest {
    private GatewayConfig gatewayConfig;
    private OriginCheckFilter filter;

    @BeforeEach
    void setUp() {
        gatewayConfig = new GatewayConfig();
        gatewayConfig.setBlockedOrigins(List.of("blocked.example"));
        gatewayConfig.setBlockMessage("Go away");
        filter = new OriginCheckFilter(gatewayConfig);
    }

    private FullContext request(String header, String value) {
        FullHttpRequest request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/proxy/x");
        if (header != null) {
            request.headers().set(header, value);
        }
        return new FullContext(request, null);
    }

    @Test
    void blockedOriginIsRejected() {
        FilterOutcome outcome = filter.filter(request(HttpHeaderNames.ORIGIN.toString(), "https://www.blocked.example"));

        assertThat(outcome.getType()).isEqualTo(FilterOutcome.Type.SHORT_CIRCUIT);
        assertThat(outcome.getResponse().status()).isEqualTo(HttpResponseStatus.FORBIDDEN);
        JSONObject error = JSONUtil.parseObj(outcome.getResponse().content().toString(CharsetUtil.UTF_8))
                .getJSONObject("error");
        assertThat(error.getStr("type")).isEqualTo("blocked_origin");
        assertThat(error.getStr("message")).isEqualTo("Go away");
    }

    @Test
    void blockedRefererIsRejected() {
        FilterOutcome outcome = filter.filter(request(HttpHeaderNames.REFERER.toString(),
                "https://blocked.example/chat"));

        assertThat(outcome.getResponse().status()).isEqualTo(HttpResponseStatus.FORBIDDEN);
    }

    @Test
    void otherOriginsPass() {
        assertThat(filter.filter(request(HttpHeaderNames.ORIGIN.toString(), "https://fine.example")).isContinue())
                .isTrue();
        assertThat(filter.filter(request(null, null)).isContinue()).isTrue();
    }
}
