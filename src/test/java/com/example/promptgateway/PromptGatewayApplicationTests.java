package com.example.promptgateway;

import com.example.promptgateway.buildInfo.BuildInfoHolder;
import com.example.promptgateway.netty.GatewayServer;
import com.example.promptgateway.startup.StartupOrchestrator;
import com.example.promptgateway.startup.StartupState;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {"netty.port=0", "build-info.probe-timeout=5s"})
class PromptGatewayApplicationTests {
    @Autowired
    private GatewayServer gatewayServer;
    @Autowired
    private StartupOrchestrator startupOrchestrator;
    @Autowired
    private BuildInfoHolder buildInfoHolder;

    private final HttpClient client = HttpClient.newHttpClient();

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(
                URI.create("http://127.0.0.1:" + gatewayServer.boundPort() + path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void startsAndServes() throws Exception {
        assertThat(startupOrchestrator.getState()).isEqualTo(StartupState.LISTENING);
        assertThat(gatewayServer.isListening()).isTrue();
        assertThat(buildInfoHolder.isPublished()).isTrue();

        HttpResponse<String> health = get("/health");
        assertThat(health.statusCode()).isEqualTo(200);
        assertThat(health.body()).isEmpty();

        HttpResponse<String> missing = get("/nothing-here");
        assertThat(missing.statusCode()).isEqualTo(404);
        assertThat(missing.body()).isEqualTo("{\"error\":\"Not found\"}");

        HttpResponse<String> info = get("/");
        assertThat(info.statusCode()).isEqualTo(200);
        assertThat(info.body()).contains("\"build\"");
    }
}
