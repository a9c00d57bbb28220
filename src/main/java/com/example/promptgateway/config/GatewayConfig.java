package com.example.promptgateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "gateway")
@Data
public class GatewayConfig {
    private Gatekeeper gatekeeper = Gatekeeper.NONE;
    private String proxyKey;
    private String adminKey;
    private QueueMode queueMode = QueueMode.FAIR;
    private boolean promptLogging = false;
    private Duration promptLogFlushInterval = Duration.ofSeconds(10);
    private String promptLogFile = "prompt-log.jsonl";
    // provider -> api keys
    private Map<String, List<String>> keys = new LinkedHashMap<>();
    private List<String> blockedOrigins = new ArrayList<>();
    private String blockMessage = "You must be over the age of majority in your country to use this service.";
}
