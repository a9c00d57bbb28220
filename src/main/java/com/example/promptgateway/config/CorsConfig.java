package com.example.promptgateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "cors")
@Data
public class CorsConfig {
    private boolean enabled = true;
    private String allowOrigin = "*";
    private String allowMethods = "GET,HEAD,PUT,PATCH,POST,DELETE";
    private String allowHeaders = "Content-Type, Authorization, X-Api-Key";
    private long maxAgeSeconds = 3600;
}
