package com.example.promptgateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "access-log")
@Data
public class LogConfig {
    // 高频低价值路径，不输出访问日志
    private List<String> quietPaths = new ArrayList<>(List.of("/health", "/proxy/kobold/api/v1/model"));
    private List<String> redactedHeaders = new ArrayList<>(List.of(
            "cookie",
            "set-cookie",
            "authorization",
            "x-api-key",
            "x-forwarded-for",
            "x-real-ip",
            "true-client-ip",
            "cf-connecting-ip"));
    // 请求体中的提示词字段，任何日志中都不能出现
    private List<String> redactedBodyFields = new ArrayList<>(List.of("prompt", "messages"));
    private String censor = "********";
}
