package com.example.promptgateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "build-info")
@Data
public class BuildInfoConfig {
    // git 探测命令的超时时间，超时按探测失败处理
    private Duration probeTimeout = Duration.ofSeconds(30);
    private String safeDirectory = "/app";
    // 部署描述文件的改动不算作本地修改
    private String deploymentDescriptor = "Dockerfile";
    private String workingDirectory = ".";
}
