package com.example.promptgateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@ConfigurationProperties(prefix = "netty")
@Data
@Configuration
public class NettyConfig {
    public static final int DEFAULT_MAX_CONTENT_LENGTH = 10 * 1024 * 1024;

    private int port = 7860; // 监听端口
    private int maxContentLength = DEFAULT_MAX_CONTENT_LENGTH; // JSON 和表单请求体的上限（字节）
    // 是否信任 X-Forwarded-For 等转发头，部署在未知的反向代理之后时应关闭
    private boolean trustProxy = true;
    private int bossThreads = 2;
    private int workerThreads = 16;
    private int businessThreads = Runtime.getRuntime().availableProcessors() * 2;
}
