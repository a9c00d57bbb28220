package com.example.promptgateway.startup;

import lombok.Getter;

@Getter
public class StartupException extends RuntimeException {
    // 失败时正在尝试进入的阶段
    private final StartupState failedStep;

    public StartupException(StartupState failedStep, String message, Throwable cause) {
        super(message, cause);
        this.failedStep = failedStep;
    }
}
