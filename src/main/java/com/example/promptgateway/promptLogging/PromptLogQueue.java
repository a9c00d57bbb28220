package com.example.promptgateway.promptLogging;

public interface PromptLogQueue {
    void start();

    void stop();

    boolean isRunning();
}
