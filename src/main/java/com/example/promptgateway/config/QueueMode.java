package com.example.promptgateway.config;

public enum QueueMode {
    NONE,
    FAIR,
    ALWAYS
}
