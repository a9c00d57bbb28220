package com.example.promptgateway.startup;

/**
 * Startup milestones in the order they are reached. {@link #AUTH_STORE_READY}, {@link #PROMPT_LOG_RUNNING} and
 * {@link #QUEUE_RUNNING} are skipped when their feature is off.
 */
public enum StartupState {
    INIT,
    BUILD_INFO_RESOLVED,
    CONFIG_VALIDATED,
    KEY_POOL_READY,
    AUTH_STORE_READY,
    PROMPT_LOG_RUNNING,
    QUEUE_RUNNING,
    LISTENING,
    FAILED_STARTUP
}
