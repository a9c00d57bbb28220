package com.example.promptgateway.config;

/**
 * Access-control mode applied to proxy routes.
 */
public enum Gatekeeper {
    NONE,
    PROXY_KEY,
    USER_TOKEN
}
