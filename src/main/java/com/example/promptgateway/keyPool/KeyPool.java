package com.example.promptgateway.keyPool;

import java.util.Map;

public interface KeyPool {
    void init();

    boolean isInitialized();

    int available(String provider);

    // provider -> 可用 key 数量
    Map<String, Integer> summary();
}
