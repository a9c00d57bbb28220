package com.example.promptgateway.keyPool;

import com.example.promptgateway.config.GatewayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Key pool loaded from {@code gateway.keys}.
 */
@Component
public class ConfiguredKeyPool implements KeyPool {
    private static final Logger logger = LoggerFactory.getLogger(ConfiguredKeyPool.class);

    private final GatewayConfig gatewayConfig;
    private final ConcurrentHashMap<String, List<ProviderKey>> keys = new ConcurrentHashMap<>();
    private volatile boolean initialized;

    @Autowired
    public ConfiguredKeyPool(GatewayConfig gatewayConfig) {
        this.gatewayConfig = gatewayConfig;
    }

    @Override
    public synchronized void init() {
        if (initialized) {
            return;
        }
        gatewayConfig.getKeys().forEach((provider, values) -> {
            String name = provider.toLowerCase(Locale.ROOT);
            List<ProviderKey> providerKeys = values.stream()
                    .filter(value -> value != null && !value.isBlank())
                    .distinct()
                    .map(value -> new ProviderKey(name, value.trim()))
                    .collect(Collectors.toList());
            keys.put(name, Collections.unmodifiableList(providerKeys));
            logger.info("加载 {} 的 key {} 个 {}", name, providerKeys.size(), providerKeys);
        });
        initialized = true;
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    @Override
    public int available(String provider) {
        List<ProviderKey> providerKeys = keys.get(provider.toLowerCase(Locale.ROOT));
        if (providerKeys == null) {
            return 0;
        }
        return providerKeys.size();
    }

    @Override
    public Map<String, Integer> summary() {
        Map<String, Integer> summary = new TreeMap<>();
        keys.keySet().forEach(provider -> summary.put(provider, available(provider)));
        return summary;
    }
}
