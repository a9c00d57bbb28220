package com.example.promptgateway.keyPool;

import cn.hutool.crypto.digest.DigestUtil;
import lombok.Getter;

/**
 * An upstream API key. Only the short hash is ever logged.
 */
@Getter
public class ProviderKey {
    private final String provider;
    private final String key;
    private final String hash;

    public ProviderKey(String provider, String key) {
        this.provider = provider;
        this.key = key;
        this.hash = provider + "-" + DigestUtil.sha256Hex(key).substring(0, 8);
    }

    @Override
    public String toString() {
        return hash;
    }
}
