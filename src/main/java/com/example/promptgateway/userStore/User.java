package com.example.promptgateway.userStore;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class User {
    private String token;
    private long createdAt;
    private long lastUsedAt;
    private boolean disabled;
}
