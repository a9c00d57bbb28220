package com.example.promptgateway.userStore;

import cn.hutool.core.util.IdUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryUserStore implements UserStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryUserStore.class);

    private final ConcurrentHashMap<String, User> users = new ConcurrentHashMap<>();
    private volatile boolean initialized;

    @Override
    public CompletableFuture<Void> init() {
        return CompletableFuture.runAsync(() -> {
            initialized = true;
            logger.info("用户 token 存储初始化完成 users={}", users.size());
        });
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    @Override
    public Optional<User> getUser(String token) {
        checkInitialized();
        User user = token == null ? null : users.get(token);
        if (user == null || user.isDisabled()) {
            return Optional.empty();
        }
        user.setLastUsedAt(System.currentTimeMillis());
        return Optional.of(user);
    }

    @Override
    public List<User> getUsers() {
        checkInitialized();
        List<User> list = new ArrayList<>(users.values());
        list.sort(Comparator.comparingLong(User::getCreatedAt));
        return list;
    }

    @Override
    public User createUser() {
        checkInitialized();
        long now = System.currentTimeMillis();
        User user = new User(IdUtil.fastSimpleUUID(), now, 0L, false);
        users.put(user.getToken(), user);
        logger.info("创建用户 token 当前用户数 {}", users.size());
        return user;
    }

    private void checkInitialized() {
        if (!initialized) {
            throw new IllegalStateException("User store is not initialized");
        }
    }
}
