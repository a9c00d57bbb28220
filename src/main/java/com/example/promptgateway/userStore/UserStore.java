package com.example.promptgateway.userStore;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Per-user tokens, needed only when the gatekeeper is {@code USER_TOKEN}.
 */
public interface UserStore {
    CompletableFuture<Void> init();

    boolean isInitialized();

    Optional<User> getUser(String token);

    List<User> getUsers();

    User createUser();
}
