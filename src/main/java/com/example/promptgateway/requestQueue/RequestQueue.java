package com.example.promptgateway.requestQueue;

import com.example.promptgateway.filters.models.RequestContext;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

public interface RequestQueue {
    void start();

    void stop();

    boolean isRunning();

    /**
     * Runs the task once the request reaches the head of the queue.
     */
    <T> CompletableFuture<T> enqueue(RequestContext context, Supplier<T> task);

    int size();
}
