package com.example.promptgateway.requestQueue;

import com.example.promptgateway.exception.GatewayException;
import com.example.promptgateway.filters.models.RequestContext;
import com.example.promptgateway.startup.CrashContainment;
import io.netty.handler.codec.http.HttpResponseStatus;
import jakarta.annotation.PreDestroy;
import lombok.AllArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * FIFO queue drained by a single scheduler thread. A task rejected with 429 goes back to the tail with its
 * retry counter bumped; requests waiting longer than {@link #MAX_WAIT_MS} are dropped.
 */
@Component
public class ScheduledRequestQueue implements RequestQueue {
    private static final Logger logger = LoggerFactory.getLogger(ScheduledRequestQueue.class);
    static final long TICK_MS = 50;
    static final long MAX_WAIT_MS = 300_000; // 5分钟
    static final int MAX_RETRIES = 3;

    private final CrashContainment crashContainment;
    private final ConcurrentLinkedDeque<QueuedRequest<?>> queue = new ConcurrentLinkedDeque<>();
    private volatile ScheduledExecutorService scheduler;

    @AllArgsConstructor
    private static class QueuedRequest<T> {
        final RequestContext context;
        final Supplier<T> task;
        final CompletableFuture<T> future;

        void run() {
            future.complete(task.get());
        }
    }

    @Autowired
    public ScheduledRequestQueue(CrashContainment crashContainment) {
        this.crashContainment = crashContainment;
    }

    @Override
    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "request-queue");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(crashContainment.guard("request-queue", this::drain),
                TICK_MS, TICK_MS, TimeUnit.MILLISECONDS);
        scheduler.scheduleWithFixedDelay(crashContainment.guard("request-queue-cleaner", this::removeStale),
                5, 5, TimeUnit.SECONDS);
        logger.info("请求队列已启动");
    }

    @Override
    public boolean isRunning() {
        return scheduler != null;
    }

    @Override
    public <T> CompletableFuture<T> enqueue(RequestContext context, Supplier<T> task) {
        CompletableFuture<T> future = new CompletableFuture<>();
        queue.addLast(new QueuedRequest<>(context, task, future));
        return future;
    }

    @Override
    public int size() {
        return queue.size();
    }

    void drain() {
        QueuedRequest<?> request;
        while ((request = queue.pollFirst()) != null) {
            try {
                request.run();
            } catch (GatewayException e) {
                if (HttpResponseStatus.TOO_MANY_REQUESTS.equals(e.getStatus())
                        && request.context.getRetryCount() < MAX_RETRIES) {
                    request.context.setRetryCount(request.context.getRetryCount() + 1);
                    logger.info("请求被限流 重新排队 第{}次重试", request.context.getRetryCount());
                    queue.addLast(request);
                    // 本轮不再处理，等待下一个 tick
                    return;
                }
                request.future.completeExceptionally(e);
            } catch (RuntimeException e) {
                request.future.completeExceptionally(e);
            }
        }
    }

    void removeStale() {
        long now = System.currentTimeMillis();
        Iterator<QueuedRequest<?>> it = queue.iterator();
        while (it.hasNext()) {
            QueuedRequest<?> request = it.next();
            if (now - request.context.getArrivalTimestamp() > MAX_WAIT_MS) {
                it.remove();
                request.future.completeExceptionally(new GatewayException(HttpResponseStatus.GATEWAY_TIMEOUT,
                        "Request timed out in queue"));
            }
        }
    }

    @Override
    @PreDestroy
    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        scheduler = null;
        QueuedRequest<?> request;
        while ((request = queue.pollFirst()) != null) {
            request.future.completeExceptionally(new GatewayException(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    "Server is shutting down"));
        }
    }
}
