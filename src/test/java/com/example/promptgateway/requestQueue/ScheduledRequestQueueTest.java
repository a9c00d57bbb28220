package com.example.promptgateway.requestQueue;

import com.example.promptgateway.exception.GatewayException;
import com.example.promptgateway.filters.models.RequestContext;
import com.example.promptgateway.startup.CrashContainment;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScheduledRequestQueueTest {
    private final ScheduledRequestQueue queue = new ScheduledRequestQueue(new CrashContainment());

    private static RequestContext fresh() {
        return new RequestContext(System.currentTimeMillis(), "127.0.0.1");
    }

    @Test
    void drainsInArrivalOrder() {
        List<Integer> order = new ArrayList<>();
        CompletableFuture<Integer> first = queue.enqueue(fresh(), () -> {
            order.add(1);
            return 1;
        });
        CompletableFuture<Integer> second = queue.enqueue(fresh(), () -> {
            order.add(2);
            return 2;
        });

        queue.drain();

        assertThat(order).containsExactly(1, 2);
        assertThat(first.join()).isEqualTo(1);
        assertThat(second.join()).isEqualTo(2);
        assertThat(queue.size()).isZero();
    }

    @Test
    void rateLimitedTaskIsRequeuedWithRetryCount() {
        RequestContext context = fresh();
        AtomicInteger attempts = new AtomicInteger();
        CompletableFuture<String> future = queue.enqueue(context, () -> {
            if (attempts.incrementAndGet() == 1) {
                throw new GatewayException(HttpResponseStatus.TOO_MANY_REQUESTS, "rate limited");
            }
            return "ok";
        });

        queue.drain();
        assertThat(future).isNotDone();
        assertThat(context.getRetryCount()).isEqualTo(1);
        assertThat(queue.size()).isEqualTo(1);

        queue.drain();
        assertThat(future.join()).isEqualTo("ok");
    }

    @Test
    void retriesAreBounded() {
        RequestContext context = fresh();
        CompletableFuture<String> future = queue.enqueue(context, () -> {
            throw new GatewayException(HttpResponseStatus.TOO_MANY_REQUESTS, "rate limited");
        });

        for (int i = 0; i <= ScheduledRequestQueue.MAX_RETRIES; i++) {
            queue.drain();
        }

        assertThat(context.getRetryCount()).isEqualTo(ScheduledRequestQueue.MAX_RETRIES);
        assertThatThrownBy(future::join).isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(GatewayException.class);
    }

    @Test
    void staleRequestsTimeOut() {
        RequestContext stale = new RequestContext(System.currentTimeMillis() - ScheduledRequestQueue.MAX_WAIT_MS - 1,
                "127.0.0.1");
        CompletableFuture<String> expired = queue.enqueue(stale, () -> "never");
        CompletableFuture<String> waiting = queue.enqueue(fresh(), () -> "later");

        queue.removeStale();

        assertThat(expired).isCompletedExceptionally();
        assertThatThrownBy(expired::join).hasCauseInstanceOf(GatewayException.class)
                .hasMessageContaining("Request timed out in queue");
        assertThat(waiting).isNotDone();
        assertThat(queue.size()).isEqualTo(1);
    }

    @Test
    void startsOnce() {
        queue.start();
        queue.start();
        try {
            assertThat(queue.isRunning()).isTrue();
        } finally {
            queue.stop();
        }
        assertThat(queue.isRunning()).isFalse();
    }
}
