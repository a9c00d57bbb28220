package com.example.promptgateway.promptLogging;

import cn.hutool.core.io.FileUtil;
import cn.hutool.json.JSONUtil;
import com.example.promptgateway.config.GatewayConfig;
import com.example.promptgateway.startup.CrashContainment;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Buffers prompt log entries and appends them as JSON lines to the prompt log file on a fixed interval.
 */
@Component
public class BatchingPromptLogQueue implements PromptLogQueue {
    private static final Logger logger = LoggerFactory.getLogger(BatchingPromptLogQueue.class);
    static final int MAX_BATCH_SIZE = 25;

    private final GatewayConfig gatewayConfig;
    private final CrashContainment crashContainment;
    private final ConcurrentLinkedQueue<PromptLogEntry> queue = new ConcurrentLinkedQueue<>();
    private volatile ScheduledExecutorService scheduler;

    @Autowired
    public BatchingPromptLogQueue(GatewayConfig gatewayConfig, CrashContainment crashContainment) {
        this.gatewayConfig = gatewayConfig;
        this.crashContainment = crashContainment;
    }

    @Override
    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        long intervalMs = gatewayConfig.getPromptLogFlushInterval().toMillis();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "prompt-log-flusher");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(crashContainment.guard("prompt-log-flusher", this::flush),
                intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        logger.info("提示词日志队列已启动 file={} interval={}ms", gatewayConfig.getPromptLogFile(), intervalMs);
    }

    @Override
    public boolean isRunning() {
        return scheduler != null;
    }

    // 上游转发接入后由其写入
    void enqueue(PromptLogEntry entry) {
        if (!isRunning()) {
            return;
        }
        queue.add(entry);
    }

    /**
     * Writes at most one batch.
     *
     * @return number of entries written
     */
    int flush() {
        List<String> lines = new ArrayList<>();
        PromptLogEntry entry;
        while (lines.size() < MAX_BATCH_SIZE && (entry = queue.poll()) != null) {
            lines.add(JSONUtil.toJsonStr(entry));
        }
        if (lines.isEmpty()) {
            return 0;
        }
        FileUtil.appendUtf8Lines(lines, new File(gatewayConfig.getPromptLogFile()));
        logger.info("已写入提示词日志 {} 条 剩余 {} 条", lines.size(), queue.size());
        return lines.size();
    }

    @Override
    @PreDestroy
    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        scheduler = null;
        // 关闭前写完剩余日志
        int written;
        do {
            written = flush();
        } while (written > 0);
    }
}
