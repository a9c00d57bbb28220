package com.example.promptgateway.startup;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide safety net installed once the listener is bound. Uncaught thread exceptions, failures of
 * background tasks and exceptions that reach the end of a channel pipeline are turned into {@link UnhandledFault}
 * events; a single supervisor thread logs them. The process keeps running and no request is replayed.
 */
@Component
public class CrashContainment {
    private static final Logger logger = LoggerFactory.getLogger(CrashContainment.class);

    private final BlockingQueue<UnhandledFault> faults = new LinkedBlockingQueue<>();
    private final AtomicBoolean installed = new AtomicBoolean(false);
    private volatile Thread supervisor;
    private volatile Thread.UncaughtExceptionHandler previousHandler;

    public void install() {
        if (!installed.compareAndSet(false, true)) {
            return;
        }
        previousHandler = Thread.getDefaultUncaughtExceptionHandler();
        Thread.setDefaultUncaughtExceptionHandler((thread, error) ->
                report(new UnhandledFault(UnhandledFault.Kind.UNCAUGHT_EXCEPTION, thread.getName(), error)));
        Thread thread = new Thread(this::supervise, "fault-supervisor");
        thread.setDaemon(true);
        thread.start();
        supervisor = thread;
        logger.info("已安装进程级异常兜底处理");
    }

    public boolean isInstalled() {
        return installed.get();
    }

    public void reportUnhandled(String source, Throwable error) {
        report(new UnhandledFault(UnhandledFault.Kind.UNHANDLED_ASYNC_FAILURE, source, error));
    }

    /**
     * Wraps a background task so that a failure is reported instead of silently cancelling the task's schedule.
     */
    public Runnable guard(String source, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Throwable t) {
                reportUnhandled(source, t);
            }
        };
    }

    private void report(UnhandledFault fault) {
        // 安装之前没有 supervisor，直接记录
        if (!installed.get() || !faults.offer(fault)) {
            log(fault);
        }
    }

    private void supervise() {
        while (!Thread.currentThread().isInterrupted()) {
            try {
                log(faults.take());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                logger.error("记录异常事件失败", e);
            }
        }
    }

    private void log(UnhandledFault fault) {
        switch (fault.getKind()) {
            case UNCAUGHT_EXCEPTION -> logger.error("UNCAUGHT EXCEPTION. Please report this error trace. source={}",
                    fault.getSource(), fault.getError());
            case UNHANDLED_ASYNC_FAILURE -> logger.error(
                    "UNHANDLED ASYNC FAILURE. Please report this error trace. source={}",
                    fault.getSource(), fault.getError());
        }
    }

    @PreDestroy
    public void uninstall() {
        if (!installed.compareAndSet(true, false)) {
            return;
        }
        Thread.setDefaultUncaughtExceptionHandler(previousHandler);
        Thread thread = supervisor;
        if (thread != null) {
            thread.interrupt();
        }
        UnhandledFault pending;
        while ((pending = faults.poll()) != null) {
            log(pending);
        }
    }
}
