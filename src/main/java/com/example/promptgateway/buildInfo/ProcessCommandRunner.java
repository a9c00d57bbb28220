package com.example.promptgateway.buildInfo;

import com.example.promptgateway.config.BuildInfoConfig;
import jakarta.annotation.PreDestroy;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs external commands in the configured working directory. A command that outlives its timeout is killed.
 */
@Component
public class ProcessCommandRunner implements CommandRunner {
    private final File workingDirectory;
    // 读取子进程输出会阻塞，不能占用公共 ForkJoinPool
    private final ExecutorService outputReaders = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "command-output");
        thread.setDaemon(true);
        return thread;
    });

    @Autowired
    public ProcessCommandRunner(BuildInfoConfig buildInfoConfig) {
        this.workingDirectory = new File(buildInfoConfig.getWorkingDirectory());
    }

    @Override
    public String run(List<String> command, Duration timeout) throws CommandFailedException {
        Process process;
        try {
            process = new ProcessBuilder(command).directory(workingDirectory).start();
        } catch (IOException e) {
            throw new CommandFailedException(command, "failed to start", null, null, e);
        }
        // 同时读取 stdout 和 stderr，避免管道写满导致子进程阻塞
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()),
                outputReaders);
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()),
                outputReaders);
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new CommandFailedException(command, "timed out after " + timeout, null, null);
            }
            String out = stdout.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            String err = stderr.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (process.exitValue() != 0) {
                throw new CommandFailedException(command, "exit code " + process.exitValue(), out, err);
            }
            return out;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new CommandFailedException(command, "interrupted", null, null, e);
        } catch (ExecutionException | TimeoutException e) {
            process.destroyForcibly();
            throw new CommandFailedException(command, "failed to read output", null, null, e);
        }
    }

    @PreDestroy
    public void shutdown() {
        outputReaders.shutdownNow();
    }

    private static String drain(InputStream in) {
        try (InputStream input = in) {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            input.transferTo(out);
            return out.toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
