package com.example.promptgateway.startup;

import com.example.promptgateway.buildInfo.BuildInfoHolder;
import com.example.promptgateway.buildInfo.BuildInfoResolver;
import com.example.promptgateway.config.Gatekeeper;
import com.example.promptgateway.config.GatewayConfig;
import com.example.promptgateway.config.QueueMode;
import com.example.promptgateway.keyPool.KeyPool;
import com.example.promptgateway.netty.GatewayServer;
import com.example.promptgateway.promptLogging.PromptLogQueue;
import com.example.promptgateway.requestQueue.RequestQueue;
import com.example.promptgateway.userStore.UserStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * Brings the gateway up one step at a time: build info, config validation, key pool, then the optional user
 * store, prompt log and request queue, and finally the listener. Each step completes before the next starts; a
 * failing step ends in {@link StartupState#FAILED_STARTUP} without the listener ever being bound.
 */
@Component
public class StartupOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(StartupOrchestrator.class);

    private final BuildInfoResolver buildInfoResolver;
    private final BuildInfoHolder buildInfoHolder;
    private final ConfigValidator configValidator;
    private final KeyPool keyPool;
    private final UserStore userStore;
    private final PromptLogQueue promptLogQueue;
    private final RequestQueue requestQueue;
    private final GatewayServer gatewayServer;
    private final CrashContainment crashContainment;
    private final GatewayConfig gatewayConfig;
    private final Environment environment;

    private final List<StartupState> milestones = Collections.synchronizedList(new ArrayList<>());
    private volatile StartupState state = StartupState.INIT;

    @Autowired
    public StartupOrchestrator(BuildInfoResolver buildInfoResolver, BuildInfoHolder buildInfoHolder,
                               ConfigValidator configValidator, KeyPool keyPool, UserStore userStore,
                               PromptLogQueue promptLogQueue, RequestQueue requestQueue, GatewayServer gatewayServer,
                               CrashContainment crashContainment, GatewayConfig gatewayConfig,
                               Environment environment) {
        this.buildInfoResolver = buildInfoResolver;
        this.buildInfoHolder = buildInfoHolder;
        this.configValidator = configValidator;
        this.keyPool = keyPool;
        this.userStore = userStore;
        this.promptLogQueue = promptLogQueue;
        this.requestQueue = requestQueue;
        this.gatewayServer = gatewayServer;
        this.crashContainment = crashContainment;
        this.gatewayConfig = gatewayConfig;
        this.environment = environment;
    }

    public synchronized StartupState start() {
        if (state != StartupState.INIT) {
            throw new IllegalStateException("Startup already ran, current state " + state);
        }
        logger.info("Server starting up...");
        buildInfoHolder.publish(buildInfoResolver.resolve());
        advance(StartupState.BUILD_INFO_RESOLVED);

        logger.info("Checking configs and external dependencies...");
        try {
            configValidator.assertValid();
        } catch (RuntimeException e) {
            throw fail(StartupState.CONFIG_VALIDATED, e);
        }
        advance(StartupState.CONFIG_VALIDATED);

        try {
            keyPool.init();
        } catch (RuntimeException e) {
            throw fail(StartupState.KEY_POOL_READY, e);
        }
        advance(StartupState.KEY_POOL_READY);

        if (gatewayConfig.getGatekeeper() == Gatekeeper.USER_TOKEN) {
            try {
                userStore.init().join();
            } catch (CompletionException e) {
                throw fail(StartupState.AUTH_STORE_READY, e.getCause() != null ? e.getCause() : e);
            } catch (RuntimeException e) {
                throw fail(StartupState.AUTH_STORE_READY, e);
            }
            advance(StartupState.AUTH_STORE_READY);
        }

        if (gatewayConfig.isPromptLogging()) {
            logger.info("Starting prompt logging...");
            try {
                promptLogQueue.start();
            } catch (RuntimeException e) {
                throw fail(StartupState.PROMPT_LOG_RUNNING, e);
            }
            advance(StartupState.PROMPT_LOG_RUNNING);
        }

        if (gatewayConfig.getQueueMode() != QueueMode.NONE) {
            logger.info("Starting request queue...");
            try {
                requestQueue.start();
            } catch (RuntimeException e) {
                throw fail(StartupState.QUEUE_RUNNING, e);
            }
            advance(StartupState.QUEUE_RUNNING);
        }

        try {
            gatewayServer.bind();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw fail(StartupState.LISTENING, e);
        } catch (Exception e) {
            throw fail(StartupState.LISTENING, e);
        }
        advance(StartupState.LISTENING);
        crashContainment.install();

        logger.info("Startup complete. build={} java={} profiles={}", buildInfoHolder.get(),
                System.getProperty("java.version"), Arrays.toString(environment.getActiveProfiles()));
        return state;
    }

    public StartupState getState() {
        return state;
    }

    public List<StartupState> getMilestones() {
        synchronized (milestones) {
            return List.copyOf(milestones);
        }
    }

    private void advance(StartupState next) {
        state = next;
        milestones.add(next);
        logger.debug("启动阶段完成 {}", next);
    }

    private StartupException fail(StartupState step, Throwable cause) {
        state = StartupState.FAILED_STARTUP;
        milestones.add(StartupState.FAILED_STARTUP);
        // 已启动的后台任务随失败一起停止
        if (promptLogQueue.isRunning()) {
            promptLogQueue.stop();
        }
        if (requestQueue.isRunning()) {
            requestQueue.stop();
        }
        logger.error("启动失败，未能进入阶段 {}", step, cause);
        return new StartupException(step, "Startup failed before reaching " + step + ": " + cause.getMessage(), cause);
    }
}
