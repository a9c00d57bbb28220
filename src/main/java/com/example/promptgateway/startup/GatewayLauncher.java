package com.example.promptgateway.startup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Runs the startup sequence once the Spring context is ready. A failed startup exits the process with status 1.
 */
@Component
public class GatewayLauncher implements ApplicationRunner {
    private static final Logger logger = LoggerFactory.getLogger(GatewayLauncher.class);

    private final StartupOrchestrator startupOrchestrator;
    private final ApplicationContext applicationContext;

    @Autowired
    public GatewayLauncher(StartupOrchestrator startupOrchestrator, ApplicationContext applicationContext) {
        this.startupOrchestrator = startupOrchestrator;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            startupOrchestrator.start();
        } catch (StartupException e) {
            logger.error("网关启动失败 step={} 进程退出", e.getFailedStep(), e);
            System.exit(SpringApplication.exit(applicationContext, () -> 1));
        }
    }
}
