package com.example.promptgateway.filters.impl;

import com.example.promptgateway.config.LogConfig;
import com.example.promptgateway.filters.Filter;
import com.example.promptgateway.filters.FilterOutcome;
import com.example.promptgateway.filters.models.FullContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Decides whether the request gets an access log line. The line itself is written by
 * {@link com.example.promptgateway.logging.AccessLogger} once the response goes out, whichever stage produced it.
 */
@Component
public class LoggingFilter implements Filter {
    private static final Logger logger = LoggerFactory.getLogger(LoggingFilter.class);

    private final Set<String> quietPaths;

    @Autowired
    public LoggingFilter(LogConfig logConfig) {
        this.quietPaths = Set.copyOf(logConfig.getQuietPaths());
    }

    @Override
    public FilterOutcome filter(FullContext context) {
        boolean autoLogging = !quietPaths.contains(context.getPath());
        context.setAutoLogging(autoLogging);
        if (autoLogging && logger.isDebugEnabled()) {
            logger.debug("接收到请求 {} {}", context.getRequest().method(), context.getPath());
        }
        return FilterOutcome.proceed();
    }
}
