package com.example.promptgateway.filters.init;

import com.example.promptgateway.filters.Filter;
import com.example.promptgateway.filters.impl.BodyParsingFilter;
import com.example.promptgateway.filters.impl.CorsFilter;
import com.example.promptgateway.filters.impl.HealthCheckFilter;
import com.example.promptgateway.filters.impl.LoggingFilter;
import com.example.promptgateway.filters.impl.OriginCheckFilter;
import com.example.promptgateway.filters.impl.RequestContextFilter;
import com.example.promptgateway.filters.models.FilterChain;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Fixes the order of the filter stages. Cheapest rejections first; body parsing runs before the origin check.
 */
@Component
public class FiltersInit {
    private static final Logger logger = LoggerFactory.getLogger(FiltersInit.class);

    @Getter
    private final FilterChain filterChain;
    // 请求在聚合或解码阶段就被拒绝时，仍需建立上下文并记录访问日志
    @Getter
    private final FilterChain preludeChain;

    @Autowired
    public FiltersInit(RequestContextFilter requestContextFilter,
                       LoggingFilter loggingFilter,
                       HealthCheckFilter healthCheckFilter,
                       CorsFilter corsFilter,
                       BodyParsingFilter bodyParsingFilter,
                       OriginCheckFilter originCheckFilter) {
        List<Filter> filters = List.of(
                requestContextFilter,
                loggingFilter,
                healthCheckFilter,
                corsFilter,
                bodyParsingFilter,
                originCheckFilter);
        this.filterChain = new FilterChain(filters);
        this.preludeChain = new FilterChain(List.of(requestContextFilter, loggingFilter));
        logger.info("过滤器链初始化完成 {}", filters.stream()
                .map(filter -> filter.getClass().getSimpleName())
                .collect(Collectors.joining(" -> ")));
    }
}
