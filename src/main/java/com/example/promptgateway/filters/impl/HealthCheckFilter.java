package com.example.promptgateway.filters.impl;

import com.example.promptgateway.filters.Filter;
import com.example.promptgateway.filters.FilterOutcome;
import com.example.promptgateway.filters.models.FullContext;
import com.example.promptgateway.netty.Responses;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.springframework.stereotype.Component;

@Component
public class HealthCheckFilter implements Filter {
    public static final String HEALTH_PATH = "/health";

    @Override
    public FilterOutcome filter(FullContext context) {
        if (HttpMethod.GET.equals(context.getRequest().method()) && HEALTH_PATH.equals(context.getPath())) {
            return FilterOutcome.shortCircuit(Responses.empty(HttpResponseStatus.OK));
        }
        return FilterOutcome.proceed();
    }
}
