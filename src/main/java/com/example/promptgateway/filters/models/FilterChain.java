package com.example.promptgateway.filters.models;

import com.example.promptgateway.filters.Filter;
import com.example.promptgateway.filters.FilterOutcome;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered filter stages. Runs them one after another for a request and stops at the first stage that does not
 * continue. Holds no per-request state, so one chain is shared by every channel.
 */
public class FilterChain {
    @Getter
    private final List<Filter> filters;

    public FilterChain(List<Filter> filters) {
        this.filters = Collections.unmodifiableList(new ArrayList<>(filters));
    }

    public FilterOutcome doFilter(FullContext context) {
        for (Filter filter : filters) {
            FilterOutcome outcome;
            try {
                outcome = filter.filter(context);
            } catch (RuntimeException e) {
                outcome = FilterOutcome.fail(e);
            }
            if (!outcome.isContinue()) {
                return outcome;
            }
        }
        return FilterOutcome.proceed();
    }
}
