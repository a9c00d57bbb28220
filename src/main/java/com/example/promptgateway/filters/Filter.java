package com.example.promptgateway.filters;

import com.example.promptgateway.filters.models.FullContext;

public interface Filter {
    FilterOutcome filter(FullContext context);
}
