package com.example.promptgateway.filters.models;

import lombok.Getter;
import lombok.Setter;

/**
 * Per-request bookkeeping read by the queueing and retry logic.
 */
@Getter
public class RequestContext {
    // 请求到达时间
    private final long arrivalTimestamp;
    private final String clientIp;
    // 只由下游排队逻辑修改
    @Setter
    private volatile int retryCount;

    public RequestContext(long arrivalTimestamp, String clientIp) {
        this.arrivalTimestamp = arrivalTimestamp;
        this.clientIp = clientIp;
        this.retryCount = 0;
    }
}
