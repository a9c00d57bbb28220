package com.example.promptgateway.startup;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class UnhandledFault {
    public enum Kind {
        // 线程中未捕获的异常
        UNCAUGHT_EXCEPTION,
        // 异步任务或 channel 中无人处理的失败
        UNHANDLED_ASYNC_FAILURE
    }

    private final Kind kind;
    private final String source;
    private final Throwable error;
}
