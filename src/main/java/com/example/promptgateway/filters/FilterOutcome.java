package com.example.promptgateway.filters;

import io.netty.handler.codec.http.FullHttpResponse;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of one filter stage: continue to the next stage, answer the request directly, or fail it.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class FilterOutcome {
    public enum Type {
        CONTINUE,
        SHORT_CIRCUIT,
        FAIL
    }

    private static final FilterOutcome CONTINUE = new FilterOutcome(Type.CONTINUE, null, null);

    private final Type type;
    private final FullHttpResponse response;
    private final Throwable error;

    public static FilterOutcome proceed() {
        return CONTINUE;
    }

    public static FilterOutcome shortCircuit(FullHttpResponse response) {
        return new FilterOutcome(Type.SHORT_CIRCUIT, response, null);
    }

    public static FilterOutcome fail(Throwable error) {
        return new FilterOutcome(Type.FAIL, null, error);
    }

    public boolean isContinue() {
        return type == Type.CONTINUE;
    }
}
