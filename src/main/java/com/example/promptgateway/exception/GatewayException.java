package com.example.promptgateway.exception;

import io.netty.handler.codec.http.HttpResponseStatus;
import lombok.Getter;

/**
 * Request failure that carries its own HTTP status. Answered as {@code {"error": message}} and not logged as an
 * internal error.
 */
@Getter
public class GatewayException extends RuntimeException {
    private final HttpResponseStatus status;

    public GatewayException(HttpResponseStatus status, String message) {
        super(message);
        this.status = status;
    }

    public GatewayException(HttpResponseStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
