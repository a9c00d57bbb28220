package com.example.promptgateway.netty.handler;

import cn.hutool.core.exceptions.ExceptionUtil;
import cn.hutool.json.JSONUtil;
import com.example.promptgateway.exception.GatewayException;
import com.example.promptgateway.filters.models.FullContext;
import com.example.promptgateway.logging.LogRedactor;
import com.example.promptgateway.netty.Responses;
import io.netty.handler.codec.TooLongFrameException;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Last stop of a request that no stage answered: maps failures to JSON error responses and answers unmatched
 * requests with 404.
 */
@Component
public class ErrorHandler {
    private static final Logger logger = LoggerFactory.getLogger(ErrorHandler.class);
    static final String PROXY_NOTE = "Reverse proxy encountered an internal server error.";

    private final LogRedactor logRedactor;

    @Autowired
    public ErrorHandler(LogRedactor logRedactor) {
        this.logRedactor = logRedactor;
    }

    public FullHttpResponse handleError(FullContext context, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof TooLongFrameException) {
            cause = new GatewayException(HttpResponseStatus.REQUEST_ENTITY_TOO_LARGE, "request entity too large", cause);
        }
        if (cause instanceof GatewayException) {
            GatewayException gatewayException = (GatewayException) cause;
            logger.info("请求失败 status={} message={}", gatewayException.getStatus().code(), cause.getMessage());
            return Responses.error(gatewayException.getStatus(), cause.getMessage());
        }

        // 请求体中的提示词在这里同样会被脱敏
        if (context != null) {
            logger.error("请求处理出现内部错误 req={}", JSONUtil.toJsonStr(logRedactor.requestWithBody(context)), cause);
        } else {
            logger.error("请求处理出现内部错误", cause);
        }
        Map<String, Object> error500 = new LinkedHashMap<>();
        error500.put("type", "proxy_error");
        error500.put("message", cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName());
        error500.put("stack", ExceptionUtil.stacktraceToString(cause));
        error500.put("proxy_note", PROXY_NOTE);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error500);
        return Responses.json(HttpResponseStatus.INTERNAL_SERVER_ERROR, body);
    }

    public FullHttpResponse notFound() {
        return Responses.error(HttpResponseStatus.NOT_FOUND, "Not found");
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
