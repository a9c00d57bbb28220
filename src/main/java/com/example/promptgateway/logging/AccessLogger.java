package com.example.promptgateway.logging;

import cn.hutool.json.JSONUtil;
import com.example.promptgateway.filters.models.FullContext;
import com.example.promptgateway.filters.models.RequestContext;
import io.netty.handler.codec.http.HttpResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One structured line per completed request, skipped for quiet paths.
 */
@Component
public class AccessLogger {
    private static final Logger logger = LoggerFactory.getLogger(AccessLogger.class);

    private final LogRedactor logRedactor;

    @Autowired
    public AccessLogger(LogRedactor logRedactor) {
        this.logRedactor = logRedactor;
    }

    public void logCompletion(FullContext context, HttpResponse response) {
        if (context == null || !context.isAutoLogging()) {
            return;
        }
        int status = response.status().code();
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("req", logRedactor.request(context));
        Map<String, Object> res = new LinkedHashMap<>();
        res.put("statusCode", status);
        res.put("headers", logRedactor.headers(response.headers()));
        record.put("res", res);
        RequestContext requestContext = context.getRequestContext();
        if (requestContext != null) {
            record.put("responseTime", System.currentTimeMillis() - requestContext.getArrivalTimestamp());
        }
        String line = JSONUtil.toJsonStr(record);
        if (status >= 500) {
            logger.error("request errored {}", line);
        } else if (status >= 400) {
            logger.warn("request completed {}", line);
        } else {
            logger.info("request completed {}", line);
        }
    }
}
