package com.example.promptgateway.logging;

import com.example.promptgateway.config.LogConfig;
import com.example.promptgateway.filters.models.FullContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaders;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds log-safe views of requests and responses. Credential headers, forwarded client addresses and prompt
 * fields of the body are replaced by the censor string before anything reaches a log line.
 */
@Component
public class LogRedactor {
    private final Set<String> redactedHeaders;
    private final List<String> redactedBodyFields;
    private final String censor;
    private final ObjectMapper objectMapper;

    @Autowired
    public LogRedactor(LogConfig logConfig, ObjectMapper objectMapper) {
        this.redactedHeaders = logConfig.getRedactedHeaders().stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.redactedBodyFields = List.copyOf(logConfig.getRedactedBodyFields());
        this.censor = logConfig.getCensor();
        this.objectMapper = objectMapper;
    }

    public Map<String, String> headers(HttpHeaders headers) {
        Map<String, String> safe = new LinkedHashMap<>();
        for (Map.Entry<String, String> header : headers) {
            String name = header.getKey().toLowerCase(Locale.ROOT);
            safe.merge(name, redactedHeaders.contains(name) ? censor : header.getValue(),
                    (first, second) -> redactedHeaders.contains(name) ? censor : first + ", " + second);
        }
        return safe;
    }

    /**
     * @return the parsed body as plain maps and lists with prompt fields censored, or {@code null} when the
     * request had no parsed body
     */
    public Object body(FullContext context) {
        JsonNode json = context.getJsonBody();
        if (json != null) {
            JsonNode copy = json.deepCopy();
            if (copy.isObject()) {
                ObjectNode object = (ObjectNode) copy;
                for (String field : redactedBodyFields) {
                    if (object.has(field)) {
                        object.put(field, censor);
                    }
                }
            }
            return objectMapper.convertValue(copy, Object.class);
        }
        Map<String, List<String>> form = context.getFormBody();
        if (form != null) {
            Map<String, Object> safe = new LinkedHashMap<>();
            form.forEach((key, values) -> safe.put(key,
                    redactedBodyFields.contains(key) ? censor : new ArrayList<>(values)));
            return safe;
        }
        return null;
    }

    /**
     * Request view used by the access log, without the body.
     */
    public Map<String, Object> request(FullContext context) {
        FullHttpRequest request = context.getRequest();
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("method", request.method().name());
        view.put("url", request.uri());
        view.put("headers", headers(request.headers()));
        if (context.getRemoteAddress() != null) {
            view.put("remoteAddress", context.getRemoteAddress().toString());
        }
        return view;
    }

    /**
     * Request view used when logging a failure; includes the censored body.
     */
    public Map<String, Object> requestWithBody(FullContext context) {
        Map<String, Object> view = request(context);
        Object body = body(context);
        if (body != null) {
            view.put("body", body);
        }
        return view;
    }
}
