package com.example.promptgateway.filters.impl;

import com.example.promptgateway.config.NettyConfig;
import com.example.promptgateway.exception.GatewayException;
import com.example.promptgateway.filters.Filter;
import com.example.promptgateway.filters.FilterOutcome;
import com.example.promptgateway.filters.models.FullContext;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufInputStream;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.util.CharsetUtil;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;

/**
 * Parses JSON and url-encoded bodies up to the configured ceiling.
 */
@Component
public class BodyParsingFilter implements Filter {
    private final NettyConfig nettyConfig;
    private final ObjectMapper objectMapper;

    @Autowired
    public BodyParsingFilter(NettyConfig nettyConfig, ObjectMapper objectMapper) {
        this.nettyConfig = nettyConfig;
        this.objectMapper = objectMapper;
    }

    @Override
    public FilterOutcome filter(FullContext context) {
        ByteBuf content = context.getRequest().content();
        if (content.readableBytes() > nettyConfig.getMaxContentLength()) {
            return FilterOutcome.fail(new GatewayException(HttpResponseStatus.REQUEST_ENTITY_TOO_LARGE,
                    "request entity too large"));
        }
        if (!content.isReadable()) {
            return FilterOutcome.proceed();
        }
        String contentType = context.getRequest().headers().get(HttpHeaderNames.CONTENT_TYPE);
        if (contentType == null) {
            return FilterOutcome.proceed();
        }
        String mimeType = contentType.split(";")[0].trim().toLowerCase(Locale.ROOT);
        if (HttpHeaderValues.APPLICATION_JSON.contentEqualsIgnoreCase(mimeType)) {
            try (InputStream in = new ByteBufInputStream(content.duplicate())) {
                context.setJsonBody(objectMapper.readTree(in));
            } catch (JsonProcessingException e) {
                // 解析器的原始信息会引用请求体内容，只返回出错位置
                return FilterOutcome.fail(new GatewayException(HttpResponseStatus.BAD_REQUEST,
                        malformedJsonMessage(e), e));
            } catch (IOException e) {
                return FilterOutcome.fail(e);
            }
        } else if (HttpHeaderValues.APPLICATION_X_WWW_FORM_URLENCODED.contentEqualsIgnoreCase(mimeType)) {
            String form = content.toString(CharsetUtil.UTF_8);
            context.setFormBody(new QueryStringDecoder(form, CharsetUtil.UTF_8, false).parameters());
        }
        return FilterOutcome.proceed();
    }

    static String malformedJsonMessage(JsonProcessingException e) {
        JsonLocation location = e.getLocation();
        if (location == null) {
            return "Malformed JSON body";
        }
        return "Malformed JSON body at line " + location.getLineNr() + ", column " + location.getColumnNr();
    }
}
