package com.example.promptgateway.netty.handler;

import com.example.promptgateway.filters.impl.CorsFilter;
import com.example.promptgateway.filters.models.FullContext;
import com.example.promptgateway.logging.AccessLogger;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Writes every response of the gateway: adds the CORS header, sets keep-alive and records the access log line.
 */
@Component
public class ResponseWriter {
    private static final Logger logger = LoggerFactory.getLogger(ResponseWriter.class);

    private final CorsFilter corsFilter;
    private final AccessLogger accessLogger;

    @Autowired
    public ResponseWriter(CorsFilter corsFilter, AccessLogger accessLogger) {
        this.corsFilter = corsFilter;
        this.accessLogger = accessLogger;
    }

    /**
     * @param context the request being answered, or {@code null} when the failure happened before a context
     *                existed; the connection is closed in that case
     */
    public void write(ChannelHandlerContext ctx, FullContext context, FullHttpResponse response) {
        write(ctx, context, response, context == null);
    }

    /**
     * Same as {@link #write(ChannelHandlerContext, FullContext, FullHttpResponse)} but closes the connection after
     * the response whatever the request asked for. Used when the rest of the request cannot be read.
     */
    public void writeAndClose(ChannelHandlerContext ctx, FullContext context, FullHttpResponse response) {
        write(ctx, context, response, true);
    }

    private void write(ChannelHandlerContext ctx, FullContext context, FullHttpResponse response, boolean close) {
        corsFilter.decorate(response);
        boolean keepAlive = !close && context != null && HttpUtil.isKeepAlive(context.getRequest());
        HttpUtil.setKeepAlive(response, keepAlive);
        if (!response.headers().contains(HttpHeaderNames.CONTENT_LENGTH)) {
            HttpUtil.setContentLength(response, response.content().readableBytes());
        }
        // 写出后 content 会被释放，先记录日志
        accessLogger.logCompletion(context, response);

        ChannelFuture future = ctx.writeAndFlush(response);
        future.addListener(f -> {
            if (!f.isSuccess()) {
                logger.warn("响应发送失败 channel={}", ctx.channel().id().asShortText(), f.cause());
            }
        });
        if (!keepAlive) {
            future.addListener(ChannelFutureListener.CLOSE);
        }
    }
}
