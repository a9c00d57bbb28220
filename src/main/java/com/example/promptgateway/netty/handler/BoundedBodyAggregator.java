package com.example.promptgateway.netty.handler;

import com.example.promptgateway.exception.GatewayException;
import com.example.promptgateway.filters.models.FilterChain;
import com.example.promptgateway.filters.models.FullContext;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.EmptyHttpHeaders;
import io.netty.handler.codec.http.HttpMessage;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aggregates request bodies up to the ceiling and answers larger ones with a JSON 413 before any filter or route
 * sees them. The rejected request still gets a request context and an access log line.
 */
public class BoundedBodyAggregator extends HttpObjectAggregator {
    private static final Logger logger = LoggerFactory.getLogger(BoundedBodyAggregator.class);

    private final FilterChain preludeChain;
    private final ErrorHandler errorHandler;
    private final ResponseWriter responseWriter;

    public BoundedBodyAggregator(int maxContentLength, FilterChain preludeChain, ErrorHandler errorHandler,
                                 ResponseWriter responseWriter) {
        super(maxContentLength);
        this.preludeChain = preludeChain;
        this.errorHandler = errorHandler;
        this.responseWriter = responseWriter;
    }

    // 声明长度超限时不回 Netty 自带的空 413，交给 handleOversizedMessage 返回 JSON
    @Override
    protected Object newContinueResponse(HttpMessage start, int maxContentLength, ChannelPipeline pipeline) {
        if (start instanceof HttpRequest && HttpUtil.getContentLength(start, -1L) > maxContentLength) {
            return null;
        }
        return super.newContinueResponse(start, maxContentLength, pipeline);
    }

    @Override
    protected void handleOversizedMessage(ChannelHandlerContext ctx, HttpMessage oversized) throws Exception {
        if (!(oversized instanceof HttpRequest)) {
            super.handleOversizedMessage(ctx, oversized);
            return;
        }
        HttpRequest request = (HttpRequest) oversized;
        logger.warn("请求体超过上限 {} 字节 {} {}", maxContentLength(), request.method(), request.uri());
        // 只保留请求行和请求头，请求体已无法完整读取
        FullContext context = new FullContext(new DefaultFullHttpRequest(request.protocolVersion(), request.method(),
                request.uri(), Unpooled.EMPTY_BUFFER, request.headers().copy(), EmptyHttpHeaders.INSTANCE),
                ctx.channel().remoteAddress());
        preludeChain.doFilter(context);
        // 剩余的请求体无法再解析，直接关闭连接
        responseWriter.writeAndClose(ctx, context, errorHandler.handleError(context,
                new GatewayException(HttpResponseStatus.REQUEST_ENTITY_TOO_LARGE, "request entity too large")));
    }
}
