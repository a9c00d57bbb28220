package com.example.promptgateway.netty.handler;

import com.example.promptgateway.exception.GatewayException;
import com.example.promptgateway.filters.FilterOutcome;
import com.example.promptgateway.filters.init.FiltersInit;
import com.example.promptgateway.filters.models.FilterChain;
import com.example.promptgateway.filters.models.FullContext;
import com.example.promptgateway.route.RouteDispatcher;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;

/**
 * Runs each request through the filter chain and then the route dispatcher. Every outcome ends in exactly one
 * response written by {@link ResponseWriter}.
 */
@Component
@Scope("prototype")
public class GatewayHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
    private static final Logger logger = LoggerFactory.getLogger(GatewayHandler.class);

    private final FilterChain filterChain;
    private final FilterChain preludeChain;
    private final RouteDispatcher routeDispatcher;
    private final ErrorHandler errorHandler;
    private final ResponseWriter responseWriter;

    @Autowired
    public GatewayHandler(FiltersInit filtersInit, RouteDispatcher routeDispatcher, ErrorHandler errorHandler,
                          ResponseWriter responseWriter) {
        this.filterChain = filtersInit.getFilterChain();
        this.preludeChain = filtersInit.getPreludeChain();
        this.routeDispatcher = routeDispatcher;
        this.errorHandler = errorHandler;
        this.responseWriter = responseWriter;
    }

    // SimpleChannelInboundHandler 在 channelRead0 返回后释放 request，路由只能同步读取请求体
    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        FullContext context = new FullContext(request, ctx.channel().remoteAddress());
        if (!request.decoderResult().isSuccess()) {
            preludeChain.doFilter(context);
            responseWriter.writeAndClose(ctx, context, errorHandler.handleError(context,
                    new GatewayException(HttpResponseStatus.BAD_REQUEST, "Bad request")));
            return;
        }

        FilterOutcome outcome = filterChain.doFilter(context);
        switch (outcome.getType()) {
            case SHORT_CIRCUIT -> responseWriter.write(ctx, context, outcome.getResponse());
            case FAIL -> responseWriter.write(ctx, context, errorHandler.handleError(context, outcome.getError()));
            case CONTINUE -> dispatch(ctx, context);
        }
    }

    private void dispatch(ChannelHandlerContext ctx, FullContext context) {
        routeDispatcher.dispatch(context).whenComplete((response, error) -> {
            Runnable reply = () -> reply(ctx, context, response, error);
            if (ctx.executor().inEventLoop()) {
                reply.run();
            } else {
                ctx.executor().execute(reply);
            }
        });
    }

    private void reply(ChannelHandlerContext ctx, FullContext context, FullHttpResponse response, Throwable error) {
        try {
            if (error != null) {
                responseWriter.write(ctx, context, errorHandler.handleError(context, error));
            } else if (response == null) {
                responseWriter.write(ctx, context, errorHandler.notFound());
            } else {
                responseWriter.write(ctx, context, response);
            }
        } catch (RuntimeException e) {
            ctx.fireExceptionCaught(e);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (!ctx.channel().isActive()) {
            ctx.fireExceptionCaught(cause);
            return;
        }
        logger.warn("channel {} 处理异常 返回错误响应并关闭连接", ctx.channel().id().asShortText());
        responseWriter.write(ctx, null, errorHandler.handleError(null, cause));
    }
}
