package com.example.promptgateway.netty.handler;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.example.promptgateway.config.CorsConfig;
import com.example.promptgateway.config.LogConfig;
import com.example.promptgateway.config.NettyConfig;
import com.example.promptgateway.filters.impl.CorsFilter;
import com.example.promptgateway.filters.impl.LoggingFilter;
import com.example.promptgateway.filters.impl.RequestContextFilter;
import com.example.promptgateway.filters.models.FilterChain;
import com.example.promptgateway.logging.AccessLogger;
import com.example.promptgateway.logging.LogRedactor;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultHttpContent;
import io.netty.handler.codec.http.DefaultHttpRequest;
import io.netty.handler.codec.http.DefaultLastHttpContent;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.util.CharsetUtil;
import io.netty.util.ReferenceCountUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BoundedBodyAggregatorTest {
    private static final int LIMIT = 16;

    private final List<FullHttpRequest> delivered = new ArrayList<>();
    private EmbeddedChannel channel;
    private Logger accessLogger;
    private ListAppender<ILoggingEvent> accessLog;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        LogConfig logConfig = new LogConfig();
        LogRedactor redactor = new LogRedactor(logConfig, objectMapper);
        ErrorHandler errorHandler = new ErrorHandler(redactor);
        ResponseWriter responseWriter = new ResponseWriter(new CorsFilter(new CorsConfig()), new AccessLogger(redactor));
        FilterChain preludeChain = new FilterChain(List.of(
                new RequestContextFilter(new NettyConfig()), new LoggingFilter(logConfig)));
        channel = new EmbeddedChannel(
                new BoundedBodyAggregator(LIMIT, preludeChain, errorHandler, responseWriter),
                new ChannelInboundHandlerAdapter() {
                    @Override
                    public void channelRead(ChannelHandlerContext ctx, Object msg) {
                        delivered.add((FullHttpRequest) msg);
                    }
                });

        accessLogger = (Logger) LoggerFactory.getLogger(AccessLogger.class);
        accessLog = new ListAppender<>();
        accessLog.start();
        accessLogger.addAppender(accessLog);
    }

    @AfterEach
    void tearDown() {
        accessLogger.detachAppender(accessLog);
    }

    private HttpRequest post(int contentLength) {
        HttpRequest request = new DefaultHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.POST, "/proxy/x");
        request.headers().set(HttpHeaderNames.CONTENT_LENGTH, contentLength);
        request.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json");
        return request;
    }

    @Test
    void declaredOversizedBodyIsRejectedBeforeAnyHandler() {
        channel.writeInbound(post(1024));
        channel.runPendingTasks();

        FullHttpResponse response = channel.readOutbound();

        assertThat(response.status()).isEqualTo(HttpResponseStatus.REQUEST_ENTITY_TOO_LARGE);
        assertThat(response.content().toString(CharsetUtil.UTF_8))
                .isEqualTo("{\"error\":\"request entity too large\"}");
        assertThat(response.headers().get(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN)).isEqualTo("*");
        assertThat(delivered).isEmpty();
        assertThat(channel.isOpen()).isFalse();
        response.release();
    }

    @Test
    void streamedBodyOverTheLimitIsRejected() {
        HttpRequest request = new DefaultHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.POST, "/proxy/x");
        request.headers().set(HttpHeaderNames.TRANSFER_ENCODING, "chunked");
        channel.writeInbound(request);
        channel.writeInbound(new DefaultHttpContent(Unpooled.copiedBuffer("0123456789", CharsetUtil.UTF_8)));
        channel.writeInbound(new DefaultLastHttpContent(Unpooled.copiedBuffer("0123456789", CharsetUtil.UTF_8)));
        channel.runPendingTasks();

        FullHttpResponse response = channel.readOutbound();

        assertThat(response.status()).isEqualTo(HttpResponseStatus.REQUEST_ENTITY_TOO_LARGE);
        assertThat(delivered).isEmpty();
        response.release();
    }

    @Test
    void bodyWithinLimitIsAggregated() {
        channel.writeInbound(post(10));
        channel.writeInbound(new DefaultLastHttpContent(Unpooled.copiedBuffer("0123456789", CharsetUtil.UTF_8)));

        assertThat((Object) channel.readOutbound()).isNull();
        assertThat(delivered).hasSize(1);
        assertThat(delivered.get(0).content().readableBytes()).isEqualTo(10);
        ReferenceCountUtil.release(delivered.get(0));
    }

    @Test
    void expectContinueWithOversizedLengthGetsJsonBody() {
        HttpRequest request = post(1024);
        request.headers().set(HttpHeaderNames.EXPECT, "100-continue");

        channel.writeInbound(request);
        channel.runPendingTasks();
        FullHttpResponse response = channel.readOutbound();

        assertThat(response.status()).isEqualTo(HttpResponseStatus.REQUEST_ENTITY_TOO_LARGE);
        assertThat(response.headers().get(HttpHeaderNames.CONTENT_TYPE)).startsWith("application/json");
        assertThat(response.headers().get(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN)).isEqualTo("*");
        assertThat(response.content().toString(CharsetUtil.UTF_8))
                .isEqualTo("{\"error\":\"request entity too large\"}");
        assertThat((Object) channel.readOutbound()).isNull();
        assertThat(delivered).isEmpty();
        assertThat(channel.isOpen()).isFalse();
        response.release();
    }

    @Test
    void expectContinueWithinLimitIsAcknowledged() {
        HttpRequest request = post(10);
        request.headers().set(HttpHeaderNames.EXPECT, "100-continue");

        channel.writeInbound(request);
        FullHttpResponse response = channel.readOutbound();

        assertThat(response.status()).isEqualTo(HttpResponseStatus.CONTINUE);
        assertThat(channel.isOpen()).isTrue();
        response.release();
    }

    @Test
    void rejectedRequestIsAccessLoggedWithCredentialsCensored() {
        HttpRequest request = post(1024);
        request.headers().set(HttpHeaderNames.AUTHORIZATION, "Bearer sk-upload-secret");

        channel.writeInbound(request);
        channel.runPendingTasks();
        ReferenceCountUtil.release(channel.readOutbound());

        assertThat(accessLog.list).hasSize(1);
        ILoggingEvent event = accessLog.list.get(0);
        assertThat(event.getLevel().toString()).isEqualTo("WARN");
        assertThat(event.getFormattedMessage()).contains("/proxy/x", "\"statusCode\":413", "********")
                .doesNotContain("sk-upload-secret");
    }
}
