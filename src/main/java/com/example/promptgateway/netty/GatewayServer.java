package com.example.promptgateway.netty;

import com.example.promptgateway.config.NettyConfig;
import com.example.promptgateway.filters.init.FiltersInit;
import com.example.promptgateway.netty.handler.BoundedBodyAggregator;
import com.example.promptgateway.netty.handler.ErrorHandler;
import com.example.promptgateway.netty.handler.GatewayHandler;
import com.example.promptgateway.netty.handler.ResponseWriter;
import com.example.promptgateway.netty.handler.UnhandledFaultHandler;
import com.example.promptgateway.startup.CrashContainment;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import java.net.InetSocketAddress;

/**
 * The HTTP listener. Bound by the startup orchestrator as its last step, never earlier.
 */
@Component
public class GatewayServer {
    private static final Logger logger = LoggerFactory.getLogger(GatewayServer.class);

    private final NettyConfig nettyConfig;
    private final ApplicationContext applicationContext;
    private final FiltersInit filtersInit;
    private final ErrorHandler errorHandler;
    private final ResponseWriter responseWriter;
    private final UnhandledFaultHandler unhandledFaultHandler;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup businessGroup;
    private volatile Channel serverChannel;

    @Autowired
    public GatewayServer(NettyConfig nettyConfig, ApplicationContext applicationContext, FiltersInit filtersInit,
                         ErrorHandler errorHandler, ResponseWriter responseWriter,
                         CrashContainment crashContainment) {
        this.nettyConfig = nettyConfig;
        this.applicationContext = applicationContext;
        this.filtersInit = filtersInit;
        this.errorHandler = errorHandler;
        this.responseWriter = responseWriter;
        this.unhandledFaultHandler = new UnhandledFaultHandler(crashContainment);
    }

    public synchronized void bind() throws InterruptedException {
        if (serverChannel != null) {
            throw new IllegalStateException("Server is already listening on port " + boundPort());
        }
        bossGroup = new NioEventLoopGroup(nettyConfig.getBossThreads()); // 处理TCP连接请求
        workerGroup = new NioEventLoopGroup(nettyConfig.getWorkerThreads()); // 处理IO读写
        // 业务处理器使用独立线程池，避免阻塞IO线程
        businessGroup = new DefaultEventExecutorGroup(nettyConfig.getBusinessThreads());
        ServerBootstrap b = new ServerBootstrap();
        b.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        GatewayHandler gatewayHandler = applicationContext.getBean(GatewayHandler.class);
                        ch.pipeline()
                                .addLast(new HttpServerCodec())
                                .addLast(new BoundedBodyAggregator(nettyConfig.getMaxContentLength(),
                                        filtersInit.getPreludeChain(), errorHandler, responseWriter))
                                .addLast(businessGroup, gatewayHandler)
                                .addLast(unhandledFaultHandler);
                    }
                })
                .option(ChannelOption.SO_BACKLOG, 1024)
                .childOption(ChannelOption.SO_KEEPALIVE, true);
        try {
            ChannelFuture f = b.bind(nettyConfig.getPort()).sync(); // 同步阻塞直至端口绑定成功
            serverChannel = f.channel();
        } catch (Exception e) {
            // 绑定失败（如端口被占用）时释放线程组
            releaseGroups();
            throw e;
        }
        logger.info("Now listening for connections. port={}", boundPort());
    }

    public boolean isListening() {
        Channel channel = serverChannel;
        return channel != null && channel.isActive();
    }

    public int boundPort() {
        Channel channel = serverChannel;
        if (channel == null) {
            throw new IllegalStateException("Server is not listening");
        }
        return ((InetSocketAddress) channel.localAddress()).getPort();
    }

    @PreDestroy
    public synchronized void shutdown() {
        Channel channel = serverChannel;
        serverChannel = null;
        if (channel != null) {
            channel.close().syncUninterruptibly();
            logger.info("监听端口已关闭");
        }
        releaseGroups();
    }

    private void releaseGroups() {
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
        if (businessGroup != null) {
            businessGroup.shutdownGracefully();
        }
        bossGroup = null;
        workerGroup = null;
        businessGroup = null;
    }
}
