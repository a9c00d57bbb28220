package com.example.promptgateway.netty.handler;

import com.example.promptgateway.startup.CrashContainment;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;

/**
 * Tail of every channel pipeline. Exceptions that get here were not answered by the gateway handler.
 */
@ChannelHandler.Sharable
public class UnhandledFaultHandler extends ChannelInboundHandlerAdapter {
    private final CrashContainment crashContainment;

    public UnhandledFaultHandler(CrashContainment crashContainment) {
        this.crashContainment = crashContainment;
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        crashContainment.reportUnhandled("channel " + ctx.channel().id().asShortText(), cause);
        ctx.close();
    }
}
