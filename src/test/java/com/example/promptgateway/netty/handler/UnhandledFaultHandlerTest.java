package com.example.promptgateway.netty.handler;

import com.example.promptgateway.startup.CrashContainment;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class UnhandledFaultHandlerTest {

    @Test
    void strayExceptionIsReportedAndChannelClosed() {
        CrashContainment crashContainment = mock(CrashContainment.class);
        EmbeddedChannel channel = new EmbeddedChannel(new UnhandledFaultHandler(crashContainment));
        IllegalStateException stray = new IllegalStateException("write after close");

        channel.pipeline().fireExceptionCaught(stray);

        verify(crashContainment).reportUnhandled(startsWith("channel "), eq(stray));
        assertThat(channel.isOpen()).isFalse();
    }
}
