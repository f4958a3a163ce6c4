package com.parley.observability;

import com.parley.channel.ChannelId;
import com.parley.channel.InboundFailure;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Micrometer counters for inbound webhook traffic.
 */
@Component
public class ParleyMetrics {

    private final MeterRegistry registry;

    public ParleyMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAccepted(ChannelId channel) {
        Counter.builder("parley.inbound.accepted")
                .tag("channel", channel.id())
                .register(registry).increment();
    }

    public void recordRejected(ChannelId channel, InboundFailure failure) {
        Counter.builder("parley.inbound.rejected")
                .tag("channel", channel.id())
                .tag("reason", failure.tag())
                .register(registry).increment();
    }

    public void recordUnknownChannel() {
        Counter.builder("parley.inbound.rejected")
                .tag("channel", "unknown")
                .tag("reason", InboundFailure.UNKNOWN_CHANNEL.tag())
                .register(registry).increment();
    }

    public void recordChallenge(ChannelId channel, boolean answered) {
        Counter.builder("parley.inbound.challenges")
                .tag("channel", channel.id())
                .tag("outcome", answered ? "answered" : "status")
                .register(registry).increment();
    }
}
