package com.parley.observability;

import com.parley.channel.ChannelId;
import com.parley.channel.ChannelRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class ChannelHealthIndicator implements HealthIndicator {

    private final ChannelRegistry registry;

    public ChannelHealthIndicator(ChannelRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        if (registry.listChannels().isEmpty()) {
            return Health.unknown().withDetail("reason", "No channel adapters registered").build();
        }

        Map<String, String> channelStatus = new LinkedHashMap<>();
        for (ChannelId channel : ChannelId.values()) {
            channelStatus.put(channel.id(), registry.get(channel)
                    .map(adapter -> "registered (" + adapter.displayName() + ")")
                    .orElse("not configured"));
        }

        return Health.up()
                .withDetail("channels", channelStatus)
                .withDetail("count", registry.listChannels().size())
                .build();
    }
}
