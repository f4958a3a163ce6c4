package com.parley.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Authoritative mapping from channel to adapter. Writers publish a fresh immutable
 * copy of the map, so lookups never lock and never observe a half-applied update.
 */
public class ChannelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ChannelRegistry.class);

    private final AtomicReference<Map<ChannelId, ChannelAdapter>> adapters =
            new AtomicReference<>(Collections.emptyMap());

    public ChannelRegistry() {
    }

    public ChannelRegistry(List<? extends ChannelAdapter> initial) {
        initial.forEach(this::register);
    }

    public void register(ChannelAdapter adapter) {
        ChannelId channel = adapter.channelId();
        Map<ChannelId, ChannelAdapter> previous = adapters.getAndUpdate(current -> {
            EnumMap<ChannelId, ChannelAdapter> next = new EnumMap<>(ChannelId.class);
            next.putAll(current);
            next.put(channel, adapter);
            return Collections.unmodifiableMap(next);
        });

        ChannelAdapter replaced = previous.get(channel);
        if (replaced != null && replaced != adapter) {
            log.warn("Adapter for channel={} replaced: {} -> {}",
                    channel, replaced.displayName(), adapter.displayName());
        } else {
            log.info("Registered channel adapter: channel={} name={}", channel, adapter.displayName());
        }
    }

    public Optional<ChannelAdapter> get(ChannelId channel) {
        if (channel == null) return Optional.empty();
        return Optional.ofNullable(adapters.get().get(channel));
    }

    public ChannelAdapter getOrThrow(ChannelId channel) {
        return get(channel).orElseThrow(() -> new ChannelNotRegisteredException(channel));
    }

    public boolean has(ChannelId channel) {
        return channel != null && adapters.get().containsKey(channel);
    }

    public List<ChannelId> listChannels() {
        return List.copyOf(adapters.get().keySet());
    }
}
