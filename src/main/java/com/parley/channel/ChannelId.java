package com.parley.channel;

import java.util.Optional;

/**
 * The closed set of inbound channels. Adding a provider means registering an
 * adapter for one of these, never widening the enum at runtime.
 */
public enum ChannelId {

    WEB("web"),
    SMS("sms"),
    WHATSAPP("whatsapp"),
    IMESSAGE("imessage"),
    EMAIL("email"),
    TELEGRAM("telegram");

    private final String id;

    ChannelId(String id) {
        this.id = id;
    }

    public String id() { return id; }

    public static Optional<ChannelId> fromId(String id) {
        if (id == null) return Optional.empty();
        for (ChannelId channel : values()) {
            if (channel.id.equals(id)) return Optional.of(channel);
        }
        return Optional.empty();
    }

    @Override
    public String toString() { return id; }
}
