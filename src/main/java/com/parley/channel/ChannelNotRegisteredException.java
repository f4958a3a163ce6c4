package com.parley.channel;

public class ChannelNotRegisteredException extends RuntimeException {

    private final ChannelId channel;

    public ChannelNotRegisteredException(ChannelId channel) {
        super("No adapter registered for channel: " + channel);
        this.channel = channel;
    }

    public ChannelId getChannel() { return channel; }
}
