package com.parley.channel;

/**
 * Static description of what a provider supports. Exposed on the GET status
 * response and kept for the outbound side.
 *
 * @param maxMessageLength maximum outbound length in characters, 0 if unlimited
 */
public record ChannelCapabilities(
        boolean richText,
        boolean buttons,
        boolean cards,
        boolean inboundMedia,
        boolean outboundMedia,
        boolean streaming,
        int maxMessageLength,
        boolean typingIndicator,
        boolean readReceipts
) {
}
