package com.parley.channel;

/**
 * Transport metadata for one webhook request. Built by the endpoint, never persisted.
 * {@code rawBody} is only set when a signature was supplied and is the same buffer
 * the router parses.
 */
public record InboundWebhookMeta(
        ChannelId channel,
        String signature,
        String timestamp,
        String sourceIp,
        byte[] rawBody,
        String requestUrl,
        String contentType,
        String principal
) {

    public InboundWebhookMeta(ChannelId channel, String signature, byte[] rawBody) {
        this(channel, signature, null, null, rawBody, null, null, null);
    }

    public boolean hasSignature() {
        return signature != null && !signature.isEmpty();
    }
}
