package com.parley.channel;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Builds idempotency keys for providers that do not send a message id of their own.
 * The same inputs always give the same key, so redelivered webhooks collide downstream.
 */
public final class MessageIds {

    private static final char SEPARATOR = '\u001f';

    private MessageIds() {
    }

    public static String synthesize(ChannelId channel, String sender, String timestamp, String body) {
        StringBuilder material = new StringBuilder(channel.id())
                .append(SEPARATOR).append(nullToEmpty(sender))
                .append(SEPARATOR).append(nullToEmpty(timestamp))
                .append(SEPARATOR).append(nullToEmpty(body));
        return channel.id() + "-" + sha256Hex(material.toString()).substring(0, 32);
    }

    public static String prefixed(ChannelId channel, String providerId) {
        return channel.id() + "-" + providerId;
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
