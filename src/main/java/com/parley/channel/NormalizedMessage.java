package com.parley.channel;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Canonical envelope every adapter produces.
 *
 * @param id              idempotency key, stable across provider redeliveries
 * @param senderAddress   provider-native address (phone number, chat id, e-mail)
 * @param senderUserId    directory user id, absent until identity is resolved
 * @param raw             provider payload as a map, for diagnostics
 */
public record NormalizedMessage(
        String id,
        ChannelId channel,
        String senderAddress,
        String senderUserId,
        String senderDisplayName,
        String recipientAddress,
        String text,
        List<MessageAttachment> attachments,
        Instant receivedAt,
        Map<String, Object> raw
) {

    public NormalizedMessage {
        attachments = attachments != null ? List.copyOf(attachments) : List.of();
        text = text != null ? text : "";
    }

    public NormalizedMessage(String id, ChannelId channel, String senderAddress,
                             String text, Instant receivedAt) {
        this(id, channel, senderAddress, null, null, null, text, List.of(), receivedAt, null);
    }

    public String textPreview(int maxLength) {
        return text.length() <= maxLength ? text : text.substring(0, maxLength);
    }
}
