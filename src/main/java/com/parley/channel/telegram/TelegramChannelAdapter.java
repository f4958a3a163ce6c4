package com.parley.channel.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.parley.channel.ChallengeRequest;
import com.parley.channel.ChallengeResponse;
import com.parley.channel.ChannelAdapter;
import com.parley.channel.ChannelCapabilities;
import com.parley.channel.ChannelId;
import com.parley.channel.InboundFailure;
import com.parley.channel.InboundWebhookMeta;
import com.parley.channel.MessageAttachment;
import com.parley.channel.NormalizationException;
import com.parley.channel.NormalizedMessage;
import com.parley.channel.ParsedPayload;
import com.parley.channel.Payloads;
import com.parley.config.SecretsConfig;
import com.parley.security.WebhookSignatures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Telegram Bot API webhooks. Telegram signs nothing; it echoes the
 * {@code secret_token} given to {@code setWebhook} in a header.
 */
@Component
@ConditionalOnProperty(name = "vcap.services.parley-secrets.credentials.telegram-webhook-secret")
public class TelegramChannelAdapter implements ChannelAdapter {

    private static final Logger log = LoggerFactory.getLogger(TelegramChannelAdapter.class);

    static final String SECRET_TOKEN_HEADER = "X-Telegram-Bot-Api-Secret-Token";

    private static final ChannelCapabilities CAPABILITIES =
            new ChannelCapabilities(true, true, false, true, true, false, 4096, true, false);

    private static final List<String> UPDATE_KINDS = List.of("message", "edited_message", "channel_post");

    private final SecretsConfig secretsConfig;
    private final Clock clock;

    public TelegramChannelAdapter(SecretsConfig secretsConfig, Clock clock) {
        this.secretsConfig = secretsConfig;
        this.clock = clock;
    }

    @Override
    public ChannelId channelId() { return ChannelId.TELEGRAM; }

    @Override
    public String displayName() { return "Telegram"; }

    @Override
    public ChannelCapabilities capabilities() { return CAPABILITIES; }

    @Override
    public boolean verifySignature(InboundWebhookMeta meta, byte[] rawBody) {
        return tokenMatches(meta.signature());
    }

    private boolean tokenMatches(String supplied) {
        String secret = secretsConfig.getTelegramWebhookSecret();
        if (!WebhookSignatures.isConfigured(secret)) {
            log.warn("Telegram webhook secret not configured, rejecting request");
            return false;
        }
        return supplied != null && WebhookSignatures.constantTimeEquals(supplied, secret);
    }

    @Override
    public NormalizedMessage normalize(ParsedPayload payload, InboundWebhookMeta meta) {
        JsonNode update = payload.json();
        JsonNode message = null;
        for (String kind : UPDATE_KINDS) {
            if (update.path(kind).isObject()) {
                message = update.path(kind);
                break;
            }
        }
        if (message == null) {
            throw new NormalizationException("Telegram update carries no message");
        }

        String chatId = Payloads.require(Payloads.text(message.path("chat").path("id")), "chat.id");
        String messageId = Payloads.require(Payloads.text(message.path("message_id")), "message_id");
        String text = Payloads.firstNonBlank(Payloads.text(message.path("text")),
                Payloads.text(message.path("caption")));
        List<MessageAttachment> attachments = attachments(message);
        if (text == null && attachments.isEmpty()) {
            throw new NormalizationException("Telegram message has no text or supported attachment");
        }

        JsonNode sender = message.path("from");
        String displayName = Payloads.firstNonBlank(
                join(Payloads.text(sender.path("first_name")), Payloads.text(sender.path("last_name"))),
                Payloads.text(sender.path("username")),
                Payloads.text(message.path("chat").path("title")));

        return new NormalizedMessage(
                "telegram-" + chatId + "-" + messageId,
                ChannelId.TELEGRAM, chatId, null, displayName, null, text, attachments,
                Payloads.epochSeconds(Payloads.text(message.path("date")), clock.instant()),
                payload.asMap());
    }

    private static List<MessageAttachment> attachments(JsonNode message) {
        List<MessageAttachment> attachments = new ArrayList<>();
        JsonNode photos = message.path("photo");
        if (photos.isArray() && photos.size() > 0) {
            // sizes ascend, the last one is the original
            JsonNode largest = photos.get(photos.size() - 1);
            attachments.add(MessageAttachment.media(MessageAttachment.Type.IMAGE,
                    Payloads.text(largest.path("file_id")), "image/jpeg"));
        }
        addFile(attachments, message.path("voice"), MessageAttachment.Type.AUDIO);
        addFile(attachments, message.path("audio"), MessageAttachment.Type.AUDIO);
        addFile(attachments, message.path("video"), MessageAttachment.Type.VIDEO);
        addFile(attachments, message.path("document"), MessageAttachment.Type.DOCUMENT);
        JsonNode location = message.path("location");
        if (location.path("latitude").isNumber() && location.path("longitude").isNumber()) {
            attachments.add(MessageAttachment.location(location.path("latitude").asDouble(),
                    location.path("longitude").asDouble()));
        }
        return attachments;
    }

    private static void addFile(List<MessageAttachment> attachments, JsonNode file, MessageAttachment.Type type) {
        if (!file.isObject()) return;
        attachments.add(MessageAttachment.media(type, Payloads.text(file.path("file_id")),
                Payloads.text(file.path("mime_type"))));
    }

    private static String join(String first, String last) {
        if (first == null) return last;
        return last == null ? first : first + " " + last;
    }

    @Override
    public Optional<ChallengeResponse> handleVerificationChallenge(ChallengeRequest request) {
        String supplied = Payloads.firstNonBlank(request.header(SECRET_TOKEN_HEADER),
                request.queryParam("secret_token"));
        if (!tokenMatches(supplied)) {
            return Optional.empty();
        }
        String challenge = request.queryParam("challenge");
        return Optional.of(ChallengeResponse.echo(challenge != null ? challenge : "ok"));
    }

    @Override
    public List<String> signatureHeaders() { return List.of(SECRET_TOKEN_HEADER); }

    /**
     * Telegram retries non-2xx updates and holds back later ones until it succeeds,
     * so an update we cannot map is acknowledged rather than redelivered forever.
     */
    @Override
    public int acknowledgementStatus(InboundFailure failure) {
        return failure == InboundFailure.NORMALIZATION_FAULT ? 200 : failure.defaultStatus();
    }
}
