package com.parley.channel.whatsapp;

import com.fasterxml.jackson.databind.JsonNode;
import com.parley.channel.ChallengeRequest;
import com.parley.channel.ChallengeResponse;
import com.parley.channel.ChannelAdapter;
import com.parley.channel.ChannelCapabilities;
import com.parley.channel.ChannelId;
import com.parley.channel.InboundWebhookMeta;
import com.parley.channel.MessageAttachment;
import com.parley.channel.MessageIds;
import com.parley.channel.NormalizationException;
import com.parley.channel.NormalizedMessage;
import com.parley.channel.ParsedPayload;
import com.parley.channel.PayloadFormat;
import com.parley.channel.Payloads;
import com.parley.channel.sms.TwilioWebhooks;
import com.parley.config.SecretsConfig;
import com.parley.security.WebhookSignatures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * WhatsApp Business, delivered either through Twilio (form posts, Twilio signature)
 * or directly by the Meta Cloud API (JSON, {@code X-Hub-Signature-256}).
 */
@Component
@ConditionalOnExpression("'${vcap.services.parley-secrets.credentials.twilio-auth-token:}' != '' "
        + "or '${vcap.services.parley-secrets.credentials.whatsapp-app-secret:}' != ''")
public class WhatsAppChannelAdapter implements ChannelAdapter {

    private static final Logger log = LoggerFactory.getLogger(WhatsAppChannelAdapter.class);

    static final String META_SIGNATURE_HEADER = "X-Hub-Signature-256";
    private static final String META_SIGNATURE_PREFIX = "sha256=";
    private static final String TWILIO_ADDRESS_PREFIX = "whatsapp:";

    private static final ChannelCapabilities CAPABILITIES =
            new ChannelCapabilities(true, true, false, true, true, false, 4096, true, true);

    private final SecretsConfig secretsConfig;
    private final Clock clock;

    public WhatsAppChannelAdapter(SecretsConfig secretsConfig, Clock clock) {
        this.secretsConfig = secretsConfig;
        this.clock = clock;
    }

    @Override
    public ChannelId channelId() { return ChannelId.WHATSAPP; }

    @Override
    public String displayName() { return "WhatsApp Business"; }

    @Override
    public ChannelCapabilities capabilities() { return CAPABILITIES; }

    @Override
    public boolean verifySignature(InboundWebhookMeta meta, byte[] rawBody) {
        String signature = meta.signature();
        if (signature != null && signature.startsWith(META_SIGNATURE_PREFIX)) {
            return verifyMetaSignature(signature.substring(META_SIGNATURE_PREFIX.length()), rawBody);
        }
        return TwilioWebhooks.verify(secretsConfig.getTwilioAuthToken(), signature,
                meta.requestUrl(), rawBody, meta.contentType());
    }

    private boolean verifyMetaSignature(String hexSignature, byte[] rawBody) {
        String appSecret = secretsConfig.getWhatsAppAppSecret();
        if (!WebhookSignatures.isConfigured(appSecret)) {
            log.warn("WhatsApp app secret not configured, rejecting Meta webhook");
            return false;
        }
        if (rawBody == null) return false;
        String expected = WebhookSignatures.hmacHex(WebhookSignatures.HMAC_SHA256, appSecret, rawBody);
        return WebhookSignatures.constantTimeEquals(hexSignature.trim().toLowerCase(), expected);
    }

    @Override
    public NormalizedMessage normalize(ParsedPayload payload, InboundWebhookMeta meta) {
        if (payload.isJson()) {
            return normalizeCloudApi(payload);
        }
        return TwilioWebhooks.normalize(ChannelId.WHATSAPP, payload, TWILIO_ADDRESS_PREFIX, clock);
    }

    private NormalizedMessage normalizeCloudApi(ParsedPayload payload) {
        JsonNode value = payload.json().path("entry").path(0).path("changes").path(0).path("value");
        JsonNode message = value.path("messages").path(0);
        if (!message.isObject()) {
            throw new NormalizationException("no message in WhatsApp Cloud API payload");
        }

        String from = Payloads.require(Payloads.text(message.path("from")), "messages[0].from");
        String timestamp = Payloads.text(message.path("timestamp"));
        String type = Payloads.text(message.path("type"));

        String text = Payloads.text(message.path("text").path("body"));
        List<MessageAttachment> attachments = new ArrayList<>();
        for (String mediaType : List.of("image", "audio", "video", "document")) {
            JsonNode media = message.path(mediaType);
            if (!media.isObject()) continue;
            String mimeType = Payloads.text(media.path("mime_type"));
            attachments.add(MessageAttachment.media(attachmentType(mediaType), Payloads.text(media.path("id")), mimeType));
            if (text == null) text = Payloads.text(media.path("caption"));
        }
        JsonNode location = message.path("location");
        if (location.isObject() && location.path("latitude").isNumber() && location.path("longitude").isNumber()) {
            attachments.add(MessageAttachment.location(location.path("latitude").asDouble(),
                    location.path("longitude").asDouble()));
        }
        if (text == null && attachments.isEmpty()) {
            throw new NormalizationException("unsupported WhatsApp message type: " + type);
        }

        String providerId = Payloads.text(message.path("id"));
        String id = providerId != null
                ? MessageIds.prefixed(ChannelId.WHATSAPP, providerId)
                : MessageIds.synthesize(ChannelId.WHATSAPP, from, timestamp, text);
        Instant receivedAt = Payloads.epochSeconds(timestamp, clock.instant());

        return new NormalizedMessage(id, ChannelId.WHATSAPP, from, null,
                Payloads.text(value.path("contacts").path(0).path("profile").path("name")),
                Payloads.text(value.path("metadata").path("display_phone_number")),
                text, attachments, receivedAt, payload.asMap());
    }

    private static MessageAttachment.Type attachmentType(String mediaType) {
        return switch (mediaType) {
            case "image" -> MessageAttachment.Type.IMAGE;
            case "audio" -> MessageAttachment.Type.AUDIO;
            case "video" -> MessageAttachment.Type.VIDEO;
            default -> MessageAttachment.Type.DOCUMENT;
        };
    }

    /**
     * Meta subscription handshake: {@code hub.mode=subscribe} with the configured
     * verify token is answered with {@code hub.challenge}.
     */
    @Override
    public Optional<ChallengeResponse> handleVerificationChallenge(ChallengeRequest request) {
        String verifyToken = secretsConfig.getWhatsAppVerifyToken();
        if (!"subscribe".equals(request.queryParam("hub.mode")) || !WebhookSignatures.isConfigured(verifyToken)) {
            return Optional.empty();
        }
        String supplied = request.queryParam("hub.verify_token");
        if (supplied == null || !WebhookSignatures.constantTimeEquals(supplied, verifyToken)) {
            log.warn("WhatsApp subscription handshake with wrong verify token");
            return Optional.empty();
        }
        String challenge = request.queryParam("hub.challenge");
        return Optional.of(ChallengeResponse.echo(challenge != null ? challenge : ""));
    }

    @Override
    public List<String> signatureHeaders() {
        return List.of(TwilioWebhooks.SIGNATURE_HEADER, META_SIGNATURE_HEADER);
    }

    @Override
    public Set<PayloadFormat> acceptedFormats() { return Set.of(PayloadFormat.FORM, PayloadFormat.JSON); }

    @Override
    public PayloadFormat defaultFormat() { return PayloadFormat.FORM; }
}
