package com.parley.channel.email;

import com.fasterxml.jackson.databind.JsonNode;
import com.parley.channel.ChannelAdapter;
import com.parley.channel.ChannelCapabilities;
import com.parley.channel.ChannelId;
import com.parley.channel.InboundWebhookMeta;
import com.parley.channel.MessageIds;
import com.parley.channel.NormalizationException;
import com.parley.channel.NormalizedMessage;
import com.parley.channel.ParsedPayload;
import com.parley.channel.PayloadFormat;
import com.parley.channel.Payloads;
import com.parley.config.SecretsConfig;
import com.parley.security.WebhookSignatures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.time.Clock;
import java.util.Base64;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Transactional e-mail through SendGrid: Inbound Parse posts (form or multipart)
 * and JSON relays, signed with the Event Webhook ECDSA scheme.
 */
@Component
@ConditionalOnProperty(name = "vcap.services.parley-secrets.credentials.sendgrid-verification-key")
public class EmailChannelAdapter implements ChannelAdapter {

    private static final Logger log = LoggerFactory.getLogger(EmailChannelAdapter.class);

    static final String SIGNATURE_HEADER = "X-Twilio-Email-Event-Webhook-Signature";
    static final String TIMESTAMP_HEADER = "X-Twilio-Email-Event-Webhook-Timestamp";

    private static final Pattern NAMED_ADDRESS = Pattern.compile("^\\s*\"?([^\"<]*?)\"?\\s*<([^>]+)>\\s*$");
    private static final Pattern MESSAGE_ID_HEADER =
            Pattern.compile("(?im)^Message-ID:\\s*(\\S+)\\s*$");
    private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern HTML_BLOCK = Pattern.compile("(?is)<(script|style)[^>]*>.*?</\\1>");

    private static final ChannelCapabilities CAPABILITIES =
            new ChannelCapabilities(true, false, false, true, true, false, 100_000, false, false);

    private final SecretsConfig secretsConfig;
    private final Clock clock;

    public EmailChannelAdapter(SecretsConfig secretsConfig, Clock clock) {
        this.secretsConfig = secretsConfig;
        this.clock = clock;
    }

    @Override
    public ChannelId channelId() { return ChannelId.EMAIL; }

    @Override
    public String displayName() { return "Email (SendGrid)"; }

    @Override
    public ChannelCapabilities capabilities() { return CAPABILITIES; }

    /**
     * ECDSA P-256 / SHA-256 over the timestamp header value followed by the raw
     * payload. Key and signature are Base64 (X.509 and DER respectively).
     */
    @Override
    public boolean verifySignature(InboundWebhookMeta meta, byte[] rawBody) {
        String verificationKey = secretsConfig.getSendGridVerificationKey();
        if (!WebhookSignatures.isConfigured(verificationKey)) {
            log.warn("SendGrid verification key not configured, rejecting webhook");
            return false;
        }
        if (meta.signature() == null || meta.timestamp() == null || rawBody == null) {
            return false;
        }
        try {
            PublicKey publicKey = KeyFactory.getInstance("EC")
                    .generatePublic(new X509EncodedKeySpec(Base64.getDecoder().decode(verificationKey.trim())));
            Signature verifier = Signature.getInstance("SHA256withECDSA");
            verifier.initVerify(publicKey);
            verifier.update(meta.timestamp().getBytes(StandardCharsets.UTF_8));
            verifier.update(rawBody);
            return verifier.verify(Base64.getDecoder().decode(meta.signature().trim()));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            log.warn("SendGrid signature could not be verified: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public NormalizedMessage normalize(ParsedPayload payload, InboundWebhookMeta meta) {
        String from;
        String displayName;
        String to;
        String messageId;
        if (payload.isJson()) {
            JsonNode json = payload.json();
            JsonNode fromNode = json.path("from");
            if (fromNode.isObject()) {
                from = Payloads.text(fromNode.path("email"));
                displayName = Payloads.text(fromNode.path("name"));
            } else {
                from = address(Payloads.text(fromNode));
                displayName = displayName(Payloads.text(fromNode));
            }
            to = address(Payloads.text(json.path("to")));
            JsonNode headers = json.path("headers");
            messageId = Payloads.firstNonBlank(payload.field("message_id"),
                    headers.isObject() ? Payloads.text(headers.path("Message-ID")) : messageIdHeader(Payloads.text(headers)));
        } else {
            from = address(payload.field("from"));
            displayName = displayName(payload.field("from"));
            to = address(payload.field("to"));
            messageId = messageIdHeader(payload.field("headers"));
        }
        from = Payloads.require(from, "from");

        String subject = payload.field("subject");
        String text = Payloads.firstNonBlank(payload.field("text"), stripHtml(payload.field("html")), subject);
        if (text == null) {
            throw new NormalizationException("e-mail has no body or subject");
        }

        String id = messageId != null
                ? MessageIds.prefixed(ChannelId.EMAIL, messageId)
                : MessageIds.synthesize(ChannelId.EMAIL, from, meta.timestamp(), subject + "\n" + text);

        return new NormalizedMessage(id, ChannelId.EMAIL, from, null, displayName, to, text,
                List.of(), clock.instant(), payload.asMap());
    }

    /** Bare address from {@code Name <addr>}, or the value itself. */
    static String address(String value) {
        if (value == null) return null;
        Matcher matcher = NAMED_ADDRESS.matcher(value);
        String address = matcher.matches() ? matcher.group(2) : value;
        return address.trim().toLowerCase();
    }

    static String displayName(String value) {
        if (value == null) return null;
        Matcher matcher = NAMED_ADDRESS.matcher(value);
        if (!matcher.matches()) return null;
        String name = matcher.group(1).trim();
        return name.isEmpty() ? null : name;
    }

    private static String messageIdHeader(String rawHeaders) {
        if (rawHeaders == null) return null;
        Matcher matcher = MESSAGE_ID_HEADER.matcher(rawHeaders);
        return matcher.find() ? matcher.group(1) : null;
    }

    static String stripHtml(String html) {
        if (html == null) return null;
        String text = HTML_TAG.matcher(HTML_BLOCK.matcher(html).replaceAll(" ")).replaceAll(" ")
                .replace("&nbsp;", " ")
                .replace("&amp;", "&")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replaceAll("\\s+", " ")
                .trim();
        return text.isEmpty() ? null : text;
    }

    @Override
    public List<String> signatureHeaders() { return List.of(SIGNATURE_HEADER); }

    @Override
    public String timestampHeader() { return TIMESTAMP_HEADER; }

    @Override
    public Set<PayloadFormat> acceptedFormats() {
        return Set.of(PayloadFormat.JSON, PayloadFormat.FORM, PayloadFormat.MULTIPART);
    }

    @Override
    public PayloadFormat defaultFormat() { return PayloadFormat.FORM; }
}
