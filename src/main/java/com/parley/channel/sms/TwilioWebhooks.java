package com.parley.channel.sms;

import com.parley.channel.ChannelId;
import com.parley.channel.MalformedPayloadException;
import com.parley.channel.MessageAttachment;
import com.parley.channel.MessageIds;
import com.parley.channel.NormalizationException;
import com.parley.channel.NormalizedMessage;
import com.parley.channel.ParsedPayload;
import com.parley.channel.PayloadParser;
import com.parley.channel.Payloads;
import com.parley.security.WebhookSignatures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.MultiValueMap;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Twilio messaging webhook conventions, shared by the SMS and WhatsApp adapters.
 *
 * @see <a href="https://www.twilio.com/docs/usage/security#validating-requests">Validating requests</a>
 */
public final class TwilioWebhooks {

    private static final Logger log = LoggerFactory.getLogger(TwilioWebhooks.class);

    public static final String SIGNATURE_HEADER = "X-Twilio-Signature";
    private static final int MAX_MEDIA = 10;

    private TwilioWebhooks() {
    }

    /**
     * Verifies {@code X-Twilio-Signature}: Base64 HMAC-SHA1 keyed by the auth token over
     * the full request URL followed by each POST parameter name and value, names sorted.
     */
    public static boolean verify(String authToken, String signature, String url,
                                 byte[] rawBody, String contentType) {
        if (!WebhookSignatures.isConfigured(authToken)) {
            log.warn("Twilio auth token not configured, rejecting webhook");
            return false;
        }
        if (signature == null || url == null || rawBody == null) return false;

        MultiValueMap<String, String> params;
        try {
            params = PayloadParser.decodeForm(rawBody, contentType);
        } catch (MalformedPayloadException e) {
            log.debug("Twilio signature check on undecodable body: {}", e.getMessage());
            return false;
        }
        String expected = WebhookSignatures.hmacBase64(WebhookSignatures.HMAC_SHA1, authToken,
                signedContent(url, params));
        return WebhookSignatures.constantTimeEquals(signature.trim(), expected);
    }

    static String signedContent(String url, MultiValueMap<String, String> params) {
        StringBuilder data = new StringBuilder(url);
        for (String key : new TreeSet<>(params.keySet())) {
            for (String value : params.get(key)) {
                data.append(key).append(value != null ? value : "");
            }
        }
        return data.toString();
    }

    /**
     * Maps a Twilio messaging form post. {@code addressPrefix} is stripped from
     * From/To (Twilio prefixes WhatsApp numbers with {@code whatsapp:}).
     */
    public static NormalizedMessage normalize(ChannelId channel, ParsedPayload payload,
                                              String addressPrefix, Clock clock) {
        String from = stripPrefix(Payloads.require(payload.field("From"), "From"), addressPrefix);
        String to = stripPrefix(payload.field("To"), addressPrefix);
        String body = payload.field("Body");

        List<MessageAttachment> attachments = media(payload);
        if (body == null && attachments.isEmpty()) {
            throw new NormalizationException("message has no text or attachments");
        }

        String sid = Payloads.firstNonBlank(payload.field("MessageSid"), payload.field("SmsMessageSid"));
        String id = sid != null
                ? MessageIds.prefixed(channel, sid)
                : MessageIds.synthesize(channel, from, null, body);

        return new NormalizedMessage(id, channel, from, null, payload.field("ProfileName"), to,
                body, attachments, clock.instant(), payload.asMap());
    }

    private static List<MessageAttachment> media(ParsedPayload payload) {
        int count;
        try {
            String numMedia = payload.field("NumMedia");
            count = numMedia != null ? Integer.parseInt(numMedia.trim()) : 0;
        } catch (NumberFormatException e) {
            throw new NormalizationException("NumMedia is not a number");
        }
        List<MessageAttachment> attachments = new ArrayList<>();
        for (int i = 0; i < Math.min(count, MAX_MEDIA); i++) {
            String url = payload.field("MediaUrl" + i);
            if (url == null) continue;
            String mimeType = payload.field("MediaContentType" + i);
            attachments.add(MessageAttachment.media(MessageAttachment.typeForMime(mimeType), url, mimeType));
        }
        return attachments;
    }

    private static String stripPrefix(String address, String prefix) {
        if (address == null || prefix == null) return address;
        return address.startsWith(prefix) ? address.substring(prefix.length()) : address;
    }
}
