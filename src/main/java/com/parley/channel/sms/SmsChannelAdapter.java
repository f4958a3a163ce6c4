package com.parley.channel.sms;

import com.parley.channel.ChannelAdapter;
import com.parley.channel.ChannelCapabilities;
import com.parley.channel.ChannelId;
import com.parley.channel.InboundWebhookMeta;
import com.parley.channel.NormalizedMessage;
import com.parley.channel.ParsedPayload;
import com.parley.channel.PayloadFormat;
import com.parley.config.SecretsConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Set;

@Component
@ConditionalOnProperty(name = "vcap.services.parley-secrets.credentials.twilio-auth-token")
public class SmsChannelAdapter implements ChannelAdapter {

    private static final ChannelCapabilities CAPABILITIES =
            new ChannelCapabilities(false, false, false, true, true, false, 1600, false, false);

    private final SecretsConfig secretsConfig;
    private final Clock clock;

    public SmsChannelAdapter(SecretsConfig secretsConfig, Clock clock) {
        this.secretsConfig = secretsConfig;
        this.clock = clock;
    }

    @Override
    public ChannelId channelId() { return ChannelId.SMS; }

    @Override
    public String displayName() { return "Twilio SMS"; }

    @Override
    public ChannelCapabilities capabilities() { return CAPABILITIES; }

    @Override
    public boolean verifySignature(InboundWebhookMeta meta, byte[] rawBody) {
        return TwilioWebhooks.verify(secretsConfig.getTwilioAuthToken(), meta.signature(),
                meta.requestUrl(), rawBody, meta.contentType());
    }

    @Override
    public NormalizedMessage normalize(ParsedPayload payload, InboundWebhookMeta meta) {
        return TwilioWebhooks.normalize(ChannelId.SMS, payload, null, clock);
    }

    @Override
    public List<String> signatureHeaders() { return List.of(TwilioWebhooks.SIGNATURE_HEADER); }

    @Override
    public Set<PayloadFormat> acceptedFormats() { return Set.of(PayloadFormat.FORM); }

    @Override
    public PayloadFormat defaultFormat() { return PayloadFormat.FORM; }
}
