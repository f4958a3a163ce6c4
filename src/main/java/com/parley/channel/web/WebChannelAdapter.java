package com.parley.channel.web;

import com.parley.channel.ChannelAdapter;
import com.parley.channel.ChannelCapabilities;
import com.parley.channel.ChannelId;
import com.parley.channel.InboundWebhookMeta;
import com.parley.channel.MessageIds;
import com.parley.channel.NormalizationException;
import com.parley.channel.NormalizedMessage;
import com.parley.channel.ParsedPayload;
import com.parley.channel.Payloads;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * First-party web chat. Requests are authenticated by the security filter chain,
 * so there is no provider signature; the principal stands in for the sender.
 */
@Component
public class WebChannelAdapter implements ChannelAdapter {

    private static final ChannelCapabilities CAPABILITIES =
            new ChannelCapabilities(true, true, true, true, true, true, 32_000, true, true);

    private final Clock clock;

    public WebChannelAdapter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ChannelId channelId() { return ChannelId.WEB; }

    @Override
    public String displayName() { return "Web"; }

    @Override
    public ChannelCapabilities capabilities() { return CAPABILITIES; }

    /**
     * Never called: the channel declares no signature header, so the router skips
     * verification. The caller's principal is checked in {@link #normalize}.
     */
    @Override
    public boolean verifySignature(InboundWebhookMeta meta, byte[] rawBody) {
        return false;
    }

    @Override
    public boolean requiresSignature() { return false; }

    @Override
    public NormalizedMessage normalize(ParsedPayload payload, InboundWebhookMeta meta) {
        String principal = meta.principal();
        if (principal == null || principal.isBlank()) {
            throw new NormalizationException("web message without an authenticated user");
        }
        String text = Payloads.require(payload.field("text"), "text");
        String clientMessageId = payload.field("clientMessageId");
        String id = clientMessageId != null
                ? MessageIds.prefixed(ChannelId.WEB, principal + "-" + clientMessageId)
                : MessageIds.synthesize(ChannelId.WEB, principal, String.valueOf(clock.millis()), text);

        return new NormalizedMessage(id, ChannelId.WEB, principal, principal, null, null, text,
                List.of(), clock.instant(), payload.asMap());
    }
}
