package com.parley.channel;

import com.parley.observability.ParleyMetrics;
import com.parley.security.ReplayGuard;
import com.parley.security.SourceIpRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Admits one inbound webhook: adapter lookup, source throttling, replay window,
 * signature verification, parsing and normalization. Expected failures come back
 * as a {@link RoutingResult}; only adapter defects escape as exceptions.
 * Nothing here blocks on downstream processing.
 */
@Service
public class InboundRouter {

    private static final Logger log = LoggerFactory.getLogger(InboundRouter.class);

    private final ChannelRegistry registry;
    private final PayloadParser payloadParser;
    private final SourceIpRateLimiter rateLimiter;
    private final ReplayGuard replayGuard;
    private final ParleyMetrics metrics;

    public InboundRouter(ChannelRegistry registry,
                         PayloadParser payloadParser,
                         SourceIpRateLimiter rateLimiter,
                         ReplayGuard replayGuard,
                         ParleyMetrics metrics) {
        this.registry = registry;
        this.payloadParser = payloadParser;
        this.rateLimiter = rateLimiter;
        this.replayGuard = replayGuard;
        this.metrics = metrics;
    }

    public RoutingResult route(ChannelId channel, byte[] body, InboundWebhookMeta meta) {
        Optional<ChannelAdapter> found = registry.get(channel);
        if (found.isEmpty()) {
            metrics.recordRejected(channel, InboundFailure.CHANNEL_NOT_CONFIGURED);
            return RoutingResult.rejected(InboundFailure.CHANNEL_NOT_CONFIGURED, "channel not configured");
        }
        ChannelAdapter adapter = found.get();

        if (meta.sourceIp() != null && !rateLimiter.tryAcquire(meta.sourceIp())) {
            return reject(adapter, InboundFailure.RATE_LIMITED, "rate limit exceeded");
        }

        if (meta.timestamp() != null && !replayGuard.isFresh(meta.timestamp())) {
            log.warn("Stale webhook timestamp on channel={} timestamp={}", channel, meta.timestamp());
            return reject(adapter, InboundFailure.STALE_REQUEST, "request timestamp too old");
        }

        if (meta.hasSignature()) {
            if (!adapter.verifySignature(meta, body)) {
                log.warn("Webhook signature verification failed for channel={} ip={}",
                        channel, meta.sourceIp());
                return reject(adapter, InboundFailure.AUTHENTICATION_FAILED, "signature verification failed");
            }
        } else if (adapter.requiresSignature()) {
            log.warn("Webhook without signature rejected for channel={} ip={}", channel, meta.sourceIp());
            return reject(adapter, InboundFailure.AUTHENTICATION_FAILED, "signature verification failed");
        }

        PayloadFormat format = PayloadFormat.fromContentType(meta.contentType())
                .orElse(adapter.defaultFormat());
        if (!adapter.acceptedFormats().contains(format)) {
            log.warn("Unsupported payload format={} for channel={}", format, channel);
            return reject(adapter, InboundFailure.MALFORMED_PAYLOAD, "malformed payload");
        }

        ParsedPayload payload;
        try {
            payload = payloadParser.parse(body, format, meta.contentType());
        } catch (MalformedPayloadException e) {
            log.warn("Malformed {} payload on channel={}: {}", format, channel, e.getMessage());
            return reject(adapter, InboundFailure.MALFORMED_PAYLOAD, "malformed payload");
        }

        NormalizedMessage message;
        try {
            message = adapter.normalize(payload, meta);
        } catch (NormalizationException e) {
            log.warn("Normalization failed on channel={}: {}", channel, e.getMessage());
            return reject(adapter, InboundFailure.NORMALIZATION_FAULT, e.getMessage());
        }

        if (message.channel() != channel) {
            throw new IllegalStateException("Adapter " + adapter.displayName()
                    + " produced a message for channel " + message.channel() + " while routing " + channel);
        }

        metrics.recordAccepted(channel);
        return RoutingResult.accepted(message);
    }

    private RoutingResult reject(ChannelAdapter adapter, InboundFailure failure, String error) {
        metrics.recordRejected(adapter.channelId(), failure);
        return RoutingResult.rejected(failure, adapter.acknowledgementStatus(failure), error);
    }
}
