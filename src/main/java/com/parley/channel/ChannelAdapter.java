package com.parley.channel;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * One provider's wire format: signature check, payload normalization and,
 * where the provider uses one, the GET subscription handshake.
 * Implementations are stateless apart from their configured secrets.
 */
public interface ChannelAdapter {

    ChannelId channelId();

    String displayName();

    ChannelCapabilities capabilities();

    /**
     * Checks the provider signature against the exact bytes received.
     * Returns false on a bad, malformed or unverifiable signature; never throws.
     */
    boolean verifySignature(InboundWebhookMeta meta, byte[] rawBody);

    /**
     * Maps a parsed payload onto the canonical envelope.
     *
     * @throws NormalizationException when the payload does not match the provider schema
     */
    NormalizedMessage normalize(ParsedPayload payload, InboundWebhookMeta meta);

    default Optional<ChallengeResponse> handleVerificationChallenge(ChallengeRequest request) {
        return Optional.empty();
    }

    /** Whether a request with no signature must be rejected. */
    default boolean requiresSignature() { return true; }

    /** Headers carrying the signature, in lookup order. */
    default List<String> signatureHeaders() { return List.of(); }

    default String timestampHeader() { return "X-Request-Timestamp"; }

    default Set<PayloadFormat> acceptedFormats() { return Set.of(PayloadFormat.JSON); }

    /** Format assumed when the request carries no usable Content-Type. */
    default PayloadFormat defaultFormat() { return PayloadFormat.JSON; }

    /**
     * Status returned to the provider for a failure. Providers that redeliver on
     * anything but 2xx override this for failures a redelivery cannot fix.
     */
    default int acknowledgementStatus(InboundFailure failure) {
        return failure.defaultStatus();
    }
}
