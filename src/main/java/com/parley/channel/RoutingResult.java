package com.parley.channel;

/**
 * Outcome of routing one inbound request. {@code statusCode} follows the provider's
 * acknowledgement convention and is independent of {@code success}.
 */
public record RoutingResult(
        boolean success,
        int statusCode,
        NormalizedMessage normalizedMessage,
        String error,
        InboundFailure failure
) {

    public RoutingResult {
        if (success && normalizedMessage == null) {
            throw new IllegalArgumentException("successful routing requires a normalized message");
        }
    }

    public static RoutingResult accepted(NormalizedMessage message) {
        return new RoutingResult(true, 200, message, null, null);
    }

    public static RoutingResult rejected(InboundFailure failure, int statusCode, String error) {
        return new RoutingResult(false, statusCode, null, error, failure);
    }

    public static RoutingResult rejected(InboundFailure failure, String error) {
        return rejected(failure, failure.defaultStatus(), error);
    }
}
