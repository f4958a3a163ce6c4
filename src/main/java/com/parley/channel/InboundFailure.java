package com.parley.channel;

/**
 * Failure taxonomy for inbound routing, each with the status returned to the
 * provider unless the adapter's acknowledgement policy says otherwise.
 */
public enum InboundFailure {

    UNKNOWN_CHANNEL(404),
    CHANNEL_NOT_CONFIGURED(501),
    AUTHENTICATION_FAILED(401),
    MALFORMED_PAYLOAD(400),
    NORMALIZATION_FAULT(422),
    RATE_LIMITED(429),
    STALE_REQUEST(403),
    INTERNAL_FAULT(500);

    private final int defaultStatus;

    InboundFailure(int defaultStatus) {
        this.defaultStatus = defaultStatus;
    }

    public int defaultStatus() { return defaultStatus; }

    public String tag() { return name().toLowerCase(); }
}
