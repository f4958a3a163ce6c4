package com.parley.channel;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.parley.observability.ParleyMetrics;
import com.parley.security.ReplayGuard;
import com.parley.security.SourceIpRateLimiter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InboundRouterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String JSON = "application/json";

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private SimpleMeterRegistry meterRegistry;
    private ChannelRegistry registry;
    private InboundRouter router;
    private StubChannelAdapter telegram;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        registry = new ChannelRegistry();
        telegram = new StubChannelAdapter(ChannelId.TELEGRAM);
        registry.register(telegram);
        router = new InboundRouter(registry, new PayloadParser(new ObjectMapper()),
                new SourceIpRateLimiter(3, Duration.ofMinutes(1), clock),
                new ReplayGuard(Duration.ofMinutes(5), clock),
                new ParleyMetrics(meterRegistry));
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static InboundWebhookMeta meta(ChannelId channel, String signature, String timestamp, String ip) {
        return new InboundWebhookMeta(channel, signature, timestamp, ip, null, null, JSON, null);
    }

    @Test
    void acceptsSignedWellFormedPayload() {
        RoutingResult result = router.route(ChannelId.TELEGRAM, bytes("{\"text\":\"hi\"}"),
                meta(ChannelId.TELEGRAM, "token", null, "10.0.0.1"));

        assertTrue(result.success());
        assertEquals(200, result.statusCode());
        assertEquals(ChannelId.TELEGRAM, result.normalizedMessage().channel());
        assertEquals("hi", result.normalizedMessage().text());
        assertEquals(1.0, meterRegistry.counter("parley.inbound.accepted", "channel", "telegram").count());
    }

    @Test
    void unregisteredChannelIsNotConfigured() {
        RoutingResult result = router.route(ChannelId.EMAIL, bytes("{}"), meta(ChannelId.EMAIL, "sig", null, null));

        assertFalse(result.success());
        assertEquals(501, result.statusCode());
        assertEquals(InboundFailure.CHANNEL_NOT_CONFIGURED, result.failure());
    }

    @Test
    void tamperedSignatureIsRejectedBeforeParsing() {
        telegram.signatureValid = false;

        RoutingResult result = router.route(ChannelId.TELEGRAM, bytes("{\"text\":\"hi\"}"),
                meta(ChannelId.TELEGRAM, "wrong", null, null));

        assertFalse(result.success());
        assertEquals(401, result.statusCode());
        assertEquals(1, telegram.verifyCalls);
        assertEquals(0, telegram.normalizeCalls);
        assertEquals(1.0, meterRegistry.counter("parley.inbound.rejected",
                "channel", "telegram", "reason", "authentication_failed").count());
    }

    @Test
    void absentSignatureFailsClosed() {
        RoutingResult result = router.route(ChannelId.TELEGRAM, bytes("not even json"),
                meta(ChannelId.TELEGRAM, null, null, null));

        assertEquals(401, result.statusCode());
        assertEquals("signature verification failed", result.error());
        assertEquals(0, telegram.verifyCalls);
    }

    @Test
    void unsignedChannelSkipsVerification() {
        StubChannelAdapter web = new StubChannelAdapter(ChannelId.WEB);
        web.signatureRequired = false;
        registry.register(web);

        RoutingResult result = router.route(ChannelId.WEB, bytes("{\"text\":\"hello\"}"),
                meta(ChannelId.WEB, null, null, null));

        assertTrue(result.success());
        assertEquals(0, web.verifyCalls);
    }

    @Test
    void malformedJsonIsRejectedWithoutNormalizing() {
        RoutingResult result = router.route(ChannelId.TELEGRAM, bytes("{\"text\": "),
                meta(ChannelId.TELEGRAM, "token", null, null));

        assertFalse(result.success());
        assertEquals(400, result.statusCode());
        assertEquals(InboundFailure.MALFORMED_PAYLOAD, result.failure());
        assertEquals(0, telegram.normalizeCalls);
    }

    @Test
    void formatTheAdapterDoesNotSpeakIsMalformed() {
        InboundWebhookMeta meta = new InboundWebhookMeta(ChannelId.TELEGRAM, "token", null, null, null,
                null, "application/x-www-form-urlencoded", null);

        RoutingResult result = router.route(ChannelId.TELEGRAM, bytes("text=hi"), meta);

        assertEquals(400, result.statusCode());
        assertEquals(0, telegram.normalizeCalls);
    }

    @Test
    void missingContentTypeFallsBackToAdapterDefault() {
        InboundWebhookMeta meta = new InboundWebhookMeta(ChannelId.TELEGRAM, "token", null, null, null,
                null, null, null);

        RoutingResult result = router.route(ChannelId.TELEGRAM, bytes("{\"text\":\"hi\"}"), meta);

        assertTrue(result.success());
    }

    @Test
    void normalizationFaultCarriesDetail() {
        telegram.normalizer = (payload, meta) -> {
            throw new NormalizationException("missing required field: chat.id");
        };

        RoutingResult result = router.route(ChannelId.TELEGRAM, bytes("{}"),
                meta(ChannelId.TELEGRAM, "token", null, null));

        assertFalse(result.success());
        assertEquals(422, result.statusCode());
        assertEquals("missing required field: chat.id", result.error());
    }

    @Test
    void adapterAcknowledgementPolicyOverridesStatus() {
        ChannelAdapter lenient = new StubChannelAdapter(ChannelId.SMS) {
            @Override
            public int acknowledgementStatus(InboundFailure failure) {
                return 200;
            }
        };
        registry.register(lenient);

        RoutingResult result = router.route(ChannelId.SMS, bytes("{\"text\": "),
                meta(ChannelId.SMS, "sig", null, null));

        assertFalse(result.success());
        assertEquals(200, result.statusCode());
        assertEquals(InboundFailure.MALFORMED_PAYLOAD, result.failure());
    }

    @Test
    void sourceAddressOverLimitIsThrottled() {
        for (int i = 0; i < 3; i++) {
            assertTrue(router.route(ChannelId.TELEGRAM, bytes("{\"text\":\"hi\"}"),
                    meta(ChannelId.TELEGRAM, "token", null, "10.0.0.9")).success());
        }

        RoutingResult result = router.route(ChannelId.TELEGRAM, bytes("{\"text\":\"hi\"}"),
                meta(ChannelId.TELEGRAM, "token", null, "10.0.0.9"));

        assertEquals(429, result.statusCode());
        assertEquals(InboundFailure.RATE_LIMITED, result.failure());
        assertTrue(router.route(ChannelId.TELEGRAM, bytes("{\"text\":\"hi\"}"),
                meta(ChannelId.TELEGRAM, "token", null, "10.0.0.10")).success());
    }

    @Test
    void staleTimestampIsRejectedBeforeVerification() {
        String tenMinutesAgo = String.valueOf(NOW.minus(Duration.ofMinutes(10)).getEpochSecond());

        RoutingResult result = router.route(ChannelId.TELEGRAM, bytes("{\"text\":\"hi\"}"),
                meta(ChannelId.TELEGRAM, "token", tenMinutesAgo, null));

        assertEquals(403, result.statusCode());
        assertEquals(InboundFailure.STALE_REQUEST, result.failure());
        assertEquals(0, telegram.verifyCalls);
    }

    @Test
    void messageForAnotherChannelIsAnInternalFault() {
        telegram.normalizer = (payload, meta) ->
                new NormalizedMessage("x", ChannelId.SMS, "sender", "hi", Instant.EPOCH);

        assertThrows(IllegalStateException.class, () -> router.route(ChannelId.TELEGRAM,
                bytes("{\"text\":\"hi\"}"), meta(ChannelId.TELEGRAM, "token", null, null)));
    }

    @Test
    void multipleAcceptedFormatsAreHonoured() {
        telegram.formats = Set.of(PayloadFormat.JSON, PayloadFormat.FORM);
        InboundWebhookMeta meta = new InboundWebhookMeta(ChannelId.TELEGRAM, "token", null, null, null,
                null, "application/x-www-form-urlencoded", null);

        RoutingResult result = router.route(ChannelId.TELEGRAM, bytes("text=from+a+form"), meta);

        assertTrue(result.success());
        assertEquals("from a form", result.normalizedMessage().text());
    }
}
