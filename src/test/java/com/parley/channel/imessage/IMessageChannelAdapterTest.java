package com.parley.channel.imessage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.crypto.ECDSASigner;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jose.jwk.Curve;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.gen.ECKeyGenerator;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import com.parley.channel.ChannelId;
import com.parley.channel.InboundWebhookMeta;
import com.parley.channel.MessageAttachment;
import com.parley.channel.NormalizationException;
import com.parley.channel.NormalizedMessage;
import com.parley.channel.ParsedPayload;
import com.parley.channel.PayloadFormat;
import com.parley.channel.PayloadParser;
import com.parley.config.ParleyProperties;
import com.parley.config.SecretsConfig;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.Date;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class IMessageChannelAdapterTest {

    private static KeyPair rsaKeys;

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
    private final PayloadParser parser = new PayloadParser(new ObjectMapper());

    @BeforeAll
    static void generateKeys() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        rsaKeys = generator.generateKeyPair();
    }

    private IMessageChannelAdapter adapter(String publicKey, String audience) {
        SecretsConfig secrets = mock(SecretsConfig.class);
        when(secrets.getIMessagePublicKey()).thenReturn(publicKey);
        ParleyProperties properties = new ParleyProperties();
        properties.getChannels().getImessage().setAudience(audience);
        return new IMessageChannelAdapter(secrets, properties, clock);
    }

    private static String rsaPublicKeyBase64() {
        return Base64.getEncoder().encodeToString(rsaKeys.getPublic().getEncoded());
    }

    private static String token(JWSAlgorithm algorithm, JWSSigner signer, Instant expiresAt, String audience)
            throws Exception {
        JWTClaimsSet.Builder claims = new JWTClaimsSet.Builder()
                .issuer("apple-business-chat")
                .subject("biz-1")
                .issueTime(new Date());
        if (expiresAt != null) claims.expirationTime(Date.from(expiresAt));
        if (audience != null) claims.audience(audience);
        SignedJWT jwt = new SignedJWT(new JWSHeader(algorithm), claims.build());
        jwt.sign(signer);
        return jwt.serialize();
    }

    private static String rsaToken(Instant expiresAt, String audience) throws Exception {
        return token(JWSAlgorithm.RS256, new RSASSASigner(rsaKeys.getPrivate()), expiresAt, audience);
    }

    private static InboundWebhookMeta meta(String authorization) {
        return new InboundWebhookMeta(ChannelId.IMESSAGE, authorization, new byte[0]);
    }

    private static Instant inOneHour() {
        return Instant.now().plus(Duration.ofHours(1));
    }

    @Test
    void acceptsRs256TokenSignedByConfiguredKey() throws Exception {
        IMessageChannelAdapter adapter = adapter(rsaPublicKeyBase64(), null);

        assertTrue(adapter.verifySignature(meta("Bearer " + rsaToken(inOneHour(), null)), new byte[0]));
    }

    @Test
    void acceptsPemEncodedKey() throws Exception {
        String pem = "-----BEGIN PUBLIC KEY-----\n"
                + Base64.getMimeEncoder().encodeToString(rsaKeys.getPublic().getEncoded())
                + "\n-----END PUBLIC KEY-----\n";
        IMessageChannelAdapter adapter = adapter(pem, null);

        assertTrue(adapter.verifySignature(meta("Bearer " + rsaToken(inOneHour(), null)), new byte[0]));
    }

    @Test
    void acceptsEs256TokenWithJwkKey() throws Exception {
        ECKey ecKey = new ECKeyGenerator(Curve.P_256).generate();
        IMessageChannelAdapter adapter = adapter(ecKey.toPublicJWK().toJSONString(), null);

        String jwt = token(JWSAlgorithm.ES256, new ECDSASigner(ecKey), inOneHour(), null);

        assertTrue(adapter.verifySignature(meta("Bearer " + jwt), new byte[0]));
    }

    @Test
    void rejectsExpiredToken() throws Exception {
        IMessageChannelAdapter adapter = adapter(rsaPublicKeyBase64(), null);

        String expired = rsaToken(Instant.now().minus(Duration.ofHours(2)), null);

        assertFalse(adapter.verifySignature(meta("Bearer " + expired), new byte[0]));
    }

    @Test
    void rejectsTokenWithoutExpiry() throws Exception {
        IMessageChannelAdapter adapter = adapter(rsaPublicKeyBase64(), null);

        assertFalse(adapter.verifySignature(meta("Bearer " + rsaToken(null, null)), new byte[0]));
    }

    @Test
    void enforcesConfiguredAudience() throws Exception {
        IMessageChannelAdapter adapter = adapter(rsaPublicKeyBase64(), "parley-biz");

        assertTrue(adapter.verifySignature(meta("Bearer " + rsaToken(inOneHour(), "parley-biz")), new byte[0]));
        assertFalse(adapter.verifySignature(meta("Bearer " + rsaToken(inOneHour(), "someone-else")), new byte[0]));
    }

    @Test
    void rejectsTokenFromAnotherKey() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        KeyPair other = generator.generateKeyPair();
        IMessageChannelAdapter adapter = adapter(rsaPublicKeyBase64(), null);

        String forged = token(JWSAlgorithm.RS256, new RSASSASigner(other.getPrivate()), inOneHour(), null);

        assertFalse(adapter.verifySignature(meta("Bearer " + forged), new byte[0]));
    }

    @Test
    void rejectsGarbageToken() {
        IMessageChannelAdapter adapter = adapter(rsaPublicKeyBase64(), null);

        assertFalse(adapter.verifySignature(meta("Bearer not.a.jwt"), new byte[0]));
        assertFalse(adapter.verifySignature(meta(null), new byte[0]));
    }

    @Test
    void refusesToStartWithoutAnyKey() {
        assertThrows(IllegalStateException.class, () -> adapter("", null));
        assertThrows(IllegalStateException.class, () -> adapter("definitely not a key", null));
    }

    @Test
    void normalizesMessage() throws Exception {
        ParsedPayload payload = parser.parse("""
                {"id":"msg-77","sourceId":"urn:mbid:abc","destinationId":"biz-1","body":"Are you open Sunday?",
                 "attachments":[{"url":"https://cdn.example.com/a.jpg","mimeType":"image/jpeg"},{"name":"no-url"}]}
                """.getBytes(StandardCharsets.UTF_8), PayloadFormat.JSON, "application/json");

        NormalizedMessage message = adapter(rsaPublicKeyBase64(), null).normalize(payload, meta(null));

        assertEquals("imessage-msg-77", message.id());
        assertEquals(ChannelId.IMESSAGE, message.channel());
        assertEquals("urn:mbid:abc", message.senderAddress());
        assertEquals("biz-1", message.recipientAddress());
        assertEquals("Are you open Sunday?", message.text());
        assertEquals(List.of(MessageAttachment.media(MessageAttachment.Type.IMAGE,
                "https://cdn.example.com/a.jpg", "image/jpeg")), message.attachments());
    }

    @Test
    void messageWithoutSourceIsANormalizationFault() throws Exception {
        ParsedPayload payload = parser.parse("{\"body\":\"hi\"}".getBytes(StandardCharsets.UTF_8),
                PayloadFormat.JSON, "application/json");
        IMessageChannelAdapter adapter = adapter(rsaPublicKeyBase64(), null);

        assertThrows(NormalizationException.class, () -> adapter.normalize(payload, meta(null)));
    }
}
