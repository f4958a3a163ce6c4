package com.parley.channel.imessage;

import com.fasterxml.jackson.databind.JsonNode;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.Curve;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.source.ImmutableJWKSet;
import com.nimbusds.jose.jwk.source.JWKSource;
import com.nimbusds.jose.jwk.source.JWKSourceBuilder;
import com.nimbusds.jose.proc.BadJOSEException;
import com.nimbusds.jose.proc.JWSVerificationKeySelector;
import com.nimbusds.jose.proc.SecurityContext;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.proc.ConfigurableJWTProcessor;
import com.nimbusds.jwt.proc.DefaultJWTClaimsVerifier;
import com.nimbusds.jwt.proc.DefaultJWTProcessor;
import com.parley.channel.ChannelAdapter;
import com.parley.channel.ChannelCapabilities;
import com.parley.channel.ChannelId;
import com.parley.channel.InboundWebhookMeta;
import com.parley.channel.MessageAttachment;
import com.parley.channel.MessageIds;
import com.parley.channel.NormalizationException;
import com.parley.channel.NormalizedMessage;
import com.parley.channel.ParsedPayload;
import com.parley.channel.Payloads;
import com.parley.config.ParleyProperties;
import com.parley.config.SecretsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.net.MalformedURLException;
import java.net.URI;
import java.security.KeyFactory;
import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;
import java.security.interfaces.ECPublicKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.X509EncodedKeySpec;
import java.text.ParseException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Apple Messages for Business. Each request carries a JWT in the Authorization
 * header, verified against a configured public key or a JWK set URL.
 */
@Component
@ConditionalOnExpression("'${vcap.services.parley-secrets.credentials.imessage-public-key:}' != '' "
        + "or '${parley.channels.imessage.jwks-uri:}' != ''")
public class IMessageChannelAdapter implements ChannelAdapter {

    private static final Logger log = LoggerFactory.getLogger(IMessageChannelAdapter.class);

    private static final String BEARER_PREFIX = "Bearer ";
    private static final Set<JWSAlgorithm> ACCEPTED_ALGORITHMS = Set.of(JWSAlgorithm.RS256, JWSAlgorithm.ES256);

    private static final ChannelCapabilities CAPABILITIES =
            new ChannelCapabilities(true, true, true, true, true, false, 10_000, true, true);

    private final ConfigurableJWTProcessor<SecurityContext> jwtProcessor;
    private final Clock clock;

    public IMessageChannelAdapter(SecretsConfig secretsConfig, ParleyProperties properties, Clock clock) {
        this.clock = clock;
        ParleyProperties.IMessageProperties imessage = properties.getChannels().getImessage();
        this.jwtProcessor = buildProcessor(keySource(secretsConfig.getIMessagePublicKey(), imessage.getJwksUri()),
                imessage.getAudience());
    }

    static ConfigurableJWTProcessor<SecurityContext> buildProcessor(JWKSource<SecurityContext> keySource,
                                                                     String audience) {
        DefaultJWTProcessor<SecurityContext> processor = new DefaultJWTProcessor<>();
        processor.setJWSKeySelector(new JWSVerificationKeySelector<>(ACCEPTED_ALGORITHMS, keySource));
        processor.setJWTClaimsSetVerifier(new DefaultJWTClaimsVerifier<>(
                audience != null && !audience.isBlank() ? Collections.singleton(audience) : null,
                null,
                Set.of("exp"),
                null));
        return processor;
    }

    /**
     * A configured public key wins over the JWK set URL. The key may be a JWK
     * (JSON) or a PEM / Base64 X.509 SubjectPublicKeyInfo, RSA or EC.
     */
    static JWKSource<SecurityContext> keySource(String publicKey, String jwksUri) {
        if (publicKey != null && !publicKey.isBlank()) {
            return new ImmutableJWKSet<>(new JWKSet(parsePublicKey(publicKey.trim())));
        }
        if (jwksUri != null && !jwksUri.isBlank()) {
            try {
                return JWKSourceBuilder.create(URI.create(jwksUri).toURL()).build();
            } catch (MalformedURLException | IllegalArgumentException e) {
                throw new IllegalStateException("Invalid iMessage JWK set URL: " + jwksUri, e);
            }
        }
        throw new IllegalStateException("iMessage channel needs imessage-public-key or parley.channels.imessage.jwks-uri");
    }

    static JWK parsePublicKey(String value) {
        try {
            if (value.startsWith("{")) {
                return JWK.parse(value).toPublicJWK();
            }
            byte[] der = Base64.getMimeDecoder().decode(value
                    .replaceAll("-----(BEGIN|END) PUBLIC KEY-----", "")
                    .replaceAll("\\s", ""));
            PublicKey key = decodeX509(der);
            if (key instanceof RSAPublicKey rsa) {
                return new RSAKey.Builder(rsa).build();
            }
            return new ECKey.Builder(Curve.forECParameterSpec(((ECPublicKey) key).getParams()),
                    (ECPublicKey) key).build();
        } catch (ParseException | IllegalArgumentException e) {
            throw new IllegalStateException("Invalid iMessage public key", e);
        }
    }

    private static PublicKey decodeX509(byte[] der) {
        for (String algorithm : List.of("RSA", "EC")) {
            try {
                return KeyFactory.getInstance(algorithm).generatePublic(new X509EncodedKeySpec(der));
            } catch (InvalidKeySpecException e) {
                log.trace("Public key is not {}", algorithm);
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException(algorithm + " key factory not available", e);
            }
        }
        throw new IllegalArgumentException("public key is neither RSA nor EC");
    }

    @Override
    public ChannelId channelId() { return ChannelId.IMESSAGE; }

    @Override
    public String displayName() { return "Apple Messages for Business"; }

    @Override
    public ChannelCapabilities capabilities() { return CAPABILITIES; }

    @Override
    public boolean verifySignature(InboundWebhookMeta meta, byte[] rawBody) {
        String header = meta.signature();
        if (header == null) return false;
        String token = header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())
                ? header.substring(BEARER_PREFIX.length()).trim()
                : header.trim();
        try {
            JWTClaimsSet claims = jwtProcessor.process(token, null);
            log.debug("iMessage JWT accepted, issuer={}", claims.getIssuer());
            return true;
        } catch (ParseException | BadJOSEException | JOSEException e) {
            log.warn("iMessage JWT rejected: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public NormalizedMessage normalize(ParsedPayload payload, InboundWebhookMeta meta) {
        JsonNode json = payload.json();
        String sender = Payloads.require(payload.field("sourceId"), "sourceId");
        String text = payload.field("body");

        List<MessageAttachment> attachments = new ArrayList<>();
        for (JsonNode attachment : json.path("attachments")) {
            String url = Payloads.text(attachment.path("url"));
            if (url == null) continue;
            String mimeType = Payloads.firstNonBlank(Payloads.text(attachment.path("mimeType")),
                    Payloads.text(attachment.path("mime-type")));
            attachments.add(MessageAttachment.media(MessageAttachment.typeForMime(mimeType), url, mimeType));
        }
        if (text == null && attachments.isEmpty()) {
            throw new NormalizationException("iMessage has no body or attachments");
        }

        String providerId = payload.field("id");
        String id = providerId != null
                ? MessageIds.prefixed(ChannelId.IMESSAGE, providerId)
                : MessageIds.synthesize(ChannelId.IMESSAGE, sender, meta.timestamp(), text);

        return new NormalizedMessage(id, ChannelId.IMESSAGE, sender, null, null,
                payload.field("destinationId"), text, attachments, clock.instant(), payload.asMap());
    }

    @Override
    public List<String> signatureHeaders() { return List.of(HttpHeaders.AUTHORIZATION); }
}
