package com.parley.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.HexFormat;

/**
 * HMAC helpers shared by the channel adapters.
 */
public final class WebhookSignatures {

    private static final Logger log = LoggerFactory.getLogger(WebhookSignatures.class);

    public static final String HMAC_SHA1 = "HmacSHA1";
    public static final String HMAC_SHA256 = "HmacSHA256";

    private WebhookSignatures() {
    }

    public static byte[] hmac(String algorithm, String secret, byte[] data) {
        try {
            Mac mac = Mac.getInstance(algorithm);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), algorithm));
            return mac.doFinal(data);
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            log.error("HMAC computation failed for algorithm={}", algorithm, e);
            return new byte[0];
        }
    }

    public static String hmacBase64(String algorithm, String secret, String data) {
        return Base64.getEncoder().encodeToString(
                hmac(algorithm, secret, data.getBytes(StandardCharsets.UTF_8)));
    }

    public static String hmacHex(String algorithm, String secret, byte[] data) {
        return HexFormat.of().formatHex(hmac(algorithm, secret, data));
    }

    /**
     * Compares two strings without short-circuiting on the first differing byte.
     */
    public static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) return false;
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }

    public static boolean isConfigured(String secret) {
        return secret != null && !secret.isBlank();
    }
}
