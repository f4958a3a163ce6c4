package com.parley.security;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class WebhookSignaturesTest {

    @Test
    void computesKnownHmacSha256() {
        // RFC 4231 test case 2
        assertEquals("5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843",
                WebhookSignatures.hmacHex(WebhookSignatures.HMAC_SHA256, "Jefe",
                        "what do ya want for nothing?".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void computesKnownHmacSha1Base64() {
        // RFC 2202 test case 2
        assertEquals("7/zfauXrL6LSdBbV8YTfnCWafHk=",
                WebhookSignatures.hmacBase64(WebhookSignatures.HMAC_SHA1, "Jefe", "what do ya want for nothing?"));
    }

    @Test
    void constantTimeEqualsHandlesNullsAndLengths() {
        assertTrue(WebhookSignatures.constantTimeEquals("abc", "abc"));
        assertFalse(WebhookSignatures.constantTimeEquals("abc", "abd"));
        assertFalse(WebhookSignatures.constantTimeEquals("abc", "abcd"));
        assertFalse(WebhookSignatures.constantTimeEquals(null, "abc"));
        assertFalse(WebhookSignatures.constantTimeEquals("abc", null));
    }

    @Test
    void blankSecretIsNotConfigured() {
        assertFalse(WebhookSignatures.isConfigured(null));
        assertFalse(WebhookSignatures.isConfigured("  "));
        assertTrue(WebhookSignatures.isConfigured("s3cret"));
    }
}
