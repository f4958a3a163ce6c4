package com.parley.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * Provider credentials, bound from the {@code parley-secrets} user-provided service.
 */
@Configuration
public class SecretsConfig {

    @Value("${vcap.services.parley-secrets.credentials.twilio-auth-token:}")
    private String twilioAuthToken;

    @Value("${vcap.services.parley-secrets.credentials.whatsapp-app-secret:}")
    private String whatsAppAppSecret;

    @Value("${vcap.services.parley-secrets.credentials.whatsapp-verify-token:}")
    private String whatsAppVerifyToken;

    @Value("${vcap.services.parley-secrets.credentials.telegram-webhook-secret:}")
    private String telegramWebhookSecret;

    @Value("${vcap.services.parley-secrets.credentials.sendgrid-verification-key:}")
    private String sendGridVerificationKey;

    @Value("${vcap.services.parley-secrets.credentials.imessage-public-key:}")
    private String iMessagePublicKey;

    public String getTwilioAuthToken() { return twilioAuthToken; }
    public String getWhatsAppAppSecret() { return whatsAppAppSecret; }
    public String getWhatsAppVerifyToken() { return whatsAppVerifyToken; }
    public String getTelegramWebhookSecret() { return telegramWebhookSecret; }
    public String getSendGridVerificationKey() { return sendGridVerificationKey; }
    public String getIMessagePublicKey() { return iMessagePublicKey; }
}
