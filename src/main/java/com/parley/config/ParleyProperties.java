package com.parley.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "parley")
public class ParleyProperties {

    private InboundProperties inbound = new InboundProperties();
    private ChannelsProperties channels = new ChannelsProperties();
    private SecurityProperties security = new SecurityProperties();

    public InboundProperties getInbound() { return inbound; }
    public void setInbound(InboundProperties inbound) { this.inbound = inbound; }

    public ChannelsProperties getChannels() { return channels; }
    public void setChannels(ChannelsProperties channels) { this.channels = channels; }

    public SecurityProperties getSecurity() { return security; }
    public void setSecurity(SecurityProperties security) { this.security = security; }

    public static class InboundProperties {
        /**
         * Externally visible base URL (scheme + host) providers post to. Twilio signs the
         * URL it called, which differs from the local one behind a proxy or router.
         */
        private String publicBaseUrl;
        private Duration replayWindow = Duration.ofMinutes(5);
        private RateLimitProperties rateLimit = new RateLimitProperties();

        public String getPublicBaseUrl() { return publicBaseUrl; }
        public void setPublicBaseUrl(String publicBaseUrl) { this.publicBaseUrl = publicBaseUrl; }
        public Duration getReplayWindow() { return replayWindow; }
        public void setReplayWindow(Duration replayWindow) { this.replayWindow = replayWindow; }
        public RateLimitProperties getRateLimit() { return rateLimit; }
        public void setRateLimit(RateLimitProperties rateLimit) { this.rateLimit = rateLimit; }
    }

    public static class RateLimitProperties {
        private int maxRequests = 30;
        private Duration window = Duration.ofSeconds(60);

        public int getMaxRequests() { return maxRequests; }
        public void setMaxRequests(int maxRequests) { this.maxRequests = maxRequests; }
        public Duration getWindow() { return window; }
        public void setWindow(Duration window) { this.window = window; }
    }

    public static class ChannelsProperties {
        private IMessageProperties imessage = new IMessageProperties();

        public IMessageProperties getImessage() { return imessage; }
        public void setImessage(IMessageProperties imessage) { this.imessage = imessage; }
    }

    public static class IMessageProperties {
        private String jwksUri;
        private String audience;

        public String getJwksUri() { return jwksUri; }
        public void setJwksUri(String jwksUri) { this.jwksUri = jwksUri; }
        public String getAudience() { return audience; }
        public void setAudience(String audience) { this.audience = audience; }
    }

    public static class SecurityProperties {
        private PiiProperties pii = new PiiProperties();

        public PiiProperties getPii() { return pii; }
        public void setPii(PiiProperties pii) { this.pii = pii; }
    }

    public static class PiiProperties {
        private boolean redactInLogs = true;
        private List<String> redactPatterns = new ArrayList<>();

        public boolean isRedactInLogs() { return redactInLogs; }
        public void setRedactInLogs(boolean redactInLogs) { this.redactInLogs = redactInLogs; }
        public List<String> getRedactPatterns() { return redactPatterns; }
        public void setRedactPatterns(List<String> redactPatterns) { this.redactPatterns = redactPatterns; }
    }
}
