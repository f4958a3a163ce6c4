package com.parley.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.parley.channel.ChannelAdapter;
import com.parley.channel.ChannelRegistry;
import com.parley.channel.PayloadParser;
import com.parley.security.ReplayGuard;
import com.parley.security.SourceIpRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Wires the inbound pipeline. The registry is filled here, once, from every
 * adapter bean whose provider credentials are present.
 */
@Configuration
public class InboundConfig {

    private static final Logger log = LoggerFactory.getLogger(InboundConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ChannelRegistry channelRegistry(List<ChannelAdapter> adapters) {
        ChannelRegistry registry = new ChannelRegistry(adapters);
        log.info("Inbound channels registered: {}", registry.listChannels());
        return registry;
    }

    @Bean
    public PayloadParser payloadParser(ObjectMapper objectMapper) {
        return new PayloadParser(objectMapper);
    }

    @Bean
    public SourceIpRateLimiter sourceIpRateLimiter(ParleyProperties properties, Clock clock) {
        return new SourceIpRateLimiter(properties.getInbound().getRateLimit(), clock);
    }

    @Bean
    public ReplayGuard replayGuard(ParleyProperties properties, Clock clock) {
        return new ReplayGuard(properties.getInbound().getReplayWindow(), clock);
    }
}
