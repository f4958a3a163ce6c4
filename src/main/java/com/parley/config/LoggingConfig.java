package com.parley.config;

import com.parley.observability.PiiRedactionConverter;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Pushes configured PII patterns into the Logback {@link PiiRedactionConverter}.
 */
@Configuration
public class LoggingConfig {

    private static final Logger log = LoggerFactory.getLogger(LoggingConfig.class);

    private final ParleyProperties properties;

    public LoggingConfig(ParleyProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void configurePiiRedaction() {
        ParleyProperties.PiiProperties pii = properties.getSecurity().getPii();
        if (!pii.isRedactInLogs()) {
            log.warn("PII redaction in logs is disabled; sender addresses will be logged in clear");
            PiiRedactionConverter.setEnabled(false);
            return;
        }
        List<String> patterns = pii.getRedactPatterns();
        if (patterns != null && !patterns.isEmpty()) {
            log.info("Configuring {} additional PII redaction patterns", patterns.size());
            PiiRedactionConverter.setConfiguredPatterns(patterns);
        } else {
            log.info("Using default PII redaction patterns (phone, email)");
        }
    }
}
