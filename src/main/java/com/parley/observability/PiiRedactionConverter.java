package com.parley.observability;

import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Logback converter that redacts sender addresses from log messages.
 * Defaults cover e-mail addresses, E.164-style phone numbers and bare 7 to 15 digit numbers; extra patterns
 * come from parley.security.pii.redact-patterns through LoggingConfig.
 */
public class PiiRedactionConverter extends ClassicConverter {

    static final String REDACTED = "[REDACTED]";

    private static final List<Pattern> DEFAULT_PATTERNS = List.of(
            Pattern.compile("[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}"),  // Email
            Pattern.compile("\\+\\d{7,15}\\b"),                                  // E.164 phone
            // Phone numbers and chat ids without a leading '+', e.g. WhatsApp and Telegram senders
            Pattern.compile("(?<![\\w.-])-?\\d{7,15}(?![\\w-])")
    );

    private static volatile List<Pattern> configuredPatterns = null;
    private static volatile boolean enabled = true;

    public static void setConfiguredPatterns(List<String> patterns) {
        List<Pattern> compiled = new ArrayList<>(DEFAULT_PATTERNS);
        if (patterns != null) {
            for (String p : patterns) {
                compiled.add(Pattern.compile(p));
            }
        }
        configuredPatterns = compiled;
    }

    public static void setEnabled(boolean value) {
        enabled = value;
    }

    static void reset() {
        configuredPatterns = null;
        enabled = true;
    }

    @Override
    public String convert(ILoggingEvent event) {
        return redact(event.getFormattedMessage());
    }

    public static String redact(String message) {
        if (message == null) return "";
        if (!enabled) return message;

        List<Pattern> patterns = configuredPatterns != null ? configuredPatterns : DEFAULT_PATTERNS;
        for (Pattern pattern : patterns) {
            message = pattern.matcher(message).replaceAll(REDACTED);
        }
        return message;
    }
}
