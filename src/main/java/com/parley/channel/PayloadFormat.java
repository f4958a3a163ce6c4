package com.parley.channel;

import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;

import java.util.Optional;

public enum PayloadFormat {

    FORM,
    JSON,
    MULTIPART;

    /**
     * Resolves the format from a Content-Type header value. Empty when the header is
     * missing, unparseable or names a type none of the adapters speak.
     */
    public static Optional<PayloadFormat> fromContentType(String contentType) {
        if (contentType == null || contentType.isBlank()) return Optional.empty();
        MediaType mediaType;
        try {
            mediaType = MediaType.parseMediaType(contentType);
        } catch (InvalidMediaTypeException e) {
            return Optional.empty();
        }
        if (MediaType.APPLICATION_FORM_URLENCODED.includes(mediaType)) return Optional.of(FORM);
        if (MediaType.MULTIPART_FORM_DATA.includes(mediaType)) return Optional.of(MULTIPART);
        if (MediaType.APPLICATION_JSON.isCompatibleWith(mediaType)
                || mediaType.getSubtype().endsWith("+json")) {
            return Optional.of(JSON);
        }
        return Optional.empty();
    }
}
