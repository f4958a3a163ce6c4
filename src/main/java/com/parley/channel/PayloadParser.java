package com.parley.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.springframework.core.ResolvableType;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ReactiveHttpInputMessage;
import org.springframework.http.codec.multipart.DefaultPartHttpMessageReader;
import org.springframework.http.codec.multipart.FormFieldPart;
import org.springframework.http.codec.multipart.MultipartHttpMessageReader;
import org.springframework.http.codec.multipart.Part;
import org.springframework.http.converter.FormHttpMessageConverter;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Collections;
import java.util.List;

/**
 * Decodes a captured request body into a {@link ParsedPayload}. Works purely on the
 * byte array, so the same capture can also feed signature verification.
 */
public class PayloadParser {

    private static final FormHttpMessageConverter FORM_CONVERTER = new FormHttpMessageConverter();
    private static final Duration MULTIPART_TIMEOUT = Duration.ofSeconds(10);
    private static final ResolvableType MULTIPART_TYPE =
            ResolvableType.forClassWithGenerics(MultiValueMap.class, String.class, Part.class);

    // Rejects bodies with content after the top-level value.
    private final ObjectReader jsonReader;
    private final MultipartHttpMessageReader multipartReader =
            new MultipartHttpMessageReader(new DefaultPartHttpMessageReader());

    public PayloadParser(ObjectMapper objectMapper) {
        this.jsonReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public ParsedPayload parse(byte[] body, PayloadFormat format, String contentType)
            throws MalformedPayloadException {
        if (body == null || body.length == 0) {
            throw new MalformedPayloadException("empty body");
        }
        return switch (format) {
            case JSON -> ParsedPayload.ofJson(parseJson(body));
            case FORM -> ParsedPayload.ofFields(PayloadFormat.FORM, decodeForm(body, contentType));
            case MULTIPART -> ParsedPayload.ofFields(PayloadFormat.MULTIPART,
                    decodeMultipart(body, contentType));
        };
    }

    private JsonNode parseJson(byte[] body) throws MalformedPayloadException {
        JsonNode node;
        try {
            node = jsonReader.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("invalid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MalformedPayloadException("unreadable JSON body", e);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedPayloadException("expected a JSON object");
        }
        return node;
    }

    /**
     * Decodes an {@code application/x-www-form-urlencoded} body. Shared with adapters
     * whose signature covers the decoded parameters.
     */
    public static MultiValueMap<String, String> decodeForm(byte[] body, String contentType)
            throws MalformedPayloadException {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(formContentType(contentType));
        HttpInputMessage message = new HttpInputMessage() {
            @Override
            public InputStream getBody() {
                return new ByteArrayInputStream(body);
            }

            @Override
            public HttpHeaders getHeaders() {
                return headers;
            }
        };
        try {
            return FORM_CONVERTER.read(null, message);
        } catch (IOException | HttpMessageNotReadableException | IllegalArgumentException e) {
            throw new MalformedPayloadException("invalid form body", e);
        }
    }

    private static MediaType formContentType(String contentType) {
        if (PayloadFormat.fromContentType(contentType).orElse(null) != PayloadFormat.FORM) {
            return MediaType.APPLICATION_FORM_URLENCODED;
        }
        return MediaType.parseMediaType(contentType);
    }

    private MultiValueMap<String, String> decodeMultipart(byte[] body, String contentType)
            throws MalformedPayloadException {
        HttpHeaders headers = new HttpHeaders();
        try {
            headers.setContentType(MediaType.parseMediaType(contentType));
        } catch (InvalidMediaTypeException e) {
            throw new MalformedPayloadException("invalid multipart content type", e);
        }
        ReactiveHttpInputMessage message = new ReactiveHttpInputMessage() {
            @Override
            public Flux<DataBuffer> getBody() {
                return Flux.defer(() -> Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(body)));
            }

            @Override
            public HttpHeaders getHeaders() {
                return headers;
            }
        };

        MultiValueMap<String, Part> parts;
        try {
            parts = multipartReader.readMono(MULTIPART_TYPE,
                    message, Collections.emptyMap()).block(MULTIPART_TIMEOUT);
        } catch (RuntimeException e) {
            throw new MalformedPayloadException("invalid multipart body: " + e.getMessage(), e);
        }
        if (parts == null) {
            throw new MalformedPayloadException("empty multipart body");
        }

        MultiValueMap<String, String> fields = new LinkedMultiValueMap<>();
        parts.forEach((name, values) -> collectFields(name, values, fields));
        return fields;
    }

    private void collectFields(String name, List<Part> values, MultiValueMap<String, String> fields) {
        for (Part part : values) {
            if (part instanceof FormFieldPart fieldPart) {
                fields.add(name, fieldPart.value());
            } else {
                // file content is not carried on the envelope; drop any spooled copy
                part.delete().onErrorResume(e -> Mono.empty()).block(MULTIPART_TIMEOUT);
            }
        }
    }
}
