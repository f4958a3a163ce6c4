package com.parley.web;

import com.parley.channel.InboundFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns adapter defects and I/O failures on the webhook endpoint into a bare 500.
 * Exception detail stays in the log.
 */
@RestControllerAdvice(assignableTypes = InboundWebhookController.class)
public class InboundExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(InboundExceptionHandler.class);

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleInternalFault(Exception e) {
        log.error("Internal fault while handling inbound webhook", e);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", "internal error");
        return ResponseEntity.status(InboundFailure.INTERNAL_FAULT.defaultStatus()).body(body);
    }
}
