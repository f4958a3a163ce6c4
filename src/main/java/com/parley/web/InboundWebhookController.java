package com.parley.web;

import com.parley.channel.ChallengeRequest;
import com.parley.channel.ChallengeResponse;
import com.parley.channel.ChannelAdapter;
import com.parley.channel.ChannelId;
import com.parley.channel.ChannelRegistry;
import com.parley.channel.InboundFailure;
import com.parley.channel.InboundRouter;
import com.parley.channel.InboundWebhookMeta;
import com.parley.channel.NormalizedMessage;
import com.parley.channel.RoutingResult;
import com.parley.config.ParleyProperties;
import com.parley.observability.ParleyMetrics;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.security.Principal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Single public entry point for provider webhooks: {@code /inbound/{channel}}.
 * The body is read here, once, before anything can consume it as form parameters.
 */
@RestController
@RequestMapping("/inbound")
public class InboundWebhookController {

    private static final Logger log = LoggerFactory.getLogger(InboundWebhookController.class);

    private static final int PREVIEW_LENGTH = 80;

    private final ChannelRegistry registry;
    private final InboundRouter router;
    private final ParleyMetrics metrics;
    private final ParleyProperties properties;

    public InboundWebhookController(ChannelRegistry registry, InboundRouter router,
                                    ParleyMetrics metrics, ParleyProperties properties) {
        this.registry = registry;
        this.router = router;
        this.metrics = metrics;
        this.properties = properties;
    }

    @PostMapping("/{channel}")
    public ResponseEntity<Map<String, Object>> receive(@PathVariable("channel") String channelSegment,
                                                       HttpServletRequest request,
                                                       Principal principal) throws IOException {
        Optional<ChannelId> channelId = ChannelId.fromId(channelSegment);
        if (channelId.isEmpty()) {
            metrics.recordUnknownChannel();
            log.warn("Webhook for unknown channel rejected");
            return respond(InboundFailure.UNKNOWN_CHANNEL.defaultStatus(), false, null, "unknown channel");
        }
        ChannelId channel = channelId.get();

        byte[] body = request.getInputStream().readAllBytes();

        Optional<ChannelAdapter> adapter = registry.get(channel);
        String signature = adapter.map(a -> signature(a, request)).orElse(null);
        String timestamp = adapter.map(a -> request.getHeader(a.timestampHeader())).orElse(null);

        InboundWebhookMeta meta = new InboundWebhookMeta(
                channel,
                signature,
                timestamp,
                clientIp(request),
                signature != null ? body : null,
                requestUrl(request),
                request.getContentType(),
                principal != null ? principal.getName() : null);

        RoutingResult result = router.route(channel, body, meta);
        if (!result.success()) {
            return respond(result.statusCode(), false, null, result.error());
        }

        NormalizedMessage message = result.normalizedMessage();
        log.info("Inbound message accepted channel={} id={} from={}",
                channel, message.id(), message.senderAddress());
        log.debug("Inbound message id={} preview={}", message.id(), message.textPreview(PREVIEW_LENGTH));
        return respond(result.statusCode(), true, message.id(), null);
    }

    @GetMapping("/{channel}")
    public ResponseEntity<?> verify(@PathVariable("channel") String channelSegment,
                                    @RequestParam Map<String, String> queryParams,
                                    @RequestHeader HttpHeaders headers) {
        Optional<ChannelId> channelId = ChannelId.fromId(channelSegment);
        if (channelId.isEmpty()) {
            metrics.recordUnknownChannel();
            return respond(InboundFailure.UNKNOWN_CHANNEL.defaultStatus(), false, null, "unknown channel");
        }
        ChannelId channel = channelId.get();
        Optional<ChannelAdapter> adapter = registry.get(channel);
        if (adapter.isEmpty()) {
            return respond(InboundFailure.CHANNEL_NOT_CONFIGURED.defaultStatus(), false, null,
                    "channel not configured");
        }

        Optional<ChallengeResponse> challenge = adapter.get()
                .handleVerificationChallenge(new ChallengeRequest(channel, queryParams, headers));
        metrics.recordChallenge(channel, challenge.isPresent());
        if (challenge.isPresent()) {
            ChallengeResponse response = challenge.get();
            log.info("Answered webhook verification challenge for channel={}", channel);
            return ResponseEntity.status(response.status())
                    .contentType(response.contentType())
                    .body(response.body());
        }

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("channel", channel.id());
        status.put("status", "active");
        status.put("capabilities", adapter.get().capabilities());
        return ResponseEntity.ok(status);
    }

    private static String signature(ChannelAdapter adapter, HttpServletRequest request) {
        for (String header : adapter.signatureHeaders()) {
            String value = request.getHeader(header);
            if (value != null && !value.isBlank()) return value;
        }
        return null;
    }

    /** URL the provider called, which is what Twilio signs. */
    private String requestUrl(HttpServletRequest request) {
        String publicBaseUrl = properties.getInbound().getPublicBaseUrl();
        StringBuilder url = publicBaseUrl != null && !publicBaseUrl.isBlank()
                ? new StringBuilder(stripTrailingSlash(publicBaseUrl)).append(request.getRequestURI())
                : new StringBuilder(request.getRequestURL());
        if (request.getQueryString() != null) {
            url.append('?').append(request.getQueryString());
        }
        return url.toString();
    }

    /**
     * Socket address only. Trusted proxies are resolved into it by the server's
     * forward-headers strategy; forwarding headers sent by the client are ignored.
     */
    static String clientIp(HttpServletRequest request) {
        return request.getRemoteAddr();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static ResponseEntity<Map<String, Object>> respond(int status, boolean success,
                                                               String messageId, String error) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", success);
        if (messageId != null) body.put("messageId", messageId);
        if (error != null) body.put("error", error);
        return ResponseEntity.status(status).body(body);
    }
}
