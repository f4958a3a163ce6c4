package com.parley.observability;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @Test
    void propagatesRequestIdAndChannelDuringTheRequest() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/inbound/telegram");
        request.addHeader("X-Request-ID", "req-1");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> requestId = new AtomicReference<>();
        AtomicReference<String> channel = new AtomicReference<>();
        FilterChain chain = (req, res) -> {
            requestId.set(MDC.get("requestId"));
            channel.set(MDC.get("channel"));
        };

        filter.doFilter(request, response, chain);

        assertEquals("req-1", requestId.get());
        assertEquals("telegram", channel.get());
        assertEquals("req-1", response.getHeader("X-Request-ID"));
        assertNull(MDC.get("requestId"));
        assertNull(MDC.get("channel"));
    }

    @Test
    void generatesRequestIdWhenAbsent() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/actuator/health");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> channel = new AtomicReference<>("unset");

        filter.doFilter(request, response, (req, res) -> channel.set(MDC.get("channel")));

        assertEquals(8, response.getHeader("X-Request-ID").length());
        assertNull(channel.get());
    }

    @Test
    void extractsChannelSegment() {
        assertEquals("sms", CorrelationIdFilter.channelSegment("/inbound/sms"));
        assertEquals("sms", CorrelationIdFilter.channelSegment("/inbound/sms/extra"));
        assertNull(CorrelationIdFilter.channelSegment("/inbound/"));
        assertNull(CorrelationIdFilter.channelSegment("/actuator/health"));
        assertNull(CorrelationIdFilter.channelSegment(null));
    }
}
