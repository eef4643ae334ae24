package com.jumpad.mathapi.filter;

import jakarta.servlet.FilterChain;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("CorrelationIdFilter Unit Tests")
class CorrelationIdFilterTest {

    private CorrelationIdFilter filter;
    private FilterChain filterChain;
    private MockHttpServletRequest request;
    private MockHttpServletResponse response;

    @BeforeEach
    void setUp() {
        filter = new CorrelationIdFilter();
        filterChain = mock(FilterChain.class);
        request = new MockHttpServletRequest("POST", "/somar");
        response = new MockHttpServletResponse();
        MDC.clear();
    }

    @Test
    @DisplayName("incoming correlation ID is reused and echoed")
    void shouldReuseIncomingId() throws Exception {
        request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "req-123");

        filter.doFilterInternal(request, response, filterChain);

        assertEquals("req-123", response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER));
    }

    @Test
    @DisplayName("missing correlation ID is generated")
    void shouldGenerateId() throws Exception {
        filter.doFilterInternal(request, response, filterChain);

        String id = response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER);
        assertNotNull(id);
        assertEquals(8, id.length());
    }

    @Test
    @DisplayName("unsafe header value is replaced")
    void shouldReplaceUnsafeId() throws Exception {
        request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "abc\nFAKE LOG LINE");

        filter.doFilterInternal(request, response, filterChain);

        String id = response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER);
        assertNotEquals("abc\nFAKE LOG LINE", id);
        assertTrue(id.matches("[A-Za-z0-9._-]+"));
    }

    @Test
    @DisplayName("ID is in the MDC during the request and removed afterwards")
    void shouldScopeMdcToRequest() throws Exception {
        request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "req-456");
        AtomicReference<String> seen = new AtomicReference<>();
        doAnswer(invocation -> {
            seen.set(MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY));
            return null;
        }).when(filterChain).doFilter(any(), any());

        filter.doFilterInternal(request, response, filterChain);

        assertEquals("req-456", seen.get());
        assertNull(MDC.get(CorrelationIdFilter.CORRELATION_ID_MDC_KEY));
    }
}
