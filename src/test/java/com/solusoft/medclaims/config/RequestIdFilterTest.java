package com.solusoft.medclaims.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;

public class RequestIdFilterTest {

    @Mock
    private FilterChain chain;

    private RequestIdFilter filter;

    private MockHttpServletRequest request;

    private MockHttpServletResponse response;

    private final AtomicReference<String> idSeenDownstream = new AtomicReference<>();

    @BeforeEach
    public void setup() throws Exception {
        MockitoAnnotations.openMocks(this);
        filter = new RequestIdFilter();
        request = new MockHttpServletRequest("GET", "/api/v1/claims");
        response = new MockHttpServletResponse();
        doAnswer(inv -> {
            idSeenDownstream.set(MDC.get(RequestIdFilter.MDC_KEY));
            return null;
        }).when(chain).doFilter(any(ServletRequest.class), any(ServletResponse.class));
    }

    @Test
    public void testDoFilter_wellFormedId_isReused() throws Exception {
        request.addHeader(RequestIdFilter.HEADER_KEY, "gateway-7f3a.01");

        filter.doFilter(request, response, chain);

        assertEquals("gateway-7f3a.01", idSeenDownstream.get());
        assertEquals("gateway-7f3a.01", response.getHeader(RequestIdFilter.HEADER_KEY));
        assertEquals("gateway-7f3a.01", request.getAttribute(RequestIdFilter.REQUEST_ATTRIBUTE));
        assertNull(MDC.get(RequestIdFilter.MDC_KEY));
    }

    @Test
    public void testDoFilter_missingId_generatesUuid() throws Exception {
        filter.doFilter(request, response, chain);

        String generated = response.getHeader(RequestIdFilter.HEADER_KEY);
        assertEquals(generated, UUID.fromString(generated).toString());
        assertEquals(generated, idSeenDownstream.get());
    }

    @Test
    public void testDoFilter_headerWithLineBreak_isReplaced() throws Exception {
        request.addHeader(RequestIdFilter.HEADER_KEY, "abc\r\nSet-Cookie: session=1");

        filter.doFilter(request, response, chain);

        String used = response.getHeader(RequestIdFilter.HEADER_KEY);
        assertNotEquals("abc\r\nSet-Cookie: session=1", used);
        UUID.fromString(used);
    }

    @Test
    public void testResolveRequestId_boundsLength() {
        String longest = "a".repeat(RequestIdFilter.MAX_LENGTH);

        assertEquals(longest, RequestIdFilter.resolveRequestId(longest));
        assertNotEquals(longest + "a", RequestIdFilter.resolveRequestId(longest + "a"));
        assertNotEquals("", RequestIdFilter.resolveRequestId("   "));
        assertEquals("req-1", RequestIdFilter.resolveRequestId("  req-1 "));
    }

    @Test
    public void testDoFilter_chainFails_stillClearsMdc() throws Exception {
        doThrow(new ServletException("boom")).when(chain).doFilter(any(ServletRequest.class), any(ServletResponse.class));

        assertThrows(ServletException.class, () -> filter.doFilter(request, response, chain));

        verify(chain).doFilter(any(ServletRequest.class), any(ServletResponse.class));
        assertNull(MDC.get(RequestIdFilter.MDC_KEY));
    }
}
