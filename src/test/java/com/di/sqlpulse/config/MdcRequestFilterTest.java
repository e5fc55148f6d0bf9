package com.di.sqlpulse.config;

import com.di.sqlpulse.util.MdcPropagation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MdcRequestFilter Tests")
class MdcRequestFilterTest {

    private final MdcRequestFilter filter = new MdcRequestFilter();

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("Should tag the request with the caller's id, its path and the connection")
    void testFilter_TagsRequest() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/monitoring/performance-history");
        request.addHeader(MdcRequestFilter.REQUEST_ID_HEADER, "dash-123");
        request.setParameter("connectionId", "PROD");
        MockHttpServletResponse response = new MockHttpServletResponse();
        Map<String, String> seen = new HashMap<>();

        filter.doFilter(request, response, (req, res) -> seen.putAll(MdcPropagation.copyMdc()));

        assertEquals("dash-123", seen.get(MdcRequestFilter.REQUEST_ID));
        assertEquals("/api/monitoring/performance-history", seen.get(MdcRequestFilter.REQUEST_PATH));
        assertEquals("PROD", seen.get(MdcPropagation.CONNECTION_ID));
        assertEquals("dash-123", response.getHeader(MdcRequestFilter.REQUEST_ID_HEADER));
        assertTrue(MdcPropagation.copyMdc().isEmpty());
    }

    @Test
    @DisplayName("Should generate an id when the header is missing or unsafe")
    void testRequestIdOf_Generated() {
        assertTrue(MdcRequestFilter.requestIdOf(null).startsWith("req-"));
        assertTrue(MdcRequestFilter.requestIdOf("a b\nforged=1").startsWith("req-"));
        assertEquals("abc-1", MdcRequestFilter.requestIdOf(" abc-1 "));
    }

    @Test
    @DisplayName("Should skip the connection tag when the parameter is absent")
    void testFilter_NoConnection() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/monitoring/collect/schedule");
        Map<String, String> seen = new HashMap<>();

        filter.doFilter(request, new MockHttpServletResponse(), (req, res) -> seen.putAll(MdcPropagation.copyMdc()));

        assertFalse(seen.containsKey(MdcPropagation.CONNECTION_ID));
        assertTrue(seen.get(MdcRequestFilter.REQUEST_ID).startsWith("req-"));
    }
}
