package com.di.sqlpulse.exception;

import com.di.sqlpulse.config.MdcRequestFilter;
import com.di.sqlpulse.tier.Tier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GlobalExceptionHandler Tests")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("Should return 400 with every settings violation")
    void testInvalidSettings() {
        InvalidSettingsException e = new InvalidSettingsException(
                List.of("Invalid schema name: 'A B'", "retentionDays must be between 7 and 90"));

        ResponseEntity<ErrorResponse> response = handler.handleInvalidSettings(e);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals(400, response.getBody().getStatus());
        assertEquals(ErrorCategory.VALIDATION_ERROR.name(), response.getBody().getCategory());
        assertEquals(e.getViolations(), response.getBody().getDetails().get("violations"));
    }

    @Test
    @DisplayName("Should name the offending field of an invalid identifier")
    void testInvalidIdentifier() {
        ResponseEntity<ErrorResponse> response =
                handler.handleInvalidIdentifier(new InvalidIdentifierException("sqlId", "x'; drop"));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("sqlId", response.getBody().getDetails().get("field"));
        assertEquals("Invalid sqlId: 'x'; drop'", response.getBody().getMessage());
    }

    @Test
    @DisplayName("Should return 404 for an unknown statement")
    void testNotFound() {
        ResponseEntity<ErrorResponse> response =
                handler.handleNotFound(new StatementNotFoundException("C1", "abcd1234efgh5"));

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals(ErrorCategory.NOT_FOUND.name(), response.getBody().getCategory());
    }

    @Test
    @DisplayName("Should return 503 with the tier code when a tier cannot answer")
    void testTierUnavailable() {
        TierUnavailableException e = new TierUnavailableException(Tier.LIVE_CACHE, "Live cache unavailable",
                new SQLException("ORA-00942: table or view does not exist", "42000", 942));

        ResponseEntity<ErrorResponse> response = handler.handleTierUnavailable(e);

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertEquals("C", response.getBody().getDetails().get("tier"));
        assertEquals(ErrorCategory.TIER_UNAVAILABLE.name(), response.getBody().getCategory());
    }

    @Test
    @DisplayName("Should carry the request path and id from the MDC")
    void testBadRequest_RequestContext() {
        MDC.put(MdcRequestFilter.REQUEST_PATH, "/api/monitoring/history");
        MDC.put(MdcRequestFilter.REQUEST_ID, "req-42");

        ResponseEntity<ErrorResponse> response =
                handler.handleBadRequest(new IllegalArgumentException("date is required"));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("date is required", response.getBody().getMessage());
        assertEquals("/api/monitoring/history", response.getBody().getPath());
        assertEquals("req-42", response.getBody().getRequestId());
    }

    @Test
    @DisplayName("Should fall back to /unknown and the exception type for a bare failure")
    void testGenericException() {
        ResponseEntity<ErrorResponse> response = handler.handleGenericException(new NullPointerException());

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("/unknown", response.getBody().getPath());
        assertEquals("NullPointerException", response.getBody().getMessage());
        assertEquals(ErrorCategory.APPLICATION_ERROR.name(), response.getBody().getCategory());
        assertNull(response.getBody().getRequestId());
    }
}
