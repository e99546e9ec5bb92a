package com.example.musiccollection.common.exception;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.example.musiccollection.api.response.ApiResponse;
import com.example.musiccollection.common.logging.AccessLogFilter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void shouldUseBusinessStatusForHttpStatusAndCode() {
        MDC.put(AccessLogFilter.MDC_REQUEST_ID, "req-1");

        ResponseEntity<ApiResponse<Void>> response = handler.handleBusinessException(
                BusinessException.notFound("Catalog item", "Refresh the collection and retry"));

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals("404", response.getBody().getCode());
        assertEquals("Catalog item not found", response.getBody().getMessage());
        assertEquals("Refresh the collection and retry", response.getBody().getUserAction());
        assertEquals("req-1", response.getBody().getRequestId());
    }

    @Test
    void shouldExplainUnknownSourceFilter() {
        ResponseEntity<ApiResponse<Void>> response = handler.handleBusinessException(
                BusinessException.unknownSource("tidal"));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("Unknown source: tidal", response.getBody().getMessage());
        assertEquals("Use all, library or catalog", response.getBody().getUserAction());
    }

    @Test
    void shouldReportLibraryOutageAsServiceUnavailable() {
        ResponseEntity<ApiResponse<Void>> response = handler.handleLibraryConnection(
                new LibraryConnectionException("Library bridge /browse unreachable: refused"));

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertEquals("503", response.getBody().getCode());
        assertNull(response.getBody().getData());
    }

    @Test
    void shouldNameMissingParameter() {
        ResponseEntity<ApiResponse<Void>> response = handler.handleMissingParameter(
                new MissingServletRequestParameterException("q", "String"));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("Missing parameter: q", response.getBody().getMessage());
    }

    @Test
    void shouldHideUnexpectedFailureDetails() {
        ResponseEntity<ApiResponse<Void>> response = handler.handleException(new IllegalStateException("boom"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("Internal server error", response.getBody().getMessage());
    }
}
