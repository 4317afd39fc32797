package com.wifi.propagation.controller;

import com.wifi.propagation.exception.HeatmapComputationException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the GlobalExceptionHandler.
 * Verifies status codes and the error body layout.
 */
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void should_ReturnBadRequest_When_HandlingIllegalArgumentException() {
        ResponseEntity<Map<String, Object>> response =
            handler.handleIllegalArgumentException(new IllegalArgumentException("swLat must be a finite number"));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals(400, response.getBody().get("status"));
        assertEquals("Bad Request", response.getBody().get("error"));
        assertEquals("swLat must be a finite number", response.getBody().get("message"));
        assertNotNull(response.getBody().get("timestamp"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void should_ReturnFieldErrors_When_HandlingMethodArgumentNotValidException() {
        MethodArgumentNotValidException exception = mock(MethodArgumentNotValidException.class);
        BindingResult bindingResult = mock(BindingResult.class);
        when(exception.getBindingResult()).thenReturn(bindingResult);
        when(bindingResult.getAllErrors()).thenReturn(java.util.List.of(
            new FieldError("heatmapRequest", "band", "Band is required"),
            new FieldError("heatmapRequest", "accessPoints[0].macAddress", "Invalid MAC address format")));

        ResponseEntity<Map<String, Object>> response = handler.handleValidationErrors(exception);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("Validation Failed", response.getBody().get("error"));
        Map<String, String> fieldErrors = (Map<String, String>) response.getBody().get("fieldErrors");
        assertEquals("Band is required", fieldErrors.get("band"));
        assertEquals("Invalid MAC address format", fieldErrors.get("accessPoints[0].macAddress"));
    }

    @Test
    void should_ReturnServiceUnavailable_When_ComputationTimesOut() {
        ResponseEntity<Map<String, Object>> response =
            handler.handleHeatmapComputationException(new HeatmapComputationException("timed out after 30 seconds", true));

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertEquals(503, response.getBody().get("status"));
        assertNotNull(response.getBody().get("suggestedAction"));
    }

    @Test
    void should_ReturnInternalServerError_When_ComputationFails() {
        ResponseEntity<Map<String, Object>> response = handler.handleHeatmapComputationException(
            new HeatmapComputationException("Heatmap computation failed", new IllegalStateException("boom")));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("Heatmap Computation Error", response.getBody().get("error"));
        assertFalse(response.getBody().containsKey("suggestedAction"));
    }

    @Test
    void should_HideDetails_When_HandlingUnexpectedException() {
        ResponseEntity<Map<String, Object>> response =
            handler.handleGenericException(new NullPointerException("secret internals"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("An unexpected error occurred", response.getBody().get("message"));
    }
}
