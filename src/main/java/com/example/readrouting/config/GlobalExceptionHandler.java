package com.example.readrouting.config;

import com.example.readrouting.exception.EndpointConnectionException;
import com.example.readrouting.exception.EndpointQueryException;
import com.example.readrouting.exception.PositionUnavailableException;
import com.example.readrouting.exception.ReadRoutingException;
import com.example.readrouting.exception.RoutingConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps routing failures onto HTTP responses. Nothing here retries or reroutes;
 * the client decides whether to try again.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Target node unreachable. The read is not silently moved to another node.
     */
    @ExceptionHandler(EndpointConnectionException.class)
    public ResponseEntity<Map<String, Object>> handleConnection(EndpointConnectionException ex) {
        log.warn("Endpoint {} unavailable: {}", ex.getNodeId(), ex.getMessage());
        Map<String, Object> response = body("Database connection error", ex.getMessage(), HttpStatus.SERVICE_UNAVAILABLE);
        response.put("node", ex.getNodeId());
        return new ResponseEntity<>(response, HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler(PositionUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handlePositionUnavailable(PositionUnavailableException ex) {
        log.warn("WAL position unavailable on {}: {}", ex.getNodeId(), ex.getMessage());
        Map<String, Object> response = body("WAL position unavailable", ex.getMessage(), HttpStatus.SERVICE_UNAVAILABLE);
        response.put("node", ex.getNodeId());
        return new ResponseEntity<>(response, HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler(EndpointQueryException.class)
    public ResponseEntity<Map<String, Object>> handleQuery(EndpointQueryException ex) {
        log.error("Query failed on {}: {}", ex.getNodeId(), ex.getMessage(), ex);
        Map<String, Object> response = body("Database error", ex.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR);
        response.put("node", ex.getNodeId());
        return new ResponseEntity<>(response, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(RoutingConfigurationException.class)
    public ResponseEntity<Map<String, Object>> handleConfiguration(RoutingConfigurationException ex) {
        log.error("Routing misconfigured: {}", ex.getMessage());
        return new ResponseEntity<>(body("Routing configuration error", ex.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR),
                HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(ReadRoutingException.class)
    public ResponseEntity<Map<String, Object>> handleRouting(ReadRoutingException ex) {
        log.error("Routing failure: {}", ex.getMessage(), ex);
        return new ResponseEntity<>(body("Routing error", ex.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR),
                HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler({IllegalArgumentException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        log.debug("Rejected request: {}", ex.getMessage());
        return new ResponseEntity<>(body("Bad request", ex.getMessage(), HttpStatus.BAD_REQUEST), HttpStatus.BAD_REQUEST);
    }

    private static Map<String, Object> body(String error, String message, HttpStatus status) {
        Map<String, Object> response = new HashMap<>();
        response.put("error", error);
        response.put("message", message);
        response.put("status", status.value());
        response.put("timestamp", System.currentTimeMillis());
        return response;
    }
}
