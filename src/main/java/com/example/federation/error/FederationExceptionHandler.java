package com.example.federation.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Map;

@RestControllerAdvice
public class FederationExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(FederationExceptionHandler.class);

    @ExceptionHandler(FederationException.class)
    public ResponseEntity<Map<String, Object>> handleFederation(FederationException e) {
        if (e.getKind() == ErrorKind.INTERNAL) {
            logger.error("Internal federation error: {}", e.getMessage(), e);
        } else {
            logger.debug("Request rejected with {}: {}", e.getKind(), e.getMessage());
        }
        return ResponseEntity.status(e.getKind().getStatus()).body(e.toBody());
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleBadInput(ServerWebInputException e) {
        return handleFederation(FederationException.badRequest(
                e.getReason() != null ? e.getReason() : "Malformed request"));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> handleStorage(DataAccessException e) {
        logger.error("Storage failure", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("errcode", ErrorKind.INTERNAL.getErrcode(), "error", "Storage failure"));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleStatus(ResponseStatusException e) {
        String errcode;
        if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
            errcode = ErrorKind.NOT_FOUND.getErrcode();
        } else if (e.getStatusCode().is4xxClientError()) {
            errcode = "M_UNRECOGNIZED";
        } else {
            errcode = ErrorKind.INTERNAL.getErrcode();
        }
        String reason = e.getReason() != null ? e.getReason() : e.getStatusCode().toString();
        return ResponseEntity.status(e.getStatusCode()).body(Map.of("errcode", errcode, "error", reason));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        logger.error("Unexpected failure handling federation request", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("errcode", ErrorKind.INTERNAL.getErrcode(), "error", "Internal server error"));
    }
}
