package dev.jobhunter.api;

import dev.jobhunter.error.AnalysisException;
import dev.jobhunter.error.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(AnalysisException.class)
    public ResponseEntity<Map<String, String>> handleAnalysis(AnalysisException ex) {
        HttpStatus status = statusOf(ex.getKind());
        if (status.is5xxServerError()) {
            log.warn("Request failed with {}: {}", ex.getKind().code(), ex.getMessage());
        }
        return ResponseEntity.status(status)
                .body(Map.of("error", ex.getKind().code(), "message", String.valueOf(ex.getMessage())));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, String>> handleBadInput(ServerWebInputException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", ErrorKind.VALIDATION_FAILED.code(), "message", ex.getReason() != null
                        ? ex.getReason()
                        : "Invalid request"));
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION_FAILED -> HttpStatus.BAD_REQUEST;
            case UNKNOWN_SESSION -> HttpStatus.NOT_FOUND;
            case SESSION_BUSY, CANCELLED -> HttpStatus.CONFLICT;
            case FETCH_FAILED -> HttpStatus.BAD_GATEWAY;
            case STORE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case PERSIST_FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
        };
    }
}
