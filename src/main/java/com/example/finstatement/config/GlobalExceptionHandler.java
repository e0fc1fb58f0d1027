package com.example.finstatement.config;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import com.example.finstatement.exception.DocumentReadException;
import com.example.finstatement.exception.StatementMissingException;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(StatementMissingException.class)
    public ResponseEntity<Map<String, String>> handleStatementMissing(StatementMissingException e) {
        log.warn("🚫 {}", e.getMessage());
        return body(HttpStatus.UNPROCESSABLE_ENTITY, "STATEMENT_MISSING", e.getMessage());
    }

    @ExceptionHandler(DocumentReadException.class)
    public ResponseEntity<Map<String, String>> handleDocumentRead(DocumentReadException e) {
        log.warn("🚫 {}", e.getMessage(), e);
        return body(HttpStatus.BAD_REQUEST, "DOCUMENT_UNREADABLE", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadArgument(IllegalArgumentException e) {
        log.warn("🚫 bad request: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
    }

    @ExceptionHandler({MissingServletRequestPartException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, String>> handleMalformedRequest(Exception e) {
        log.warn("🚫 malformed request: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleException(Exception e) {
        log.error("🚨 unhandled error: {}", e.getMessage(), e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Internal server error.");
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatus status, String code, String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
