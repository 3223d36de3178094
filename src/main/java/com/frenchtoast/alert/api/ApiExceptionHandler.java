package com.frenchtoast.alert.api;

import com.frenchtoast.alert.core.error.PersistenceException;
import com.frenchtoast.alert.core.error.UrlCipherException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> onValidation(WebExchangeBindException e) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (FieldError fe : e.getFieldErrors()) {
            fields.put(fe.getField(), fe.getDefaultMessage());
        }
        return body(HttpStatus.BAD_REQUEST, "validation failed", fields);
    }

    @ExceptionHandler(PersistenceException.class)
    public ResponseEntity<Map<String, Object>> onPersistence(PersistenceException e) {
        log.warn("Request failed on storage: {}", e.toString(), e);
        return body(HttpStatus.SERVICE_UNAVAILABLE, "storage unavailable", Map.of());
    }

    @ExceptionHandler(UrlCipherException.class)
    public ResponseEntity<Map<String, Object>> onCipher(UrlCipherException e) {
        log.error("Url encryption failed: {}", e.getMessage(), e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "encryption failure", Map.of());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, Map<String, Object> details) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", status.value());
        out.put("error", error);
        if (!details.isEmpty()) {
            out.put("details", details);
        }
        return ResponseEntity.status(status).body(out);
    }
}
