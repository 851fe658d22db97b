package com.example.laborhours.export.controller;

import com.example.laborhours.export.exception.ExportException;
import com.example.laborhours.export.exception.TemplateInvalidException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the {code, description, retryable, issues} error body shared by the
 * export endpoints and picks the HTTP status for each error code.
 */
final class ExportErrorResponses {
    static final String RETRY_AFTER_SECONDS = "5";

    private ExportErrorResponses() {
    }

    static ResponseEntity<Map<String, Object>> of(ExportException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", e.getCode().name());
        body.put("description", e.getDescription());
        body.put("retryable", e.isRetryable());
        if (e instanceof TemplateInvalidException) {
            body.put("issues", ((TemplateInvalidException) e).getIssues());
        }

        HttpHeaders headers = new HttpHeaders();
        if (e.isRetryable()) {
            headers.set(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS);
        }
        return new ResponseEntity<>(body, headers, statusFor(e));
    }

    static ResponseEntity<Map<String, Object>> badRequest(String description) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", "BAD_REQUEST");
        body.put("description", description);
        body.put("retryable", false);
        return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
    }

    static HttpStatus statusFor(ExportException e) {
        switch (e.getCode()) {
            case TEMPLATE_NOT_FOUND:
            case STUDENT_NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case TEMPLATE_INVALID:
            case TEMPLATE_CORRUPT:
            case UNRESOLVABLE_FIELD:
            case EXPANSION_CONFLICT:
                return HttpStatus.BAD_REQUEST;
            case RENDERER_TIMEOUT:
                return HttpStatus.GATEWAY_TIMEOUT;
            case RENDERER_CRASHED:
                return HttpStatus.BAD_GATEWAY;
            case RENDERER_POOL_EXHAUSTED:
            case EXPORT_CANCELLED:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
