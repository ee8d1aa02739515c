package com.Excel.Variance.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.HashMap;
import java.util.Map;

/**
 * Error bodies shared by the controllers: {@code {"error", "message", "status": "error"}}.
 */
final class ErrorResponses {

    private ErrorResponses() {
    }

    static ResponseEntity<Object> notFound(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body("Session not found", e.getMessage()));
    }

    static ResponseEntity<Object> badRequest(String error, String message) {
        return ResponseEntity.badRequest().body(body(error, message));
    }

    static ResponseEntity<Object> serverError(String error, Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return ResponseEntity.status(500).body(body(error, message));
    }

    private static Map<String, Object> body(String error, String message) {
        // HashMap because message may be null
        Map<String, Object> body = new HashMap<>();
        body.put("error", error);
        body.put("message", message);
        body.put("status", "error");
        return body;
    }
}
