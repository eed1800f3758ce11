package com.adinsight.segment.controller;

import com.adinsight.segment.exception.InvalidAnalysisInputException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidAnalysisInputException.class)
    public ResponseEntity<Map<String, String>> handleInvalidInput(InvalidAnalysisInputException ex) {
        return ResponseEntity.badRequest().body(Map.of("error", ex.getMessage(), "field", ex.getField()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException ex) {
        String cause = ex.getMostSpecificCause().getMessage();
        return ResponseEntity.badRequest().body(Map.of("error", "Malformed request body: " + cause));
    }
}
