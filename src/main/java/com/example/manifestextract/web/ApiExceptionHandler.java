package com.example.manifestextract.web;

import com.example.manifestextract.service.ManifestFileException;
import com.example.manifestextract.service.RowLimitExceededException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ManifestFileException.class)
    public ResponseEntity<ErrorResponse> handleFile(ManifestFileException e) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse(e.getMessage(), e.errorType()));
    }

    @ExceptionHandler(RowLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleRowLimit(RowLimitExceededException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage(), "TOO_MANY_ROWS"));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException e) {
        return ResponseEntity.status(e.getStatusCode())
                .body(new ErrorResponse(e.getReason(), "UPLOAD_REJECTED"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException e) {
        log.warn("Bad extraction request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage(), "BAD_REQUEST"));
    }

    public record ErrorResponse(String error, String type) {
    }
}
