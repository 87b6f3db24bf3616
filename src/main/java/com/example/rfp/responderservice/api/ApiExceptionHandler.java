package com.example.rfp.responderservice.api;

import com.example.rfp.responderservice.exception.CompletionUnavailableException;
import com.example.rfp.responderservice.exception.DimensionMismatchException;
import com.example.rfp.responderservice.exception.DocumentGenerationException;
import com.example.rfp.responderservice.exception.EmbeddingUnavailableException;
import com.example.rfp.responderservice.exception.StorageException;
import com.example.rfp.responderservice.exception.TextExtractionException;
import com.example.rfp.responderservice.exception.UnsupportedFileTypeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.NoSuchElementException;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(UnsupportedFileTypeException.class)
    public ResponseEntity<Map<String, String>> unsupported(UnsupportedFileTypeException e) {
        return error(HttpStatus.UNSUPPORTED_MEDIA_TYPE, e.getMessage());
    }

    @ExceptionHandler(TextExtractionException.class)
    public ResponseEntity<Map<String, String>> unreadable(TextExtractionException e) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage());
    }

    @ExceptionHandler({EmbeddingUnavailableException.class, CompletionUnavailableException.class})
    public ResponseEntity<Map<String, String>> aiUnavailable(RuntimeException e) {
        log.warn("AI backend unavailable: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    @ExceptionHandler(DimensionMismatchException.class)
    public ResponseEntity<Map<String, String>> dimensionMismatch(DimensionMismatchException e) {
        return error(HttpStatus.CONFLICT, e.getMessage() + ". The knowledgebase must be re-ingested.");
    }

    @ExceptionHandler({StorageException.class, DocumentGenerationException.class})
    public ResponseEntity<Map<String, String>> internal(RuntimeException e) {
        log.error("Request failed: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<Map<String, String>> notFound(NoSuchElementException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentNotValidException.class})
    public ResponseEntity<Map<String, String>> badRequest(Exception e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message != null ? message : status.getReasonPhrase()));
    }
}
