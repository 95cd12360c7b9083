package com.docindex.main.exception;

import com.docindex.common.exception.DocIndexException;
import com.docindex.common.exception.DocumentNotFoundException;
import com.docindex.common.exception.EmptyInputException;
import com.docindex.common.exception.EmptyQueryException;
import com.docindex.common.exception.NoTextException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({DocumentNotFoundException.class, NoTextException.class})
    public ResponseEntity<Map<String, Object>> handleNotFound(DocIndexException e) {
        log.warn("Not found: {}", e.getMessage());
        return error(HttpStatus.NOT_FOUND, "Not Found", e.getMessage());
    }

    @ExceptionHandler({EmptyInputException.class, EmptyQueryException.class})
    public ResponseEntity<Map<String, Object>> handleEmptyInput(DocIndexException e) {
        log.warn("Empty input: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Bad Request", e.getMessage());
    }

    @ExceptionHandler(DocIndexException.class)
    public ResponseEntity<Map<String, Object>> handleDocIndexException(DocIndexException e) {
        log.error("Indexer error: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Indexer Error", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(IllegalArgumentException e) {
        log.error("Invalid argument: {}", e.getMessage(), e);
        return error(HttpStatus.BAD_REQUEST, "Bad Request", e.getMessage());
    }

    @ExceptionHandler({
        MethodArgumentNotValidException.class,
        ConstraintViolationException.class,
        MissingServletRequestParameterException.class
    })
    public ResponseEntity<Map<String, Object>> handleValidation(Exception e) {
        log.warn("Invalid request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Bad Request", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception e) {
        log.error("Unexpected error: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String message) {
        Map<String, Object> errorResponse = Map.of(
            "timestamp", LocalDateTime.now(),
            "status", status.value(),
            "error", error,
            "message", message != null ? message : error
        );
        return ResponseEntity.status(status).body(errorResponse);
    }
}
