package com.dnobretech.loaningestor.exception;

import jakarta.persistence.EntityNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * Só erros de transporte/formato de arquivo chegam aqui; dado sujo nunca vira erro HTTP.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    // 404 - solicitante inexistente
    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(EntityNotFoundException ex, HttpServletRequest req) {
        return ApiError.of(HttpStatus.NOT_FOUND, ex.getMessage(), req);
    }

    // 400 - planilha ilegível / upload vazio
    @ExceptionHandler(SpreadsheetFormatException.class)
    public ResponseEntity<ApiError> handleSpreadsheet(SpreadsheetFormatException ex, HttpServletRequest req) {
        log.warn("Upload rejeitado: {}", ex.getMessage());
        return ApiError.of(HttpStatus.BAD_REQUEST, ex.getMessage(), req);
    }

    // 400 - id fora do formato A<n>
    @ExceptionHandler({ConstraintViolationException.class, HandlerMethodValidationException.class})
    public ResponseEntity<ApiError> handleConstraintViolation(Exception ex, HttpServletRequest req) {
        return ApiError.of(HttpStatus.BAD_REQUEST, ex.getMessage(), req);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleBadRequest(IllegalArgumentException ex, HttpServletRequest req) {
        return ApiError.of(HttpStatus.BAD_REQUEST, ex.getMessage(), req);
    }

    // 400 - multipart sem a parte "file"
    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ApiError> handleMissingPart(MissingServletRequestPartException ex, HttpServletRequest req) {
        return ApiError.of(HttpStatus.BAD_REQUEST, ex.getMessage(), req);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiError> handleTooLarge(MaxUploadSizeExceededException ex, HttpServletRequest req) {
        return ApiError.of(HttpStatus.PAYLOAD_TOO_LARGE, ex.getMessage(), req);
    }

    // 500 - fallback único
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest req) {
        log.error("Erro não tratado", ex);
        return ApiError.of(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), req);
    }
}
