package com.seveninterprise.bcavault.controllers;

import com.seveninterprise.bcavault.dto.ErrorResponse;
import com.seveninterprise.bcavault.exceptions.BackupException;
import com.seveninterprise.bcavault.exceptions.BackupNotAvailableException;
import com.seveninterprise.bcavault.exceptions.BackupNotFoundException;
import com.seveninterprise.bcavault.exceptions.InvalidScheduleExpressionException;
import com.seveninterprise.bcavault.exceptions.ScheduleNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converte exceções do subsistema de backup em ErrorResponse JSON
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidScheduleExpressionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidSchedule(InvalidScheduleExpressionException e) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_SCHEDULE", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", e.getMessage());
    }

    @ExceptionHandler({ScheduleNotFoundException.class, BackupNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(BackupException e) {
        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(BackupNotAvailableException.class)
    public ResponseEntity<ErrorResponse> handleNotAvailable(BackupNotAvailableException e) {
        return error(HttpStatus.BAD_REQUEST, "BACKUP_NOT_AVAILABLE", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            fieldErrors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        ErrorResponse body = new ErrorResponse("Dados inválidos", HttpStatus.BAD_REQUEST.value(), fieldErrors);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(BackupException.class)
    public ResponseEntity<ErrorResponse> handleBackupException(BackupException e) {
        log.error("Erro no subsistema de backup: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "BACKUP_ERROR", e.getMessage());
    }

    private ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, message, status.value()));
    }
}
