package com.seveninterprise.bcavault.dto;

import java.time.Instant;
import java.util.Map;

/**
 * DTO padronizado para respostas de erro da API administrativa
 */
public class ErrorResponse {
    private String message;
    private String error;
    private Integer status;
    private Instant timestamp = Instant.now();
    private Map<String, String> fieldErrors;

    public ErrorResponse() {}

    public ErrorResponse(String error, String message, Integer status) {
        this.error = error;
        this.message = message;
        this.status = status;
    }

    public ErrorResponse(String message, Integer status, Map<String, String> fieldErrors) {
        this.error = "VALIDATION_ERROR";
        this.message = message;
        this.status = status;
        this.fieldErrors = fieldErrors;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public Integer getStatus() {
        return status;
    }

    public void setStatus(Integer status) {
        this.status = status;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }

    public void setFieldErrors(Map<String, String> fieldErrors) {
        this.fieldErrors = fieldErrors;
    }
}
