package com.seveninterprise.bcavault.exceptions;

/**
 * Exception base para operações do subsistema de backup
 */
public class BackupException extends RuntimeException {

    public BackupException(String message) {
        super(message);
    }

    public BackupException(String message, Throwable cause) {
        super(message, cause);
    }
}
