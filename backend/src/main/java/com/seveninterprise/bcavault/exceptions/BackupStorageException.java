package com.seveninterprise.bcavault.exceptions;

/**
 * Falha ao gravar ou ler objetos no armazenamento de backups
 */
public class BackupStorageException extends BackupException {

    public BackupStorageException(String message) {
        super(message);
    }

    public BackupStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
