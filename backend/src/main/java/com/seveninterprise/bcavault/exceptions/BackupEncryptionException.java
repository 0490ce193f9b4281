package com.seveninterprise.bcavault.exceptions;

/**
 * Falha criptográfica: chave ausente, cifra inválida ou checksum divergente
 */
public class BackupEncryptionException extends BackupException {

    public BackupEncryptionException(String message) {
        super(message);
    }

    public BackupEncryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
