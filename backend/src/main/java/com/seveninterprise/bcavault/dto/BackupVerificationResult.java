package com.seveninterprise.bcavault.dto;

/**
 * Resultado da verificação de integridade de um artefato gravado
 */
public class BackupVerificationResult {

    private final Long backupId;
    private final boolean valid;
    private final boolean encrypted;
    private final long totalRecords;
    private final String message;

    public BackupVerificationResult(Long backupId, boolean valid, boolean encrypted, long totalRecords, String message) {
        this.backupId = backupId;
        this.valid = valid;
        this.encrypted = encrypted;
        this.totalRecords = totalRecords;
        this.message = message;
    }

    public static BackupVerificationResult valid(Long backupId, boolean encrypted, long totalRecords) {
        return new BackupVerificationResult(backupId, true, encrypted, totalRecords, "Backup íntegro");
    }

    public static BackupVerificationResult invalid(Long backupId, boolean encrypted, String message) {
        return new BackupVerificationResult(backupId, false, encrypted, 0L, message);
    }

    public Long getBackupId() {
        return backupId;
    }

    public boolean isValid() {
        return valid;
    }

    public boolean isEncrypted() {
        return encrypted;
    }

    public long getTotalRecords() {
        return totalRecords;
    }

    public String getMessage() {
        return message;
    }
}
