package com.seveninterprise.bcavault.dto;

/**
 * Resultado de uma execução de backup agendado
 */
public class BackupExecutionResult {

    private final boolean success;
    private final Long backupId;
    private final String error;

    private BackupExecutionResult(boolean success, Long backupId, String error) {
        this.success = success;
        this.backupId = backupId;
        this.error = error;
    }

    public static BackupExecutionResult success(Long backupId) {
        return new BackupExecutionResult(true, backupId, null);
    }

    public static BackupExecutionResult failure(Long backupId, String error) {
        return new BackupExecutionResult(false, backupId, error);
    }

    public boolean isSuccess() {
        return success;
    }

    public Long getBackupId() {
        return backupId;
    }

    public String getError() {
        return error;
    }
}
