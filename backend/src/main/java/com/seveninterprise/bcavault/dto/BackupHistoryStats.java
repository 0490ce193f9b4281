package com.seveninterprise.bcavault.dto;

import com.seveninterprise.bcavault.model.DatabaseBackup;

import java.time.Instant;

/**
 * Estatísticas do ledger de backups (manuais e agendados)
 */
public class BackupHistoryStats {

    private long totalBackups;
    private long completedBackups;
    private long failedBackups;
    private long totalStorageUsed;
    private Instant lastBackupDate;
    private DatabaseBackup.BackupStatus lastBackupStatus;

    public long getTotalBackups() {
        return totalBackups;
    }

    public void setTotalBackups(long totalBackups) {
        this.totalBackups = totalBackups;
    }

    public long getCompletedBackups() {
        return completedBackups;
    }

    public void setCompletedBackups(long completedBackups) {
        this.completedBackups = completedBackups;
    }

    public long getFailedBackups() {
        return failedBackups;
    }

    public void setFailedBackups(long failedBackups) {
        this.failedBackups = failedBackups;
    }

    public long getTotalStorageUsed() {
        return totalStorageUsed;
    }

    public void setTotalStorageUsed(long totalStorageUsed) {
        this.totalStorageUsed = totalStorageUsed;
    }

    public Instant getLastBackupDate() {
        return lastBackupDate;
    }

    public void setLastBackupDate(Instant lastBackupDate) {
        this.lastBackupDate = lastBackupDate;
    }

    public DatabaseBackup.BackupStatus getLastBackupStatus() {
        return lastBackupStatus;
    }

    public void setLastBackupStatus(DatabaseBackup.BackupStatus lastBackupStatus) {
        this.lastBackupStatus = lastBackupStatus;
    }
}
