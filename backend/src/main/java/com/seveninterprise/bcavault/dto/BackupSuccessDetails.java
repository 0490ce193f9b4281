package com.seveninterprise.bcavault.dto;

/**
 * Dados enviados na notificação de backup concluído
 */
public class BackupSuccessDetails {

    private final String backupName;
    private final String backupId;
    private final String scheduleName;
    private final String fileSize;
    private final String duration;
    private final String timestamp;

    public BackupSuccessDetails(String backupName, String backupId, String scheduleName,
                                String fileSize, String duration, String timestamp) {
        this.backupName = backupName;
        this.backupId = backupId;
        this.scheduleName = scheduleName;
        this.fileSize = fileSize;
        this.duration = duration;
        this.timestamp = timestamp;
    }

    public String getBackupName() {
        return backupName;
    }

    public String getBackupId() {
        return backupId;
    }

    public String getScheduleName() {
        return scheduleName;
    }

    public String getFileSize() {
        return fileSize;
    }

    public String getDuration() {
        return duration;
    }

    public String getTimestamp() {
        return timestamp;
    }
}
