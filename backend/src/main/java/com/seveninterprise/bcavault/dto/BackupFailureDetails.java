package com.seveninterprise.bcavault.dto;

/**
 * Dados enviados na notificação de falha de backup
 */
public class BackupFailureDetails {

    private final String scheduleName;
    private final String error;
    private final String timestamp;

    public BackupFailureDetails(String scheduleName, String error, String timestamp) {
        this.scheduleName = scheduleName;
        this.error = error;
        this.timestamp = timestamp;
    }

    public String getScheduleName() {
        return scheduleName;
    }

    public String getError() {
        return error;
    }

    public String getTimestamp() {
        return timestamp;
    }
}
