package com.seveninterprise.bcavault.exceptions;

public class BackupNotFoundException extends BackupException {

    public BackupNotFoundException(Long backupId) {
        super("Backup não encontrado: " + backupId);
    }
}
