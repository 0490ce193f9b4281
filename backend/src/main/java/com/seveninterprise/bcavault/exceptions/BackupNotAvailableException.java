package com.seveninterprise.bcavault.exceptions;

/**
 * Backup existe no ledger, mas não possui artefato disponível (não concluído)
 */
public class BackupNotAvailableException extends BackupException {

    public BackupNotAvailableException(Long backupId) {
        super("Backup " + backupId + " não está disponível para download");
    }
}
