package com.seveninterprise.bcavault.services;

import com.seveninterprise.bcavault.dto.BackupVerificationResult;

/**
 * Verificação de integridade de backups concluídos
 *
 * Lê o artefato do storage, confere o checksum do envelope e a tag de
 * autenticação (descriptografando) e compara o total de registros com o ledger.
 */
public interface IBackupVerificationService {

    /**
     * @param backupId ID do registro no ledger
     * @return Resultado da verificação; falhas de integridade não lançam exceção
     * @throws com.seveninterprise.bcavault.exceptions.BackupNotFoundException se o registro não existir
     */
    BackupVerificationResult verifyBackup(Long backupId);
}
