package com.seveninterprise.bcavault.services;

import com.seveninterprise.bcavault.dto.CreateManualBackupRequest;
import com.seveninterprise.bcavault.model.DatabaseBackup;

/**
 * Backup disparado diretamente por um administrador, fora de qualquer agendamento.
 * Usa a mesma coleta, empacotamento e upload do backup agendado, com registro MANUAL no ledger.
 */
public interface IManualBackupService {

    /**
     * @return Registro COMPLETED do ledger
     * @throws com.seveninterprise.bcavault.exceptions.BackupException se o backup falhar
     *         (o registro fica como FAILED)
     */
    DatabaseBackup createManualBackup(CreateManualBackupRequest request);
}
