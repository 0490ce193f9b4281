package com.seveninterprise.bcavault.services;

import com.seveninterprise.bcavault.dto.BackupExecutionResult;

/**
 * Executa um backup agendado de ponta a ponta
 *
 * Fluxo:
 * 1. Registra a tentativa no ledger (IN_PROGRESS)
 * 2. Coleta o snapshot de todos os domínios
 * 3. Empacota (criptografando se o agendamento pedir)
 * 4. Envia o artefato ao storage
 * 5. Conclui o ledger (COMPLETED) ou registra a falha (FAILED)
 * 6. Recalcula a próxima execução do agendamento
 * 7. Notifica os administradores conforme as flags do agendamento
 *
 * Falhas de coleta, empacotamento ou upload nunca escapam deste método:
 * ficam registradas no ledger e no resultado.
 */
public interface IScheduledBackupExecutor {

    /**
     * @param scheduleId ID do agendamento
     * @return Resultado com o ID do registro no ledger
     * @throws com.seveninterprise.bcavault.exceptions.ScheduleNotFoundException se o agendamento não existir
     */
    BackupExecutionResult executeScheduledBackup(Long scheduleId);
}
