package com.seveninterprise.bcavault.services;

/**
 * Limpeza de backups agendados fora da janela de retenção
 */
public interface IBackupRetentionService {

    /**
     * Remove, para cada agendamento, os backups agendados criados antes de
     * (agora - retentionDays) cujos metadados apontam para esse agendamento.
     *
     * Registros com metadados ilegíveis ou sem agendamento correspondente
     * nunca são removidos. Falhas em um registro são registradas em log e a
     * limpeza continua com os demais.
     *
     * @return Número de registros removidos
     */
    int cleanupOldBackups();
}
