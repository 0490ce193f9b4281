package com.seveninterprise.bcavault.services;

import com.seveninterprise.bcavault.dto.CreateScheduleRequest;
import com.seveninterprise.bcavault.dto.UpdateScheduleRequest;
import com.seveninterprise.bcavault.model.BackupSchedule;

import java.time.Instant;
import java.util.List;

/**
 * Registro de agendamentos de backup
 *
 * Expressões cron e fusos são validados antes de qualquer gravação;
 * configurações inválidas são rejeitadas com InvalidScheduleExpressionException
 * e nunca substituídas silenciosamente por valores padrão.
 */
public interface IBackupScheduleService {

    /**
     * Garante a existência do agendamento diário padrão
     *
     * Idempotente: só cria o agendamento se nenhum outro com o mesmo nome
     * existir. Criado com criptografia habilitada, retenção de 30 dias e
     * próxima execução já calculada.
     *
     * @return Agendamento padrão (existente ou recém-criado)
     */
    BackupSchedule ensureDefaultSchedule();

    BackupSchedule createSchedule(CreateScheduleRequest request);

    /**
     * Aplica atualização parcial
     *
     * A próxima execução é recalculada quando a expressão ou o fuso mudam,
     * ou quando o agendamento é reabilitado. Demais campos não afetam o cálculo.
     *
     * @param scheduleId ID do agendamento
     * @param request Campos a alterar (nulos são ignorados)
     * @return Agendamento atualizado
     */
    BackupSchedule updateSchedule(Long scheduleId, UpdateScheduleRequest request);

    /**
     * Remove o agendamento. O histórico de backups no ledger é preservado.
     */
    void deleteSchedule(Long scheduleId);

    List<BackupSchedule> listSchedules();

    BackupSchedule getSchedule(Long scheduleId);

    List<Instant> previewNextRuns(String cronExpression, String timezone, int count);

    BackupSchedule.ScheduleStats getScheduleStats();
}
