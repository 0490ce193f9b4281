package com.seveninterprise.bcavault.services;

/**
 * Ciclo de vida dos dois timers recorrentes do subsistema de backup:
 * - Verificação de agendamentos vencidos (a cada minuto)
 * - Limpeza por retenção (diária)
 */
public interface IBackupSchedulerService {

    /**
     * Garante o agendamento padrão e arma os timers.
     * Chamadas repetidas enquanto em execução não têm efeito.
     */
    void start();

    /**
     * Cancela os timers. Sem efeito se já parado.
     */
    void stop();

    boolean isRunning();

    /**
     * Um tick do verificador: executa em sequência todos os agendamentos
     * habilitados com próxima execução vencida. Nunca lança exceção.
     *
     * @return Número de agendamentos executados
     */
    int pollDueSchedules();
}
