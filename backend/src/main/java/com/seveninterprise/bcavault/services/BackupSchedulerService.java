package com.seveninterprise.bcavault.services;

import com.seveninterprise.bcavault.dto.BackupExecutionResult;
import com.seveninterprise.bcavault.model.BackupSchedule;
import com.seveninterprise.bcavault.repositories.BackupScheduleRepository;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Dono dos timers do subsistema de backup
 *
 * Os handles dos timers ficam neste serviço e start/stop são protegidos
 * pelo monitor do objeto. Apenas uma instância do processo deve rodar os
 * timers: execuções concorrentes em processos distintos podem duplicar backups.
 */
@Service
public class BackupSchedulerService implements IBackupSchedulerService {

    private static final Logger log = LoggerFactory.getLogger(BackupSchedulerService.class);

    private final TaskScheduler taskScheduler;
    private final BackupScheduleRepository scheduleRepository;
    private final IScheduledBackupExecutor backupExecutor;
    private final IBackupRetentionService retentionService;
    private final IBackupScheduleService scheduleService;
    private final Clock clock;

    @Value("${bcavault.backup.scheduler.enabled:true}")
    private boolean autoStart = true;

    @Value("${bcavault.backup.scheduler.poll-interval-ms:60000}")
    private long pollIntervalMs = 60_000L;

    @Value("${bcavault.backup.scheduler.cleanup-interval-ms:86400000}")
    private long cleanupIntervalMs = 86_400_000L;

    private ScheduledFuture<?> pollTask;
    private ScheduledFuture<?> cleanupTask;

    public BackupSchedulerService(@Qualifier("backupTaskScheduler") TaskScheduler taskScheduler,
                                  BackupScheduleRepository scheduleRepository,
                                  IScheduledBackupExecutor backupExecutor,
                                  IBackupRetentionService retentionService,
                                  IBackupScheduleService scheduleService,
                                  Clock clock) {
        this.taskScheduler = taskScheduler;
        this.scheduleRepository = scheduleRepository;
        this.backupExecutor = backupExecutor;
        this.retentionService = retentionService;
        this.scheduleService = scheduleService;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (autoStart) {
            start();
        } else {
            log.info("Agendador de backups desabilitado por configuração");
        }
    }

    @Override
    public synchronized void start() {
        if (isRunning()) {
            log.info("Agendador de backups já está em execução");
            return;
        }

        try {
            scheduleService.ensureDefaultSchedule();
        } catch (Exception e) {
            // Os timers são armados mesmo assim; o banco pode voltar antes do próximo tick
            log.error("Não foi possível garantir o agendamento padrão: {}", e.getMessage(), e);
        }

        // scheduleWithFixedDelay: um tick só começa depois que o anterior terminou
        pollTask = taskScheduler.scheduleWithFixedDelay(this::pollDueSchedules, Duration.ofMillis(pollIntervalMs));
        cleanupTask = taskScheduler.scheduleWithFixedDelay(this::runCleanup, Duration.ofMillis(cleanupIntervalMs));

        log.info("Agendador de backups iniciado (verificação a cada {} ms, limpeza a cada {} ms)",
            pollIntervalMs, cleanupIntervalMs);
    }

    @Override
    @PreDestroy
    public synchronized void stop() {
        if (!isRunning()) {
            return;
        }
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
        }
        if (cleanupTask != null) {
            cleanupTask.cancel(false);
            cleanupTask = null;
        }
        log.info("Agendador de backups parado");
    }

    @Override
    public synchronized boolean isRunning() {
        return pollTask != null || cleanupTask != null;
    }

    @Override
    public int pollDueSchedules() {
        List<BackupSchedule> due;
        try {
            due = scheduleRepository.findDueSchedules(Instant.now(clock));
        } catch (Exception e) {
            // Erro transitório (ex.: conexão perdida): tenta de novo no próximo tick
            log.error("Erro ao buscar agendamentos vencidos: {}", e.getMessage(), e);
            return 0;
        }

        if (due.isEmpty()) {
            return 0;
        }
        log.info("{} agendamento(s) de backup vencido(s)", due.size());

        int executed = 0;
        for (BackupSchedule schedule : due) {
            try {
                BackupExecutionResult result = backupExecutor.executeScheduledBackup(schedule.getId());
                executed++;
                if (!result.isSuccess()) {
                    log.warn("Backup do agendamento '{}' registrado como falho: {}", schedule.getName(), result.getError());
                }
            } catch (Exception e) {
                log.error("Erro ao executar agendamento '{}': {}", schedule.getName(), e.getMessage(), e);
            }
        }
        return executed;
    }

    private void runCleanup() {
        try {
            retentionService.cleanupOldBackups();
        } catch (Exception e) {
            log.error("Erro na limpeza de backups antigos: {}", e.getMessage(), e);
        }
    }
}
