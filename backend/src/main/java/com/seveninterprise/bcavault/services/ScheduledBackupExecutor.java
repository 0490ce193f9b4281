package com.seveninterprise.bcavault.services;

import com.seveninterprise.bcavault.dto.BackupExecutionResult;
import com.seveninterprise.bcavault.dto.BackupFailureDetails;
import com.seveninterprise.bcavault.dto.BackupSuccessDetails;
import com.seveninterprise.bcavault.dto.PackagedBackup;
import com.seveninterprise.bcavault.dto.SnapshotPayload;
import com.seveninterprise.bcavault.exceptions.ScheduleNotFoundException;
import com.seveninterprise.bcavault.model.BackupSchedule;
import com.seveninterprise.bcavault.repositories.BackupScheduleRepository;
import com.seveninterprise.bcavault.services.cron.CronExpressionEvaluator;
import com.seveninterprise.bcavault.services.notification.IBackupNotificationService;
import com.seveninterprise.bcavault.services.storage.BackupUploader;
import com.seveninterprise.bcavault.services.storage.UploadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Optional;

@Service
public class ScheduledBackupExecutor implements IScheduledBackupExecutor {

    private static final Logger log = LoggerFactory.getLogger(ScheduledBackupExecutor.class);

    private static final DateTimeFormatter NOTIFICATION_TIMESTAMP =
        DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss z", Locale.US);

    private final BackupScheduleRepository scheduleRepository;
    private final IBackupLedgerService ledgerService;
    private final ISnapshotCollector snapshotCollector;
    private final IBackupPackager packager;
    private final BackupUploader uploader;
    private final CronExpressionEvaluator cronEvaluator;
    private final IBackupNotificationService notificationService;
    private final Clock clock;

    public ScheduledBackupExecutor(BackupScheduleRepository scheduleRepository,
                                   IBackupLedgerService ledgerService,
                                   ISnapshotCollector snapshotCollector,
                                   IBackupPackager packager,
                                   BackupUploader uploader,
                                   CronExpressionEvaluator cronEvaluator,
                                   IBackupNotificationService notificationService,
                                   Clock clock) {
        this.scheduleRepository = scheduleRepository;
        this.ledgerService = ledgerService;
        this.snapshotCollector = snapshotCollector;
        this.packager = packager;
        this.uploader = uploader;
        this.cronEvaluator = cronEvaluator;
        this.notificationService = notificationService;
        this.clock = clock;
    }

    @Override
    public BackupExecutionResult executeScheduledBackup(Long scheduleId) {
        BackupSchedule schedule = scheduleRepository.findById(scheduleId)
            .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));

        Instant startedAt = Instant.now(clock);
        log.info("Iniciando backup agendado '{}' (id {})", schedule.getName(), scheduleId);

        // O registro IN_PROGRESS precisa existir antes de qualquer trabalho
        Long backupId = ledgerService.begin(schedule).getId();

        SnapshotPayload payload;
        PackagedBackup packaged;
        UploadResult upload;
        try {
            payload = snapshotCollector.collect();
            payload.fromSchedule(schedule.getId(), schedule.getName());
            packaged = packager.pack(payload, schedule.isEncryptionEnabled());
            upload = uploader.upload(packaged);
            ledgerService.complete(backupId, payload, packaged, upload);
        } catch (Exception e) {
            return handleFailure(schedule, backupId, e);
        }

        Instant finishedAt = Instant.now(clock);
        recordRun(scheduleId, finishedAt, BackupSchedule.RunStatus.SUCCESS, backupId);

        log.info("Backup agendado '{}' concluído: {} registros, {} bytes, arquivo {}",
            schedule.getName(), payload.getTotalRecords(), packaged.getSizeBytes(), upload.getFileName());

        if (schedule.isEmailOnSuccess()) {
            BackupSuccessDetails details = new BackupSuccessDetails(
                upload.getFileName(),
                String.valueOf(backupId),
                schedule.getName(),
                formatSize(packaged.getSizeBytes()),
                formatDuration(startedAt, finishedAt),
                formatTimestamp(finishedAt, schedule.getTimezone()));
            notifySafely(schedule, () -> notificationService.notifySuccess(details));
        }
        return BackupExecutionResult.success(backupId);
    }

    private BackupExecutionResult handleFailure(BackupSchedule schedule, Long backupId, Exception cause) {
        String error = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        log.error("Backup agendado '{}' falhou: {}", schedule.getName(), error, cause);

        try {
            ledgerService.fail(backupId, error);
        } catch (Exception e) {
            log.error("Não foi possível marcar o backup {} como FAILED: {}", backupId, e.getMessage(), e);
        }
        Instant failedAt = Instant.now(clock);
        recordRun(schedule.getId(), failedAt, BackupSchedule.RunStatus.FAILED, backupId);

        if (schedule.isEmailOnFailure()) {
            BackupFailureDetails details = new BackupFailureDetails(
                schedule.getName(), error, formatTimestamp(failedAt, schedule.getTimezone()));
            notifySafely(schedule, () -> notificationService.notifyFailure(details));
        }
        return BackupExecutionResult.failure(backupId, error);
    }

    private void notifySafely(BackupSchedule schedule, Runnable notification) {
        try {
            notification.run();
        } catch (Exception e) {
            log.warn("Falha ao notificar resultado do backup '{}': {}", schedule.getName(), e.getMessage());
        }
    }

    /**
     * Grava o resultado e avança a próxima execução, inclusive em falhas,
     * para que o agendamento não seja disparado de novo no tick seguinte.
     * A expressão e o fuso são relidos agora, pois podem ter sido editados
     * durante a execução. Agendamentos removidos nesse meio tempo são ignorados.
     */
    private void recordRun(Long scheduleId, Instant runAt, BackupSchedule.RunStatus status, Long backupId) {
        try {
            Optional<BackupSchedule> current = scheduleRepository.findById(scheduleId);
            if (current.isEmpty()) {
                log.warn("Agendamento {} removido durante a execução; resultado não registrado", scheduleId);
                return;
            }
            BackupSchedule schedule = current.get();
            Instant nextRun = cronEvaluator.nextRun(schedule.getCronExpression(), schedule.getTimezone(), runAt);
            Long lastBackupId = status == BackupSchedule.RunStatus.SUCCESS ? backupId : schedule.getLastRunBackupId();
            scheduleRepository.recordRun(scheduleId, runAt, status, lastBackupId, nextRun);
        } catch (Exception e) {
            log.error("Falha ao registrar a execução do agendamento {}: {}", scheduleId, e.getMessage(), e);
        }
    }

    static String formatSize(long bytes) {
        return String.format(Locale.ROOT, "%.2f MB", bytes / (1024.0 * 1024.0));
    }

    static String formatDuration(Instant start, Instant end) {
        return Duration.between(start, end).toSeconds() + "s";
    }

    private String formatTimestamp(Instant instant, String timezone) {
        ZoneId zone;
        try {
            zone = cronEvaluator.resolveZone(timezone);
        } catch (RuntimeException e) {
            zone = ZoneId.of("UTC");
        }
        return NOTIFICATION_TIMESTAMP.format(instant.atZone(zone));
    }
}
