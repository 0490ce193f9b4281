package com.seveninterprise.bcavault.services;

import com.seveninterprise.bcavault.dto.CreateScheduleRequest;
import com.seveninterprise.bcavault.dto.UpdateScheduleRequest;
import com.seveninterprise.bcavault.exceptions.ScheduleNotFoundException;
import com.seveninterprise.bcavault.model.BackupSchedule;
import com.seveninterprise.bcavault.model.DatabaseBackup;
import com.seveninterprise.bcavault.repositories.BackupScheduleRepository;
import com.seveninterprise.bcavault.repositories.DatabaseBackupRepository;
import com.seveninterprise.bcavault.services.cron.CronExpressionEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Service
public class BackupScheduleService implements IBackupScheduleService {

    private static final Logger log = LoggerFactory.getLogger(BackupScheduleService.class);

    static final int MAX_PREVIEW_RUNS = 50;

    private final BackupScheduleRepository scheduleRepository;
    private final DatabaseBackupRepository backupRepository;
    private final CronExpressionEvaluator cronEvaluator;
    private final Clock clock;

    @Value("${bcavault.backup.default-schedule.name:Daily Backup (3 AM Eastern)}")
    private String defaultScheduleName;

    @Value("${bcavault.backup.default-schedule.description:Automated daily backup at 3:00 AM Eastern Time with AES-256-GCM encryption}")
    private String defaultScheduleDescription;

    @Value("${bcavault.backup.default-schedule.cron:0 3 * * *}")
    private String defaultScheduleCron;

    @Value("${bcavault.backup.default-schedule.timezone:America/New_York}")
    private String defaultScheduleTimezone;

    @Value("${bcavault.backup.default-schedule.retention-days:30}")
    private int defaultScheduleRetentionDays;

    @Value("${bcavault.backup.stats.recent-window:10}")
    private int statsRecentWindow;

    public BackupScheduleService(BackupScheduleRepository scheduleRepository,
                                 DatabaseBackupRepository backupRepository,
                                 CronExpressionEvaluator cronEvaluator,
                                 Clock clock) {
        this.scheduleRepository = scheduleRepository;
        this.backupRepository = backupRepository;
        this.cronEvaluator = cronEvaluator;
        this.clock = clock;
    }

    @Override
    @Transactional
    public BackupSchedule ensureDefaultSchedule() {
        Optional<BackupSchedule> existing = scheduleRepository.findFirstByName(defaultScheduleName);
        if (existing.isPresent()) {
            log.debug("Agendamento padrão '{}' já existe (id {})", defaultScheduleName, existing.get().getId());
            return existing.get();
        }

        CreateScheduleRequest request = new CreateScheduleRequest(
            defaultScheduleName, defaultScheduleCron, defaultScheduleTimezone);
        request.setDescription(defaultScheduleDescription);
        request.setRetentionDays(defaultScheduleRetentionDays);
        request.setEncryptionEnabled(true);

        BackupSchedule schedule = createSchedule(request);
        log.info("Agendamento padrão '{}' criado, próxima execução em {}", schedule.getName(), schedule.getNextRunAt());
        return schedule;
    }

    @Override
    @Transactional
    public BackupSchedule createSchedule(CreateScheduleRequest request) {
        cronEvaluator.validate(request.getCronExpression(), request.getTimezone());
        validateRetention(request.getRetentionDays());

        Instant now = Instant.now(clock);
        BackupSchedule schedule = new BackupSchedule();
        schedule.setName(request.getName());
        schedule.setDescription(request.getDescription());
        schedule.setCronExpression(request.getCronExpression().trim());
        schedule.setTimezone(request.getTimezone().trim());
        schedule.setEnabled(true);
        schedule.setRetentionDays(request.getRetentionDays());
        schedule.setEncryptionEnabled(request.isEncryptionEnabled());
        schedule.setEmailOnSuccess(request.isEmailOnSuccess());
        schedule.setEmailOnFailure(request.isEmailOnFailure());
        schedule.setCreatedBy(request.getCreatedBy());
        schedule.setCreatedAt(now);
        schedule.setUpdatedAt(now);
        schedule.setNextRunAt(cronEvaluator.nextRun(schedule.getCronExpression(), schedule.getTimezone(), now));

        BackupSchedule saved = scheduleRepository.save(schedule);
        log.info("Agendamento '{}' criado ({} {})", saved.getName(), saved.getCronExpression(), saved.getTimezone());
        return saved;
    }

    @Override
    @Transactional
    public BackupSchedule updateSchedule(Long scheduleId, UpdateScheduleRequest request) {
        BackupSchedule schedule = getSchedule(scheduleId);

        String cron = request.getCronExpression() != null ? request.getCronExpression().trim() : schedule.getCronExpression();
        String timezone = request.getTimezone() != null ? request.getTimezone().trim() : schedule.getTimezone();
        boolean timingChanged = !Objects.equals(cron, schedule.getCronExpression())
            || !Objects.equals(timezone, schedule.getTimezone());
        boolean reenabled = Boolean.TRUE.equals(request.getEnabled()) && !schedule.isEnabled();

        if (timingChanged) {
            cronEvaluator.validate(cron, timezone);
        }
        if (request.getRetentionDays() != null) {
            validateRetention(request.getRetentionDays());
        }

        if (request.getName() != null) {
            schedule.setName(request.getName());
        }
        if (request.getDescription() != null) {
            schedule.setDescription(request.getDescription());
        }
        if (request.getEnabled() != null) {
            schedule.setEnabled(request.getEnabled());
        }
        if (request.getRetentionDays() != null) {
            schedule.setRetentionDays(request.getRetentionDays());
        }
        if (request.getEncryptionEnabled() != null) {
            schedule.setEncryptionEnabled(request.getEncryptionEnabled());
        }
        if (request.getEmailOnSuccess() != null) {
            schedule.setEmailOnSuccess(request.getEmailOnSuccess());
        }
        if (request.getEmailOnFailure() != null) {
            schedule.setEmailOnFailure(request.getEmailOnFailure());
        }
        schedule.setCronExpression(cron);
        schedule.setTimezone(timezone);

        Instant now = Instant.now(clock);
        if (timingChanged || reenabled) {
            schedule.setNextRunAt(cronEvaluator.nextRun(cron, timezone, now));
            log.info("Próxima execução do agendamento '{}' recalculada: {}", schedule.getName(), schedule.getNextRunAt());
        }
        schedule.setUpdatedAt(now);

        return scheduleRepository.save(schedule);
    }

    @Override
    @Transactional
    public void deleteSchedule(Long scheduleId) {
        BackupSchedule schedule = getSchedule(scheduleId);
        scheduleRepository.delete(schedule);
        log.info("Agendamento '{}' (id {}) removido", schedule.getName(), scheduleId);
    }

    @Override
    public List<BackupSchedule> listSchedules() {
        return scheduleRepository.findAllByOrderByCreatedAtDesc();
    }

    @Override
    public BackupSchedule getSchedule(Long scheduleId) {
        return scheduleRepository.findById(scheduleId)
            .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
    }

    @Override
    public List<Instant> previewNextRuns(String cronExpression, String timezone, int count) {
        if (count < 1 || count > MAX_PREVIEW_RUNS) {
            throw new IllegalArgumentException(
                "Quantidade de execuções deve estar entre 1 e " + MAX_PREVIEW_RUNS);
        }
        return cronEvaluator.previewNextRuns(cronExpression, timezone, Instant.now(clock), count);
    }

    @Override
    public BackupSchedule.ScheduleStats getScheduleStats() {
        List<DatabaseBackup> recent = backupRepository.findByBackupTypeOrderByCreatedAtDesc(
            DatabaseBackup.BackupType.SCHEDULED, PageRequest.of(0, statsRecentWindow));

        long completed = recent.stream()
            .filter(b -> b.getStatus() == DatabaseBackup.BackupStatus.COMPLETED)
            .count();
        long failed = recent.stream()
            .filter(b -> b.getStatus() == DatabaseBackup.BackupStatus.FAILED)
            .count();

        BackupSchedule.ScheduleStats stats = new BackupSchedule.ScheduleStats();
        stats.setTotalSchedules((int) scheduleRepository.count());
        stats.setEnabledSchedules((int) scheduleRepository.countByEnabledTrue());
        stats.setRecentBackups(recent.size());
        stats.setSuccessRate(recent.isEmpty() ? 0.0 : completed * 100.0 / recent.size());
        stats.setFailedCount((int) failed);
        stats.setNextScheduledBackup(scheduleRepository.findFirstByEnabledTrueAndNextRunAtIsNotNullOrderByNextRunAtAsc()
            .map(BackupSchedule::getNextRunAt)
            .orElse(null));
        return stats;
    }

    private void validateRetention(int retentionDays) {
        if (retentionDays < 1 || retentionDays > 365) {
            throw new IllegalArgumentException(
                "Retenção deve estar entre 1 e 365 dias: " + retentionDays);
        }
    }
}
