package com.seveninterprise.bcavault.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Agendamento persistido de backup
 *
 * Representa uma configuração de backup automático incluindo:
 * - Expressão cron e fuso horário (IANA)
 * - Política de retenção e criptografia
 * - Preferências de notificação
 * - Controle da última e da próxima execução
 *
 * Enquanto habilitado, nextRunAt nunca é nulo: é recalculado após cada
 * execução e sempre que expressão, fuso ou estado de habilitação mudam.
 */
@Entity
@Table(name = "backup_schedules")
public class BackupSchedule {

    public enum RunStatus {
        SUCCESS,
        FAILED
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(name = "description", length = 1000)
    private String description;

    @Column(name = "cron_expression", nullable = false, length = 100)
    private String cronExpression;

    @Column(name = "timezone", nullable = false, length = 64)
    private String timezone;

    @Column(name = "is_enabled", nullable = false)
    private boolean enabled = true;

    @Column(name = "retention_days", nullable = false)
    private int retentionDays = 30;

    @Column(name = "encryption_enabled", nullable = false)
    private boolean encryptionEnabled = true;

    @Column(name = "email_on_success", nullable = false)
    private boolean emailOnSuccess = true;

    @Column(name = "email_on_failure", nullable = false)
    private boolean emailOnFailure = true;

    @Column(name = "last_run_at")
    private Instant lastRunAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_run_status", length = 16)
    private RunStatus lastRunStatus;

    @Column(name = "last_run_backup_id")
    private Long lastRunBackupId;

    @Column(name = "next_run_at")
    private Instant nextRunAt;

    @Column(name = "created_by")
    private Long createdBy;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt;

    // Getters and Setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getCronExpression() {
        return cronExpression;
    }

    public void setCronExpression(String cronExpression) {
        this.cronExpression = cronExpression;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getRetentionDays() {
        return retentionDays;
    }

    public void setRetentionDays(int retentionDays) {
        this.retentionDays = retentionDays;
    }

    public boolean isEncryptionEnabled() {
        return encryptionEnabled;
    }

    public void setEncryptionEnabled(boolean encryptionEnabled) {
        this.encryptionEnabled = encryptionEnabled;
    }

    public boolean isEmailOnSuccess() {
        return emailOnSuccess;
    }

    public void setEmailOnSuccess(boolean emailOnSuccess) {
        this.emailOnSuccess = emailOnSuccess;
    }

    public boolean isEmailOnFailure() {
        return emailOnFailure;
    }

    public void setEmailOnFailure(boolean emailOnFailure) {
        this.emailOnFailure = emailOnFailure;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    public void setLastRunAt(Instant lastRunAt) {
        this.lastRunAt = lastRunAt;
    }

    public RunStatus getLastRunStatus() {
        return lastRunStatus;
    }

    public void setLastRunStatus(RunStatus lastRunStatus) {
        this.lastRunStatus = lastRunStatus;
    }

    public Long getLastRunBackupId() {
        return lastRunBackupId;
    }

    public void setLastRunBackupId(Long lastRunBackupId) {
        this.lastRunBackupId = lastRunBackupId;
    }

    public Instant getNextRunAt() {
        return nextRunAt;
    }

    public void setNextRunAt(Instant nextRunAt) {
        this.nextRunAt = nextRunAt;
    }

    public Long getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(Long createdBy) {
        this.createdBy = createdBy;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    /**
     * Estatísticas dos agendamentos e das execuções recentes
     */
    public static class ScheduleStats {
        private int totalSchedules;
        private int enabledSchedules;
        private int recentBackups;
        private double successRate;
        private int failedCount;
        private Instant nextScheduledBackup;

        public int getTotalSchedules() {
            return totalSchedules;
        }

        public void setTotalSchedules(int totalSchedules) {
            this.totalSchedules = totalSchedules;
        }

        public int getEnabledSchedules() {
            return enabledSchedules;
        }

        public void setEnabledSchedules(int enabledSchedules) {
            this.enabledSchedules = enabledSchedules;
        }

        public int getRecentBackups() {
            return recentBackups;
        }

        public void setRecentBackups(int recentBackups) {
            this.recentBackups = recentBackups;
        }

        public double getSuccessRate() {
            return successRate;
        }

        public void setSuccessRate(double successRate) {
            this.successRate = successRate;
        }

        public int getFailedCount() {
            return failedCount;
        }

        public void setFailedCount(int failedCount) {
            this.failedCount = failedCount;
        }

        public Instant getNextScheduledBackup() {
            return nextScheduledBackup;
        }

        public void setNextScheduledBackup(Instant nextScheduledBackup) {
            this.nextScheduledBackup = nextScheduledBackup;
        }
    }
}
