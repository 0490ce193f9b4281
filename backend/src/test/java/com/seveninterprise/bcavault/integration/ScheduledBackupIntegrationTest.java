package com.seveninterprise.bcavault.integration;

import com.seveninterprise.bcavault.dto.BackupExecutionResult;
import com.seveninterprise.bcavault.dto.BackupDownloadLink;
import com.seveninterprise.bcavault.dto.BackupVerificationResult;
import com.seveninterprise.bcavault.dto.CreateManualBackupRequest;
import com.seveninterprise.bcavault.dto.CreateScheduleRequest;
import com.seveninterprise.bcavault.model.BackupSchedule;
import com.seveninterprise.bcavault.model.DatabaseBackup;
import com.seveninterprise.bcavault.repositories.BackupScheduleRepository;
import com.seveninterprise.bcavault.repositories.DatabaseBackupRepository;
import com.seveninterprise.bcavault.services.IBackupLedgerService;
import com.seveninterprise.bcavault.services.IBackupSchedulerService;
import com.seveninterprise.bcavault.services.IBackupScheduleService;
import com.seveninterprise.bcavault.services.IBackupVerificationService;
import com.seveninterprise.bcavault.services.IManualBackupService;
import com.seveninterprise.bcavault.services.IScheduledBackupExecutor;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Teste de integração do fluxo de backup agendado com H2 e storage em diretório temporário.
 *
 * As tabelas de domínio não existem no H2, então cada domínio é lido como vazio.
 */
@SpringBootTest
@ActiveProfiles("test")
class ScheduledBackupIntegrationTest {

    @Autowired
    private IBackupScheduleService scheduleService;

    @Autowired
    private IScheduledBackupExecutor backupExecutor;

    @Autowired
    private IBackupVerificationService verificationService;

    @Autowired
    private IBackupSchedulerService schedulerService;

    @Autowired
    private IManualBackupService manualBackupService;

    @Autowired
    private IBackupLedgerService ledgerService;

    @Autowired
    private BackupScheduleRepository scheduleRepository;

    @Autowired
    private DatabaseBackupRepository backupRepository;

    @Test
    void contextLoads_WithSchedulerStopped() {
        assertFalse(schedulerService.isRunning(), "Scheduler should not auto-start in tests");
    }

    @Test
    void ensureDefaultSchedule_IsIdempotent() {
        BackupSchedule first = scheduleService.ensureDefaultSchedule();
        BackupSchedule second = scheduleService.ensureDefaultSchedule();

        assertEquals(first.getId(), second.getId());
        assertTrue(scheduleRepository.findFirstByName(first.getName()).isPresent());
        assertNotNull(first.getNextRunAt());
        assertTrue(first.isEncryptionEnabled());
    }

    @Test
    void executeScheduledBackup_EncryptedEndToEnd() {
        // Arrange
        BackupSchedule schedule = scheduleService.createSchedule(
            new CreateScheduleRequest("Integration Encrypted", "0 3 * * *", "America/New_York"));

        // Act
        BackupExecutionResult result = backupExecutor.executeScheduledBackup(schedule.getId());

        // Assert
        assertTrue(result.isSuccess(), result.getError());
        DatabaseBackup backup = backupRepository.findById(result.getBackupId()).orElseThrow();
        assertEquals(DatabaseBackup.BackupStatus.COMPLETED, backup.getStatus());
        assertEquals(DatabaseBackup.BackupType.SCHEDULED, backup.getBackupType());
        assertTrue(backup.isEncrypted());
        assertEquals("aes-256-gcm", backup.getEncryptionAlgorithm());
        assertEquals("test-key", backup.getEncryptionKeyId());
        assertNotNull(backup.getBackupPath());
        assertTrue(backup.getBackupPath().endsWith(".json.encrypted"));
        assertEquals(Long.valueOf(0L), backup.getRecordCount());

        BackupSchedule updated = scheduleRepository.findById(schedule.getId()).orElseThrow();
        assertEquals(BackupSchedule.RunStatus.SUCCESS, updated.getLastRunStatus());
        assertEquals(result.getBackupId(), updated.getLastRunBackupId());
        assertTrue(updated.getNextRunAt().isAfter(updated.getLastRunAt()));

        BackupVerificationResult verification = verificationService.verifyBackup(result.getBackupId());
        assertTrue(verification.isValid(), verification.getMessage());
    }

    @Test
    void recordRun_KeepsColumnsEditedByAdministrators() {
        // Arrange: edição feita enquanto o backup rodava
        BackupSchedule schedule = scheduleService.createSchedule(
            new CreateScheduleRequest("Integration Edited", "0 3 * * *", "UTC"));
        schedule.setEnabled(false);
        schedule.setRetentionDays(7);
        scheduleRepository.save(schedule);
        Instant runAt = Instant.parse("2025-01-16T03:00:05Z");
        Instant nextRun = Instant.parse("2025-01-17T03:00:00Z");

        // Act
        int updated = scheduleRepository.recordRun(schedule.getId(), runAt, BackupSchedule.RunStatus.FAILED, null, nextRun);
        int missing = scheduleRepository.recordRun(-1L, runAt, BackupSchedule.RunStatus.FAILED, null, nextRun);

        // Assert
        assertEquals(1, updated);
        assertEquals(0, missing);
        BackupSchedule reloaded = scheduleRepository.findById(schedule.getId()).orElseThrow();
        assertFalse(reloaded.isEnabled());
        assertEquals(7, reloaded.getRetentionDays());
        assertEquals(BackupSchedule.RunStatus.FAILED, reloaded.getLastRunStatus());
        assertEquals(runAt, reloaded.getLastRunAt());
        assertEquals(nextRun, reloaded.getNextRunAt());
    }

    @Test
    void manualBackup_CompletesAndCanBeDownloadedAndDeleted() {
        // Act
        DatabaseBackup backup = manualBackupService.createManualBackup(
            new CreateManualBackupRequest("Integration manual", false));

        // Assert
        assertEquals(DatabaseBackup.BackupStatus.COMPLETED, backup.getStatus());
        assertEquals(DatabaseBackup.BackupType.MANUAL, backup.getBackupType());
        assertFalse(backup.isEncrypted());

        BackupDownloadLink link = ledgerService.getDownloadLink(backup.getId());
        assertTrue(link.getFileName().endsWith(".json"));
        assertTrue(verificationService.verifyBackup(backup.getId()).isValid());

        ledgerService.deleteBackup(backup.getId());
        assertTrue(backupRepository.findById(backup.getId()).isEmpty());
    }
}
