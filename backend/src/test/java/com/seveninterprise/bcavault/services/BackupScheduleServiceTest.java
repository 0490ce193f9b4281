package com.seveninterprise.bcavault.services;

import com.seveninterprise.bcavault.dto.CreateScheduleRequest;
import com.seveninterprise.bcavault.dto.UpdateScheduleRequest;
import com.seveninterprise.bcavault.exceptions.InvalidScheduleExpressionException;
import com.seveninterprise.bcavault.exceptions.ScheduleNotFoundException;
import com.seveninterprise.bcavault.model.BackupSchedule;
import com.seveninterprise.bcavault.model.DatabaseBackup;
import com.seveninterprise.bcavault.repositories.BackupScheduleRepository;
import com.seveninterprise.bcavault.repositories.DatabaseBackupRepository;
import com.seveninterprise.bcavault.services.cron.CronExpressionEvaluator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Testes unitários para BackupScheduleService
 *
 * Testa:
 * - Criação idempotente do agendamento padrão
 * - Validação de expressão e fuso antes de gravar
 * - Recalculo da próxima execução em atualizações
 * - Estatísticas das execuções recentes
 */
@ExtendWith(MockitoExtension.class)
class BackupScheduleServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-15T10:00:00Z");
    private static final String DEFAULT_NAME = "Daily Backup (3 AM Eastern)";

    @Mock
    private BackupScheduleRepository scheduleRepository;

    @Mock
    private DatabaseBackupRepository backupRepository;

    private BackupScheduleService scheduleService;

    private BackupSchedule existing;

    @BeforeEach
    void setUp() {
        scheduleService = new BackupScheduleService(
            scheduleRepository,
            backupRepository,
            new CronExpressionEvaluator(),
            Clock.fixed(NOW, ZoneOffset.UTC)
        );
        ReflectionTestUtils.setField(scheduleService, "defaultScheduleName", DEFAULT_NAME);
        ReflectionTestUtils.setField(scheduleService, "defaultScheduleDescription", "Automated daily backup");
        ReflectionTestUtils.setField(scheduleService, "defaultScheduleCron", "0 3 * * *");
        ReflectionTestUtils.setField(scheduleService, "defaultScheduleTimezone", "America/New_York");
        ReflectionTestUtils.setField(scheduleService, "defaultScheduleRetentionDays", 30);
        ReflectionTestUtils.setField(scheduleService, "statsRecentWindow", 10);

        existing = new BackupSchedule();
        existing.setId(1L);
        existing.setName(DEFAULT_NAME);
        existing.setCronExpression("0 3 * * *");
        existing.setTimezone("America/New_York");
        existing.setNextRunAt(Instant.parse("2025-01-16T08:00:00Z"));
    }

    @Test
    void testEnsureDefaultSchedule_CreatesWhenMissing() {
        // Arrange
        when(scheduleRepository.findFirstByName(DEFAULT_NAME)).thenReturn(Optional.empty());
        when(scheduleRepository.save(any(BackupSchedule.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // Act
        BackupSchedule created = scheduleService.ensureDefaultSchedule();

        // Assert
        assertEquals(DEFAULT_NAME, created.getName());
        assertEquals("0 3 * * *", created.getCronExpression());
        assertEquals("America/New_York", created.getTimezone());
        assertTrue(created.isEnabled());
        assertTrue(created.isEncryptionEnabled());
        assertEquals(30, created.getRetentionDays());
        assertEquals(Instant.parse("2025-01-16T08:00:00Z"), created.getNextRunAt());
        verify(scheduleRepository).save(created);
    }

    @Test
    void testEnsureDefaultSchedule_IdempotentWhenPresent() {
        when(scheduleRepository.findFirstByName(DEFAULT_NAME)).thenReturn(Optional.of(existing));

        BackupSchedule first = scheduleService.ensureDefaultSchedule();
        BackupSchedule second = scheduleService.ensureDefaultSchedule();

        assertSame(existing, first);
        assertSame(existing, second);
        verify(scheduleRepository, never()).save(any());
    }

    @Test
    void testCreateSchedule_InvalidCronIsRejected() {
        CreateScheduleRequest request = new CreateScheduleRequest("Broken", "0 3 * *", "America/New_York");

        assertThrows(InvalidScheduleExpressionException.class, () -> scheduleService.createSchedule(request));
        verify(scheduleRepository, never()).save(any());
    }

    @Test
    void testCreateSchedule_InvalidTimezoneIsRejected() {
        CreateScheduleRequest request = new CreateScheduleRequest("Broken", "0 3 * * *", "Nowhere/City");

        assertThrows(InvalidScheduleExpressionException.class, () -> scheduleService.createSchedule(request));
        verify(scheduleRepository, never()).save(any());
    }

    @Test
    void testCreateSchedule_AppliesRequestFields() {
        when(scheduleRepository.save(any(BackupSchedule.class))).thenAnswer(invocation -> invocation.getArgument(0));
        CreateScheduleRequest request = new CreateScheduleRequest("Weekly", "0 2 * * 0", "UTC");
        request.setRetentionDays(90);
        request.setEncryptionEnabled(false);
        request.setEmailOnSuccess(false);
        request.setCreatedBy(5L);

        BackupSchedule created = scheduleService.createSchedule(request);

        assertEquals(90, created.getRetentionDays());
        assertFalse(created.isEncryptionEnabled());
        assertFalse(created.isEmailOnSuccess());
        assertTrue(created.isEmailOnFailure());
        assertEquals(5L, created.getCreatedBy());
        // 15/01/2025 é quarta-feira; próximo domingo é 19/01
        assertEquals(Instant.parse("2025-01-19T02:00:00Z"), created.getNextRunAt());
    }

    @Test
    void testUpdateSchedule_CronChangeRecomputesNextRun() {
        // Arrange
        when(scheduleRepository.findById(1L)).thenReturn(Optional.of(existing));
        when(scheduleRepository.save(any(BackupSchedule.class))).thenAnswer(invocation -> invocation.getArgument(0));
        UpdateScheduleRequest request = new UpdateScheduleRequest();
        request.setCronExpression("30 12 * * *");

        // Act
        BackupSchedule updated = scheduleService.updateSchedule(1L, request);

        // Assert
        assertEquals("30 12 * * *", updated.getCronExpression());
        assertEquals(Instant.parse("2025-01-15T17:30:00Z"), updated.getNextRunAt());
    }

    @Test
    void testUpdateSchedule_TimezoneChangeRecomputesNextRun() {
        when(scheduleRepository.findById(1L)).thenReturn(Optional.of(existing));
        when(scheduleRepository.save(any(BackupSchedule.class))).thenAnswer(invocation -> invocation.getArgument(0));
        UpdateScheduleRequest request = new UpdateScheduleRequest();
        request.setTimezone("UTC");

        BackupSchedule updated = scheduleService.updateSchedule(1L, request);

        assertEquals(Instant.parse("2025-01-16T03:00:00Z"), updated.getNextRunAt());
    }

    @Test
    void testUpdateSchedule_OtherFieldsKeepNextRun() {
        Instant storedNextRun = existing.getNextRunAt();
        when(scheduleRepository.findById(1L)).thenReturn(Optional.of(existing));
        when(scheduleRepository.save(any(BackupSchedule.class))).thenAnswer(invocation -> invocation.getArgument(0));
        UpdateScheduleRequest request = new UpdateScheduleRequest();
        request.setDescription("Nova descrição");
        request.setRetentionDays(60);

        BackupSchedule updated = scheduleService.updateSchedule(1L, request);

        assertEquals("Nova descrição", updated.getDescription());
        assertEquals(60, updated.getRetentionDays());
        assertEquals(storedNextRun, updated.getNextRunAt());
    }

    @Test
    void testUpdateSchedule_ReenableRecomputesNextRun() {
        existing.setEnabled(false);
        existing.setNextRunAt(Instant.parse("2024-12-01T08:00:00Z"));
        when(scheduleRepository.findById(1L)).thenReturn(Optional.of(existing));
        when(scheduleRepository.save(any(BackupSchedule.class))).thenAnswer(invocation -> invocation.getArgument(0));
        UpdateScheduleRequest request = new UpdateScheduleRequest();
        request.setEnabled(true);

        BackupSchedule updated = scheduleService.updateSchedule(1L, request);

        assertTrue(updated.isEnabled());
        assertEquals(Instant.parse("2025-01-16T08:00:00Z"), updated.getNextRunAt());
    }

    @Test
    void testUpdateSchedule_InvalidTimezoneLeavesScheduleUntouched() {
        when(scheduleRepository.findById(1L)).thenReturn(Optional.of(existing));
        UpdateScheduleRequest request = new UpdateScheduleRequest();
        request.setTimezone("Invalid/Zone");
        request.setName("Renomeado");

        assertThrows(InvalidScheduleExpressionException.class, () -> scheduleService.updateSchedule(1L, request));
        assertEquals("America/New_York", existing.getTimezone());
        assertEquals(DEFAULT_NAME, existing.getName());
        verify(scheduleRepository, never()).save(any());
    }

    @Test
    void testUpdateSchedule_NotFound() {
        when(scheduleRepository.findById(99L)).thenReturn(Optional.empty());

        assertThrows(ScheduleNotFoundException.class,
            () -> scheduleService.updateSchedule(99L, new UpdateScheduleRequest()));
    }

    @Test
    void testDeleteSchedule_DoesNotTouchLedger() {
        when(scheduleRepository.findById(1L)).thenReturn(Optional.of(existing));

        scheduleService.deleteSchedule(1L);

        verify(scheduleRepository).delete(existing);
        verifyNoInteractions(backupRepository);
    }

    @Test
    void testDeleteSchedule_NotFound() {
        when(scheduleRepository.findById(99L)).thenReturn(Optional.empty());

        assertThrows(ScheduleNotFoundException.class, () -> scheduleService.deleteSchedule(99L));
    }

    @Test
    void testPreviewNextRuns_RejectsInvalidCount() {
        assertThrows(IllegalArgumentException.class,
            () -> scheduleService.previewNextRuns("0 3 * * *", "UTC", 0));
    }

    @Test
    void testPreviewNextRuns() {
        List<Instant> runs = scheduleService.previewNextRuns("0 3 * * *", "America/New_York", 2);

        assertEquals(List.of(Instant.parse("2025-01-16T08:00:00Z"), Instant.parse("2025-01-17T08:00:00Z")), runs);
    }

    @Test
    void testGetScheduleStats() {
        // Arrange
        List<DatabaseBackup> recent = List.of(
            completed(), completed(), completed(), failed());
        when(backupRepository.findByBackupTypeOrderByCreatedAtDesc(eq(DatabaseBackup.BackupType.SCHEDULED), any(Pageable.class)))
            .thenReturn(recent);
        when(scheduleRepository.count()).thenReturn(3L);
        when(scheduleRepository.countByEnabledTrue()).thenReturn(2L);
        when(scheduleRepository.findFirstByEnabledTrueAndNextRunAtIsNotNullOrderByNextRunAtAsc())
            .thenReturn(Optional.of(existing));

        // Act
        BackupSchedule.ScheduleStats stats = scheduleService.getScheduleStats();

        // Assert
        assertEquals(3, stats.getTotalSchedules());
        assertEquals(2, stats.getEnabledSchedules());
        assertEquals(4, stats.getRecentBackups());
        assertEquals(75.0, stats.getSuccessRate(), 0.001);
        assertEquals(1, stats.getFailedCount());
        assertEquals(existing.getNextRunAt(), stats.getNextScheduledBackup());

        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
        verify(backupRepository).findByBackupTypeOrderByCreatedAtDesc(eq(DatabaseBackup.BackupType.SCHEDULED), page.capture());
        assertEquals(10, page.getValue().getPageSize());
    }

    @Test
    void testGetScheduleStats_NoHistory() {
        when(backupRepository.findByBackupTypeOrderByCreatedAtDesc(any(), any(Pageable.class))).thenReturn(List.of());
        when(scheduleRepository.findFirstByEnabledTrueAndNextRunAtIsNotNullOrderByNextRunAtAsc()).thenReturn(Optional.empty());

        BackupSchedule.ScheduleStats stats = scheduleService.getScheduleStats();

        assertEquals(0.0, stats.getSuccessRate(), 0.001);
        assertNull(stats.getNextScheduledBackup());
    }

    private DatabaseBackup completed() {
        DatabaseBackup backup = DatabaseBackup.start(DatabaseBackup.BackupType.SCHEDULED, NOW, "{}");
        backup.markCompleted(1L, 1L, "file:///a", null, "{}", NOW);
        return backup;
    }

    private DatabaseBackup failed() {
        DatabaseBackup backup = DatabaseBackup.start(DatabaseBackup.BackupType.SCHEDULED, NOW, "{}");
        backup.markFailed("{}", NOW);
        return backup;
    }
}
