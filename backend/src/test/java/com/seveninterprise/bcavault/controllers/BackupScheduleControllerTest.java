package com.seveninterprise.bcavault.controllers;

import com.seveninterprise.bcavault.dto.BackupDownloadLink;
import com.seveninterprise.bcavault.dto.BackupExecutionResult;
import com.seveninterprise.bcavault.dto.BackupHistoryStats;
import com.seveninterprise.bcavault.dto.CreateManualBackupRequest;
import com.seveninterprise.bcavault.dto.CreateScheduleRequest;
import com.seveninterprise.bcavault.dto.ErrorResponse;
import com.seveninterprise.bcavault.exceptions.BackupNotAvailableException;
import com.seveninterprise.bcavault.exceptions.InvalidScheduleExpressionException;
import com.seveninterprise.bcavault.exceptions.ScheduleNotFoundException;
import com.seveninterprise.bcavault.model.BackupSchedule;
import com.seveninterprise.bcavault.model.DatabaseBackup;
import com.seveninterprise.bcavault.services.IBackupLedgerService;
import com.seveninterprise.bcavault.services.IBackupRetentionService;
import com.seveninterprise.bcavault.services.IBackupScheduleService;
import com.seveninterprise.bcavault.services.IBackupVerificationService;
import com.seveninterprise.bcavault.services.IManualBackupService;
import com.seveninterprise.bcavault.services.IScheduledBackupExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for BackupScheduleController
 */
@ExtendWith(MockitoExtension.class)
class BackupScheduleControllerTest {

    @Mock
    private IBackupScheduleService scheduleService;

    @Mock
    private IScheduledBackupExecutor backupExecutor;

    @Mock
    private IBackupRetentionService retentionService;

    @Mock
    private IBackupLedgerService ledgerService;

    @Mock
    private IBackupVerificationService verificationService;

    @Mock
    private IManualBackupService manualBackupService;

    @InjectMocks
    private BackupScheduleController controller;

    private BackupSchedule schedule;

    @BeforeEach
    void setUp() {
        schedule = new BackupSchedule();
        schedule.setId(1L);
        schedule.setName("Daily Backup (3 AM Eastern)");
    }

    @Test
    void listSchedules_ReturnsOk() {
        // Given
        when(scheduleService.listSchedules()).thenReturn(List.of(schedule));

        // When
        ResponseEntity<List<BackupSchedule>> response = controller.listSchedules();

        // Then
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(1, response.getBody().size());
    }

    @Test
    void createSchedule_ReturnsCreated() {
        // Given
        CreateScheduleRequest request = new CreateScheduleRequest("Nightly", "0 1 * * *", "UTC");
        when(scheduleService.createSchedule(request)).thenReturn(schedule);

        // When
        ResponseEntity<BackupSchedule> response = controller.createSchedule(request);

        // Then
        assertEquals(HttpStatus.CREATED, response.getStatusCode());
        assertSame(schedule, response.getBody());
    }

    @Test
    void triggerBackup_SuccessReturnsOk() {
        // Given
        when(backupExecutor.executeScheduledBackup(1L)).thenReturn(BackupExecutionResult.success(42L));

        // When
        ResponseEntity<Map<String, Object>> response = controller.triggerBackup(1L);

        // Then
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(true, response.getBody().get("success"));
        assertEquals(42L, response.getBody().get("backupId"));
    }

    @Test
    void triggerBackup_FailureReturnsServerError() {
        // Given
        when(backupExecutor.executeScheduledBackup(1L)).thenReturn(BackupExecutionResult.failure(43L, "disco cheio"));

        // When
        ResponseEntity<Map<String, Object>> response = controller.triggerBackup(1L);

        // Then
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals(false, response.getBody().get("success"));
        assertTrue(((String) response.getBody().get("message")).contains("disco cheio"));
    }

    @Test
    void cleanupOldBackups_ReturnsDeletedCount() {
        // Given
        when(retentionService.cleanupOldBackups()).thenReturn(3);

        // When
        ResponseEntity<Map<String, Object>> response = controller.cleanupOldBackups();

        // Then
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(3, response.getBody().get("deletedCount"));
    }

    @Test
    void deleteSchedule_DelegatesToService() {
        ResponseEntity<Map<String, Object>> response = controller.deleteSchedule(1L);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        verify(scheduleService).deleteSchedule(1L);
    }

    @Test
    void createManualBackup_ReturnsCreated() {
        // Given
        CreateManualBackupRequest request = new CreateManualBackupRequest("Antes da migração", true);
        DatabaseBackup backup = DatabaseBackup.start(DatabaseBackup.BackupType.MANUAL, Instant.EPOCH, "{}");
        when(manualBackupService.createManualBackup(request)).thenReturn(backup);

        // When
        ResponseEntity<DatabaseBackup> response = controller.createManualBackup(request);

        // Then
        assertEquals(HttpStatus.CREATED, response.getStatusCode());
        assertSame(backup, response.getBody());
    }

    @Test
    void getHistoryStats_ReturnsOk() {
        BackupHistoryStats stats = new BackupHistoryStats();
        stats.setTotalBackups(4L);
        when(ledgerService.getHistoryStats()).thenReturn(stats);

        ResponseEntity<BackupHistoryStats> response = controller.getHistoryStats();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(4L, response.getBody().getTotalBackups());
    }

    @Test
    void deleteBackup_DelegatesToLedger() {
        ResponseEntity<Map<String, Object>> response = controller.deleteBackup(42L);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(true, response.getBody().get("success"));
        verify(ledgerService).deleteBackup(42L);
    }

    @Test
    void getDownloadLink_ReturnsLocator() {
        when(ledgerService.getDownloadLink(42L)).thenReturn(new BackupDownloadLink("file:///data/f.json", "f.json"));

        ResponseEntity<BackupDownloadLink> response = controller.getDownloadLink(42L);

        assertEquals("f.json", response.getBody().getFileName());
        assertEquals("file:///data/f.json", response.getBody().getUrl());
    }

    @Test
    void exceptionHandler_NotAvailableIsBadRequest() {
        ResponseEntity<ErrorResponse> response =
            new GlobalExceptionHandler().handleNotAvailable(new BackupNotAvailableException(42L));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("BACKUP_NOT_AVAILABLE", response.getBody().getError());
    }

    @Test
    void exceptionHandler_MapsErrorsToStatus() {
        GlobalExceptionHandler handler = new GlobalExceptionHandler();

        ResponseEntity<ErrorResponse> notFound = handler.handleNotFound(new ScheduleNotFoundException(9L));
        ResponseEntity<ErrorResponse> invalid =
            handler.handleInvalidSchedule(new InvalidScheduleExpressionException("Expressão cron inválida"));

        assertEquals(HttpStatus.NOT_FOUND, notFound.getStatusCode());
        assertEquals("NOT_FOUND", notFound.getBody().getError());
        assertEquals(HttpStatus.BAD_REQUEST, invalid.getStatusCode());
        assertEquals(400, invalid.getBody().getStatus());
    }
}
