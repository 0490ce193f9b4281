package com.seveninterprise.bcavault.controllers;

import com.seveninterprise.bcavault.dto.BackupDownloadLink;
import com.seveninterprise.bcavault.dto.BackupExecutionResult;
import com.seveninterprise.bcavault.dto.BackupHistoryStats;
import com.seveninterprise.bcavault.dto.BackupVerificationResult;
import com.seveninterprise.bcavault.dto.CreateManualBackupRequest;
import com.seveninterprise.bcavault.dto.CreateScheduleRequest;
import com.seveninterprise.bcavault.dto.UpdateScheduleRequest;
import com.seveninterprise.bcavault.model.BackupSchedule;
import com.seveninterprise.bcavault.model.DatabaseBackup;
import com.seveninterprise.bcavault.services.IBackupLedgerService;
import com.seveninterprise.bcavault.services.IBackupRetentionService;
import com.seveninterprise.bcavault.services.IBackupScheduleService;
import com.seveninterprise.bcavault.services.IBackupVerificationService;
import com.seveninterprise.bcavault.services.IManualBackupService;
import com.seveninterprise.bcavault.services.IScheduledBackupExecutor;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Controller REST para administração dos backups agendados
 *
 * Endpoints disponíveis:
 * - GET    /api/backup/schedules                      - Listar agendamentos
 * - POST   /api/backup/schedules                      - Criar agendamento
 * - GET    /api/backup/schedules/{id}                 - Detalhes do agendamento
 * - PATCH  /api/backup/schedules/{id}                 - Atualização parcial
 * - DELETE /api/backup/schedules/{id}                 - Remover agendamento
 * - POST   /api/backup/schedules/{id}/trigger         - Executar backup agora
 * - GET    /api/backup/schedules/stats                - Estatísticas
 * - GET    /api/backup/schedules/preview              - Próximas execuções de uma expressão
 * - POST   /api/backup/schedules/initialize-default   - Garantir agendamento padrão
 *
 * - POST   /api/backup/manual                         - Backup manual imediato
 * - POST   /api/backup/cleanup                        - Limpeza por retenção
 * - GET    /api/backup/history                        - Histórico do ledger
 * - GET    /api/backup/history/stats                  - Estatísticas do ledger
 * - GET    /api/backup/history/{id}                   - Detalhes de um backup
 * - DELETE /api/backup/history/{id}                   - Remover backup e artefato
 * - GET    /api/backup/history/{id}/download          - Localizador do artefato
 * - POST   /api/backup/history/{id}/verify            - Verificar integridade de um backup
 *
 * Erros de validação e de agendamento são tratados pelo GlobalExceptionHandler.
 */
@RestController
@RequestMapping("/api/backup")
public class BackupScheduleController {

    private final IBackupScheduleService scheduleService;
    private final IScheduledBackupExecutor backupExecutor;
    private final IBackupRetentionService retentionService;
    private final IBackupLedgerService ledgerService;
    private final IBackupVerificationService verificationService;
    private final IManualBackupService manualBackupService;

    public BackupScheduleController(IBackupScheduleService scheduleService,
                                    IScheduledBackupExecutor backupExecutor,
                                    IBackupRetentionService retentionService,
                                    IBackupLedgerService ledgerService,
                                    IBackupVerificationService verificationService,
                                    IManualBackupService manualBackupService) {
        this.scheduleService = scheduleService;
        this.backupExecutor = backupExecutor;
        this.retentionService = retentionService;
        this.ledgerService = ledgerService;
        this.verificationService = verificationService;
        this.manualBackupService = manualBackupService;
    }

    // ============================================
    // AGENDAMENTOS
    // ============================================

    @GetMapping("/schedules")
    public ResponseEntity<List<BackupSchedule>> listSchedules() {
        return ResponseEntity.ok(scheduleService.listSchedules());
    }

    @PostMapping("/schedules")
    public ResponseEntity<BackupSchedule> createSchedule(@Valid @RequestBody CreateScheduleRequest request) {
        BackupSchedule schedule = scheduleService.createSchedule(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(schedule);
    }

    @GetMapping("/schedules/{scheduleId}")
    public ResponseEntity<BackupSchedule> getSchedule(@PathVariable Long scheduleId) {
        return ResponseEntity.ok(scheduleService.getSchedule(scheduleId));
    }

    @PatchMapping("/schedules/{scheduleId}")
    public ResponseEntity<BackupSchedule> updateSchedule(@PathVariable Long scheduleId,
                                                         @Valid @RequestBody UpdateScheduleRequest request) {
        return ResponseEntity.ok(scheduleService.updateSchedule(scheduleId, request));
    }

    @DeleteMapping("/schedules/{scheduleId}")
    public ResponseEntity<Map<String, Object>> deleteSchedule(@PathVariable Long scheduleId) {
        scheduleService.deleteSchedule(scheduleId);
        return ResponseEntity.ok(response(true, "Agendamento removido"));
    }

    /**
     * Executa o backup imediatamente, pelo mesmo caminho usado pelo verificador
     */
    @PostMapping("/schedules/{scheduleId}/trigger")
    public ResponseEntity<Map<String, Object>> triggerBackup(@PathVariable Long scheduleId) {
        BackupExecutionResult result = backupExecutor.executeScheduledBackup(scheduleId);

        Map<String, Object> body = response(result.isSuccess(),
            result.isSuccess() ? "Backup concluído com sucesso" : "Falha no backup: " + result.getError());
        body.put("backupId", result.getBackupId());

        if (!result.isSuccess()) {
            return ResponseEntity.internalServerError().body(body);
        }
        return ResponseEntity.ok(body);
    }

    @GetMapping("/schedules/stats")
    public ResponseEntity<BackupSchedule.ScheduleStats> getScheduleStats() {
        return ResponseEntity.ok(scheduleService.getScheduleStats());
    }

    @GetMapping("/schedules/preview")
    public ResponseEntity<List<Instant>> previewNextRuns(@RequestParam String cronExpression,
                                                         @RequestParam(defaultValue = "America/New_York") String timezone,
                                                         @RequestParam(defaultValue = "5") int count) {
        return ResponseEntity.ok(scheduleService.previewNextRuns(cronExpression, timezone, count));
    }

    @PostMapping("/schedules/initialize-default")
    public ResponseEntity<BackupSchedule> initializeDefaultSchedule() {
        return ResponseEntity.ok(scheduleService.ensureDefaultSchedule());
    }

    // ============================================
    // LEDGER E RETENÇÃO
    // ============================================

    @PostMapping("/manual")
    public ResponseEntity<DatabaseBackup> createManualBackup(@Valid @RequestBody CreateManualBackupRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(manualBackupService.createManualBackup(request));
    }

    @PostMapping("/cleanup")
    public ResponseEntity<Map<String, Object>> cleanupOldBackups() {
        int deleted = retentionService.cleanupOldBackups();
        Map<String, Object> body = response(true, deleted + " backup(s) removido(s)");
        body.put("deletedCount", deleted);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/history")
    public ResponseEntity<List<DatabaseBackup>> getBackupHistory() {
        return ResponseEntity.ok(ledgerService.listHistory());
    }

    @GetMapping("/history/stats")
    public ResponseEntity<BackupHistoryStats> getHistoryStats() {
        return ResponseEntity.ok(ledgerService.getHistoryStats());
    }

    @GetMapping("/history/{backupId}")
    public ResponseEntity<DatabaseBackup> getBackup(@PathVariable Long backupId) {
        return ResponseEntity.ok(ledgerService.getBackup(backupId));
    }

    @DeleteMapping("/history/{backupId}")
    public ResponseEntity<Map<String, Object>> deleteBackup(@PathVariable Long backupId) {
        ledgerService.deleteBackup(backupId);
        return ResponseEntity.ok(response(true, "Backup removido"));
    }

    @GetMapping("/history/{backupId}/download")
    public ResponseEntity<BackupDownloadLink> getDownloadLink(@PathVariable Long backupId) {
        return ResponseEntity.ok(ledgerService.getDownloadLink(backupId));
    }

    @PostMapping("/history/{backupId}/verify")
    public ResponseEntity<BackupVerificationResult> verifyBackup(@PathVariable Long backupId) {
        return ResponseEntity.ok(verificationService.verifyBackup(backupId));
    }

    private Map<String, Object> response(boolean success, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", success);
        body.put("message", message);
        body.put("timestamp", Instant.now());
        return body;
    }
}
