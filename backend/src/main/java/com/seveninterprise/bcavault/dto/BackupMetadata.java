package com.seveninterprise.bcavault.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Metadados gravados como JSON na coluna metadata do ledger.
 *
 * O campo kind identifica o conteúdo:
 * - STARTED: origem (agendamento ou descrição manual) e flag de criptografia
 * - COMPLETED: arquivo, chave no storage, domínios e contagens
 * - FAILED: agendamento de origem e mensagem de erro
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BackupMetadata {

    public enum Kind {
        STARTED,
        COMPLETED,
        FAILED
    }

    private Kind kind;
    private Long scheduleId;
    private String scheduleName;
    private String description;
    private Long createdBy;
    private Boolean encryptionEnabled;
    private String fileName;
    private String fileKey;
    private List<String> tables;
    private Map<String, Integer> recordCounts;
    private String authTag;
    private String error;

    public static BackupMetadata started(Long scheduleId, String scheduleName, boolean encryptionEnabled) {
        BackupMetadata metadata = new BackupMetadata();
        metadata.kind = Kind.STARTED;
        metadata.scheduleId = scheduleId;
        metadata.scheduleName = scheduleName;
        metadata.encryptionEnabled = encryptionEnabled;
        return metadata;
    }

    /**
     * Início de um backup manual, disparado por um administrador
     */
    public static BackupMetadata manualStarted(String description, Long createdBy, boolean encryptionEnabled) {
        BackupMetadata metadata = new BackupMetadata();
        metadata.kind = Kind.STARTED;
        metadata.description = description;
        metadata.createdBy = createdBy;
        metadata.encryptionEnabled = encryptionEnabled;
        return metadata;
    }

    public static BackupMetadata completed(Long scheduleId, String scheduleName, String fileName, String fileKey,
                                           SnapshotPayload payload, boolean encryptionEnabled, String authTag) {
        return completed(started(scheduleId, scheduleName, encryptionEnabled),
            fileName, fileKey, payload, encryptionEnabled, authTag);
    }

    /**
     * Metadados de conclusão preservando a origem (agendamento ou descrição manual)
     */
    public static BackupMetadata completed(BackupMetadata origin, String fileName, String fileKey,
                                           SnapshotPayload payload, boolean encryptionEnabled, String authTag) {
        BackupMetadata metadata = withOrigin(origin);
        metadata.kind = Kind.COMPLETED;
        metadata.fileName = fileName;
        metadata.fileKey = fileKey;
        metadata.tables = payload.getTables();
        metadata.recordCounts = payload.getRecordCounts();
        metadata.encryptionEnabled = encryptionEnabled;
        metadata.authTag = authTag;
        return metadata;
    }

    public static BackupMetadata failed(Long scheduleId, String scheduleName, String error) {
        return failed(started(scheduleId, scheduleName, false), error);
    }

    public static BackupMetadata failed(BackupMetadata origin, String error) {
        BackupMetadata metadata = withOrigin(origin);
        metadata.kind = Kind.FAILED;
        metadata.encryptionEnabled = null;
        metadata.error = error;
        return metadata;
    }

    private static BackupMetadata withOrigin(BackupMetadata origin) {
        BackupMetadata metadata = new BackupMetadata();
        if (origin != null) {
            metadata.scheduleId = origin.scheduleId;
            metadata.scheduleName = origin.scheduleName;
            metadata.description = origin.description;
            metadata.createdBy = origin.createdBy;
            metadata.encryptionEnabled = origin.encryptionEnabled;
        }
        return metadata;
    }

    public Kind getKind() {
        return kind;
    }

    public void setKind(Kind kind) {
        this.kind = kind;
    }

    public Long getScheduleId() {
        return scheduleId;
    }

    public void setScheduleId(Long scheduleId) {
        this.scheduleId = scheduleId;
    }

    public String getScheduleName() {
        return scheduleName;
    }

    public void setScheduleName(String scheduleName) {
        this.scheduleName = scheduleName;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Long getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(Long createdBy) {
        this.createdBy = createdBy;
    }

    public Boolean getEncryptionEnabled() {
        return encryptionEnabled;
    }

    public void setEncryptionEnabled(Boolean encryptionEnabled) {
        this.encryptionEnabled = encryptionEnabled;
    }

    public String getFileName() {
        return fileName;
    }

    public void setFileName(String fileName) {
        this.fileName = fileName;
    }

    public String getFileKey() {
        return fileKey;
    }

    public void setFileKey(String fileKey) {
        this.fileKey = fileKey;
    }

    public List<String> getTables() {
        return tables;
    }

    public void setTables(List<String> tables) {
        this.tables = tables;
    }

    public Map<String, Integer> getRecordCounts() {
        return recordCounts;
    }

    public void setRecordCounts(Map<String, Integer> recordCounts) {
        this.recordCounts = recordCounts;
    }

    public String getAuthTag() {
        return authTag;
    }

    public void setAuthTag(String authTag) {
        this.authTag = authTag;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }
}
