package com.seveninterprise.bcavault.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Registro (ledger) de uma tentativa de backup
 *
 * Máquina de estados:
 * - IN_PROGRESS: criado antes de qualquer coleta, criptografia ou upload
 * - COMPLETED: tamanho, contagem, localizador e metadados de criptografia gravados juntos
 * - FAILED: mensagem de erro preservada nos metadados, sem localizador
 *
 * As únicas transições são IN_PROGRESS → COMPLETED e IN_PROGRESS → FAILED.
 */
@Entity
@Table(name = "database_backups", indexes = {
    @Index(name = "idx_status", columnList = "status"),
    @Index(name = "idx_created", columnList = "created_at")
})
public class DatabaseBackup {

    public enum BackupType {
        MANUAL,
        SCHEDULED
    }

    public enum BackupStatus {
        IN_PROGRESS,
        COMPLETED,
        FAILED;

        public boolean isTerminal() {
            return this != IN_PROGRESS;
        }
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "backup_type", nullable = false, length = 16)
    private BackupType backupType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private BackupStatus status = BackupStatus.IN_PROGRESS;

    @Column(name = "file_size")
    private Long fileSize;

    @Column(name = "record_count")
    private Long recordCount;

    @Column(name = "backup_path", length = 1024)
    private String backupPath;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "is_encrypted", nullable = false)
    private boolean encrypted = false;

    @Column(name = "encryption_algorithm", length = 32)
    private String encryptionAlgorithm;

    @Column(name = "encryption_iv", length = 64)
    private String encryptionIv;

    @Column(name = "encryption_auth_tag", length = 64)
    private String encryptionAuthTag;

    @Column(name = "encryption_key_id", length = 128)
    private String encryptionKeyId;

    @Column(name = "checksum", length = 128)
    private String checksum;

    @Column(name = "created_by")
    private Long createdBy;

    @Lob
    @Column(name = "metadata", columnDefinition = "TEXT")
    private String metadata;

    protected DatabaseBackup() {
    }

    public static DatabaseBackup start(BackupType backupType, Instant createdAt, String metadata) {
        return start(backupType, null, createdAt, metadata);
    }

    public static DatabaseBackup start(BackupType backupType, Long createdBy, Instant createdAt, String metadata) {
        DatabaseBackup backup = new DatabaseBackup();
        backup.backupType = backupType;
        backup.createdBy = createdBy;
        backup.createdAt = createdAt;
        backup.metadata = metadata;
        return backup;
    }

    /**
     * Transição IN_PROGRESS → COMPLETED. Metadados de criptografia só são
     * gravados quando a criptografia foi solicitada.
     */
    public void markCompleted(long fileSize, long recordCount, String backupPath,
                              EncryptionMetadata encryption, String metadata, Instant completedAt) {
        requireInProgress(BackupStatus.COMPLETED);
        if (backupPath == null || backupPath.isBlank()) {
            throw new IllegalStateException("Backup " + id + " não pode ser concluído sem localizador");
        }
        this.status = BackupStatus.COMPLETED;
        this.fileSize = fileSize;
        this.recordCount = recordCount;
        this.backupPath = backupPath;
        this.completedAt = completedAt;
        this.metadata = metadata;
        this.encrypted = encryption != null;
        if (encryption != null) {
            this.encryptionAlgorithm = encryption.getAlgorithm();
            this.encryptionIv = encryption.getIv();
            this.encryptionAuthTag = encryption.getAuthTag();
            this.encryptionKeyId = encryption.getKeyId();
            this.checksum = encryption.getChecksum();
        }
    }

    /**
     * Transição IN_PROGRESS → FAILED
     */
    public void markFailed(String metadata, Instant failedAt) {
        requireInProgress(BackupStatus.FAILED);
        this.status = BackupStatus.FAILED;
        this.backupPath = null;
        this.completedAt = failedAt;
        this.metadata = metadata;
    }

    private void requireInProgress(BackupStatus target) {
        if (status != BackupStatus.IN_PROGRESS) {
            throw new IllegalStateException(
                "Transição inválida do backup " + id + ": " + status + " → " + target);
        }
    }

    // Getters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public BackupType getBackupType() {
        return backupType;
    }

    public BackupStatus getStatus() {
        return status;
    }

    public Long getFileSize() {
        return fileSize;
    }

    public Long getRecordCount() {
        return recordCount;
    }

    public String getBackupPath() {
        return backupPath;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public boolean isEncrypted() {
        return encrypted;
    }

    public String getEncryptionAlgorithm() {
        return encryptionAlgorithm;
    }

    public String getEncryptionIv() {
        return encryptionIv;
    }

    public String getEncryptionAuthTag() {
        return encryptionAuthTag;
    }

    public String getEncryptionKeyId() {
        return encryptionKeyId;
    }

    public String getChecksum() {
        return checksum;
    }

    public Long getCreatedBy() {
        return createdBy;
    }

    public String getMetadata() {
        return metadata;
    }
}
