package com.seveninterprise.bcavault.services;

import com.seveninterprise.bcavault.dto.BackupDownloadLink;
import com.seveninterprise.bcavault.dto.BackupHistoryStats;
import com.seveninterprise.bcavault.dto.BackupMetadata;
import com.seveninterprise.bcavault.dto.PackagedBackup;
import com.seveninterprise.bcavault.dto.SnapshotPayload;
import com.seveninterprise.bcavault.exceptions.BackupNotAvailableException;
import com.seveninterprise.bcavault.exceptions.BackupNotFoundException;
import com.seveninterprise.bcavault.model.BackupSchedule;
import com.seveninterprise.bcavault.model.DatabaseBackup;
import com.seveninterprise.bcavault.repositories.DatabaseBackupRepository;
import com.seveninterprise.bcavault.services.storage.ObjectStorageClient;
import com.seveninterprise.bcavault.services.storage.UploadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
public class BackupLedgerService implements IBackupLedgerService {

    private static final Logger log = LoggerFactory.getLogger(BackupLedgerService.class);

    private final DatabaseBackupRepository backupRepository;
    private final BackupMetadataCodec metadataCodec;
    private final ObjectStorageClient storageClient;
    private final Clock clock;

    public BackupLedgerService(DatabaseBackupRepository backupRepository,
                               BackupMetadataCodec metadataCodec,
                               ObjectStorageClient storageClient,
                               Clock clock) {
        this.backupRepository = backupRepository;
        this.metadataCodec = metadataCodec;
        this.storageClient = storageClient;
        this.clock = clock;
    }

    @Override
    @Transactional
    public DatabaseBackup begin(BackupSchedule schedule) {
        String metadata = metadataCodec.write(
            BackupMetadata.started(schedule.getId(), schedule.getName(), schedule.isEncryptionEnabled()));
        DatabaseBackup backup = DatabaseBackup.start(DatabaseBackup.BackupType.SCHEDULED, Instant.now(clock), metadata);
        return backupRepository.save(backup);
    }

    @Override
    @Transactional
    public DatabaseBackup beginManual(String description, Long createdBy, boolean encrypt) {
        String metadata = metadataCodec.write(BackupMetadata.manualStarted(description, createdBy, encrypt));
        DatabaseBackup backup = DatabaseBackup.start(
            DatabaseBackup.BackupType.MANUAL, createdBy, Instant.now(clock), metadata);
        return backupRepository.save(backup);
    }

    @Override
    @Transactional
    public DatabaseBackup complete(Long backupId, SnapshotPayload payload, PackagedBackup packaged,
                                   UploadResult upload) {
        DatabaseBackup backup = getBackup(backupId);
        BackupMetadata origin = metadataCodec.read(backup.getMetadata()).orElse(null);
        String authTag = packaged.isEncrypted() ? packaged.getEncryption().getAuthTag() : null;
        String metadata = metadataCodec.write(BackupMetadata.completed(
            origin,
            upload.getFileName(),
            upload.getFileKey(),
            payload,
            packaged.isEncrypted(),
            authTag));

        backup.markCompleted(
            packaged.getSizeBytes(),
            payload.getTotalRecords(),
            upload.getLocator(),
            packaged.getEncryption(),
            metadata,
            Instant.now(clock));
        return backupRepository.save(backup);
    }

    @Override
    @Transactional
    public DatabaseBackup fail(Long backupId, String error) {
        DatabaseBackup backup = getBackup(backupId);
        BackupMetadata origin = metadataCodec.read(backup.getMetadata()).orElse(null);
        backup.markFailed(metadataCodec.write(BackupMetadata.failed(origin, error)), Instant.now(clock));
        return backupRepository.save(backup);
    }

    @Override
    public List<DatabaseBackup> listHistory() {
        return backupRepository.findAllByOrderByCreatedAtDesc();
    }

    @Override
    public Optional<DatabaseBackup> findById(Long backupId) {
        return backupRepository.findById(backupId);
    }

    @Override
    public DatabaseBackup getBackup(Long backupId) {
        return backupRepository.findById(backupId)
            .orElseThrow(() -> new BackupNotFoundException(backupId));
    }

    @Override
    public boolean delete(DatabaseBackup backup) {
        try {
            backupRepository.delete(backup);
        } catch (Exception e) {
            log.warn("Erro ao remover backup {} do ledger: {}", backup.getId(), e.getMessage());
            return false;
        }
        deleteArtifact(backup);
        return true;
    }

    @Override
    public void deleteBackup(Long backupId) {
        DatabaseBackup backup = getBackup(backupId);
        backupRepository.delete(backup);
        deleteArtifact(backup);
        log.info("Backup {} removido", backupId);
    }

    @Override
    public BackupDownloadLink getDownloadLink(Long backupId) {
        DatabaseBackup backup = getBackup(backupId);
        if (backup.getStatus() != DatabaseBackup.BackupStatus.COMPLETED || backup.getBackupPath() == null) {
            throw new BackupNotAvailableException(backupId);
        }
        String fileName = metadataCodec.read(backup.getMetadata())
            .map(BackupMetadata::getFileName)
            .orElse("backup-" + backupId + ".json");
        return new BackupDownloadLink(backup.getBackupPath(), fileName);
    }

    @Override
    public BackupHistoryStats getHistoryStats() {
        BackupHistoryStats stats = new BackupHistoryStats();
        stats.setTotalBackups(backupRepository.count());
        stats.setCompletedBackups(backupRepository.countByStatus(DatabaseBackup.BackupStatus.COMPLETED));
        stats.setFailedBackups(backupRepository.countByStatus(DatabaseBackup.BackupStatus.FAILED));
        stats.setTotalStorageUsed(backupRepository.sumFileSizeByStatus(DatabaseBackup.BackupStatus.COMPLETED));
        backupRepository.findFirstByStatusOrderByCreatedAtDesc(DatabaseBackup.BackupStatus.COMPLETED)
            .ifPresent(last -> {
                stats.setLastBackupDate(last.getCreatedAt());
                stats.setLastBackupStatus(last.getStatus());
            });
        return stats;
    }

    /**
     * Só é chamado depois que o registro saiu do ledger. Falhas do storage
     * deixam no máximo um arquivo órfão.
     */
    private void deleteArtifact(DatabaseBackup backup) {
        Optional<String> fileKey = metadataCodec.read(backup.getMetadata()).map(BackupMetadata::getFileKey);
        if (fileKey.isEmpty()) {
            return;
        }
        try {
            storageClient.delete(fileKey.get());
        } catch (Exception e) {
            log.warn("Não foi possível remover o arquivo {} do backup {}: {}",
                fileKey.get(), backup.getId(), e.getMessage());
        }
    }
}
