package com.seveninterprise.bcavault.services;

import com.seveninterprise.bcavault.dto.BackupMetadata;
import com.seveninterprise.bcavault.dto.BackupVerificationResult;
import com.seveninterprise.bcavault.dto.SnapshotPayload;
import com.seveninterprise.bcavault.exceptions.BackupException;
import com.seveninterprise.bcavault.exceptions.BackupNotFoundException;
import com.seveninterprise.bcavault.model.DatabaseBackup;
import com.seveninterprise.bcavault.services.storage.ObjectStorageClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class BackupVerificationService implements IBackupVerificationService {

    private static final Logger log = LoggerFactory.getLogger(BackupVerificationService.class);

    private final IBackupLedgerService ledgerService;
    private final BackupMetadataCodec metadataCodec;
    private final ObjectStorageClient storageClient;
    private final IBackupPackager packager;

    public BackupVerificationService(IBackupLedgerService ledgerService,
                                     BackupMetadataCodec metadataCodec,
                                     ObjectStorageClient storageClient,
                                     IBackupPackager packager) {
        this.ledgerService = ledgerService;
        this.metadataCodec = metadataCodec;
        this.storageClient = storageClient;
        this.packager = packager;
    }

    @Override
    public BackupVerificationResult verifyBackup(Long backupId) {
        DatabaseBackup backup = ledgerService.findById(backupId)
            .orElseThrow(() -> new BackupNotFoundException(backupId));

        if (backup.getStatus() != DatabaseBackup.BackupStatus.COMPLETED) {
            return BackupVerificationResult.invalid(backupId, backup.isEncrypted(),
                "Backup não está concluído: " + backup.getStatus());
        }

        Optional<String> fileKey = metadataCodec.read(backup.getMetadata()).map(BackupMetadata::getFileKey);
        if (fileKey.isEmpty()) {
            return BackupVerificationResult.invalid(backupId, backup.isEncrypted(),
                "Metadados do backup não informam o arquivo");
        }

        try {
            byte[] content = storageClient.get(fileKey.get());
            Optional<String> envelopeChecksum = packager.envelopeChecksum(content);
            if (backup.isEncrypted() && envelopeChecksum.isEmpty()) {
                return BackupVerificationResult.invalid(backupId, true,
                    "Ledger registra backup criptografado, mas o artefato não está criptografado");
            }
            if (!backup.isEncrypted() && envelopeChecksum.isPresent()) {
                return BackupVerificationResult.invalid(backupId, false,
                    "Artefato criptografado para um backup registrado sem criptografia");
            }
            if (backup.isEncrypted() && !envelopeChecksum.get().equalsIgnoreCase(backup.getChecksum())) {
                return BackupVerificationResult.invalid(backupId, true, "Checksum do artefato diverge do ledger");
            }
            if (!packager.verifyChecksum(content)) {
                return BackupVerificationResult.invalid(backupId, backup.isEncrypted(), "Checksum não confere");
            }
            SnapshotPayload payload = packager.unpack(content);
            if (backup.getRecordCount() != null && backup.getRecordCount() != payload.getTotalRecords()) {
                return BackupVerificationResult.invalid(backupId, backup.isEncrypted(),
                    "Total de registros diverge do ledger: " + payload.getTotalRecords()
                        + " != " + backup.getRecordCount());
            }
            log.info("Backup {} verificado: {} registros", backupId, payload.getTotalRecords());
            return BackupVerificationResult.valid(backupId, backup.isEncrypted(), payload.getTotalRecords());
        } catch (BackupException e) {
            log.warn("Verificação do backup {} falhou: {}", backupId, e.getMessage());
            return BackupVerificationResult.invalid(backupId, backup.isEncrypted(), e.getMessage());
        }
    }
}
