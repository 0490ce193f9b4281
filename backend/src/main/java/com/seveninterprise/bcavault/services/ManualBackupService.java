package com.seveninterprise.bcavault.services;

import com.seveninterprise.bcavault.dto.CreateManualBackupRequest;
import com.seveninterprise.bcavault.dto.PackagedBackup;
import com.seveninterprise.bcavault.dto.SnapshotPayload;
import com.seveninterprise.bcavault.exceptions.BackupException;
import com.seveninterprise.bcavault.model.DatabaseBackup;
import com.seveninterprise.bcavault.services.storage.BackupUploader;
import com.seveninterprise.bcavault.services.storage.UploadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ManualBackupService implements IManualBackupService {

    private static final Logger log = LoggerFactory.getLogger(ManualBackupService.class);

    static final String DEFAULT_DESCRIPTION = "Manual backup";
    static final String DEFAULT_ENCRYPTED_DESCRIPTION = "Manual encrypted backup";

    private final IBackupLedgerService ledgerService;
    private final ISnapshotCollector snapshotCollector;
    private final IBackupPackager packager;
    private final BackupUploader uploader;

    public ManualBackupService(IBackupLedgerService ledgerService,
                               ISnapshotCollector snapshotCollector,
                               IBackupPackager packager,
                               BackupUploader uploader) {
        this.ledgerService = ledgerService;
        this.snapshotCollector = snapshotCollector;
        this.packager = packager;
        this.uploader = uploader;
    }

    @Override
    public DatabaseBackup createManualBackup(CreateManualBackupRequest request) {
        boolean encrypt = request.isEncrypted();
        String description = request.getDescription() != null && !request.getDescription().isBlank()
            ? request.getDescription().trim()
            : (encrypt ? DEFAULT_ENCRYPTED_DESCRIPTION : DEFAULT_DESCRIPTION);

        Long backupId = ledgerService.beginManual(description, request.getCreatedBy(), encrypt).getId();
        log.info("Iniciando backup manual {} ('{}', criptografado: {})", backupId, description, encrypt);

        try {
            SnapshotPayload payload = snapshotCollector.collect();
            payload.asManual(description, request.getCreatedBy());
            PackagedBackup packaged = packager.pack(payload, encrypt);
            UploadResult upload = uploader.upload(packaged, DatabaseBackup.BackupType.MANUAL);
            DatabaseBackup completed = ledgerService.complete(backupId, payload, packaged, upload);
            log.info("Backup manual {} concluído: {} registros, arquivo {}",
                backupId, payload.getTotalRecords(), upload.getFileName());
            return completed;
        } catch (Exception e) {
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Backup manual {} falhou: {}", backupId, error, e);
            try {
                ledgerService.fail(backupId, error);
            } catch (Exception failError) {
                log.error("Não foi possível marcar o backup {} como FAILED: {}", backupId, failError.getMessage());
            }
            throw new BackupException("Falha no backup manual: " + error, e);
        }
    }
}
