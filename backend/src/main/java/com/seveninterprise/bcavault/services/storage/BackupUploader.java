package com.seveninterprise.bcavault.services.storage;

import com.seveninterprise.bcavault.dto.PackagedBackup;
import com.seveninterprise.bcavault.model.DatabaseBackup;
import com.seveninterprise.bcavault.services.IBackupPackager;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;

/**
 * Envia artefatos de backup ao storage com chave única por tentativa:
 * backups/scheduled/&lt;timestamp&gt;-&lt;sufixo&gt;.json[.encrypted]
 * (backups manuais usam o prefixo backups/manual/)
 */
@Component
public class BackupUploader {

    static final String KEY_PREFIX = "backups/scheduled/";
    static final String MANUAL_KEY_PREFIX = "backups/manual/";
    private static final String SUFFIX_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int SUFFIX_LENGTH = 6;

    private final ObjectStorageClient storageClient;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public BackupUploader(ObjectStorageClient storageClient, Clock clock) {
        this.storageClient = storageClient;
        this.clock = clock;
    }

    public UploadResult upload(PackagedBackup backup) {
        return upload(backup, DatabaseBackup.BackupType.SCHEDULED);
    }

    public UploadResult upload(PackagedBackup backup, DatabaseBackup.BackupType backupType) {
        String fileName = generateFileName(backup.isEncrypted());
        String prefix = backupType == DatabaseBackup.BackupType.MANUAL ? MANUAL_KEY_PREFIX : KEY_PREFIX;
        String fileKey = prefix + fileName;
        String locator = storageClient.put(fileKey, backup.getContent(), IBackupPackager.CONTENT_TYPE);
        return new UploadResult(fileName, fileKey, locator);
    }

    String generateFileName(boolean encrypted) {
        String timestamp = Instant.now(clock).toString().replaceAll("[:.]", "-");
        StringBuilder suffix = new StringBuilder(SUFFIX_LENGTH);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            suffix.append(SUFFIX_ALPHABET.charAt(random.nextInt(SUFFIX_ALPHABET.length())));
        }
        return timestamp + "-" + suffix + ".json" + (encrypted ? ".encrypted" : "");
    }
}
