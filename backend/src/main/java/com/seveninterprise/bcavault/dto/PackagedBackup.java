package com.seveninterprise.bcavault.dto;

import com.seveninterprise.bcavault.model.EncryptionMetadata;

/**
 * Artefato pronto para upload: bytes serializados e, quando criptografado,
 * os metadados da cifra.
 */
public class PackagedBackup {

    private final byte[] content;
    private final EncryptionMetadata encryption;

    public PackagedBackup(byte[] content, EncryptionMetadata encryption) {
        this.content = content;
        this.encryption = encryption;
    }

    public byte[] getContent() {
        return content;
    }

    /**
     * Nulo quando o backup não é criptografado
     */
    public EncryptionMetadata getEncryption() {
        return encryption;
    }

    public boolean isEncrypted() {
        return encryption != null;
    }

    public long getSizeBytes() {
        return content.length;
    }
}
