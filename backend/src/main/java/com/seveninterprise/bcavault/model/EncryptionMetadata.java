package com.seveninterprise.bcavault.model;

/**
 * Metadados de criptografia de um artefato de backup.
 * IV, tag e checksum em hexadecimal.
 */
public final class EncryptionMetadata {

    private final String algorithm;
    private final String iv;
    private final String authTag;
    private final String keyId;
    private final String checksum;

    public EncryptionMetadata(String algorithm, String iv, String authTag, String keyId, String checksum) {
        this.algorithm = algorithm;
        this.iv = iv;
        this.authTag = authTag;
        this.keyId = keyId;
        this.checksum = checksum;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public String getIv() {
        return iv;
    }

    public String getAuthTag() {
        return authTag;
    }

    public String getKeyId() {
        return keyId;
    }

    public String getChecksum() {
        return checksum;
    }
}
