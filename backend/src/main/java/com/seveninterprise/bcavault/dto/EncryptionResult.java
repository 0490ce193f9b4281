package com.seveninterprise.bcavault.dto;

/**
 * Resultado do serviço de chaves: texto cifrado e parâmetros da cifra (hex)
 */
public class EncryptionResult {

    private final String ciphertext;
    private final String iv;
    private final String authTag;
    private final String keyId;
    private final String algorithm;

    public EncryptionResult(String ciphertext, String iv, String authTag, String keyId, String algorithm) {
        this.ciphertext = ciphertext;
        this.iv = iv;
        this.authTag = authTag;
        this.keyId = keyId;
        this.algorithm = algorithm;
    }

    public String getCiphertext() {
        return ciphertext;
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

    public String getAlgorithm() {
        return algorithm;
    }
}
