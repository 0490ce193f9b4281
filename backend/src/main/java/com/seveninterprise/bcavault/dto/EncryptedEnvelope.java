package com.seveninterprise.bcavault.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Envelope JSON gravado no storage para backups criptografados.
 * data, iv e authTag em hexadecimal; checksum SHA-256 calculado sobre data.
 */
@JsonPropertyOrder({"encrypted", "algorithm", "iv", "authTag", "keyId", "data", "checksum"})
public class EncryptedEnvelope {

    private boolean encrypted = true;
    private String algorithm;
    private String iv;
    private String authTag;
    private String keyId;
    private String data;
    private String checksum;

    public boolean isEncrypted() {
        return encrypted;
    }

    public void setEncrypted(boolean encrypted) {
        this.encrypted = encrypted;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public void setAlgorithm(String algorithm) {
        this.algorithm = algorithm;
    }

    public String getIv() {
        return iv;
    }

    public void setIv(String iv) {
        this.iv = iv;
    }

    public String getAuthTag() {
        return authTag;
    }

    public void setAuthTag(String authTag) {
        this.authTag = authTag;
    }

    public String getKeyId() {
        return keyId;
    }

    public void setKeyId(String keyId) {
        this.keyId = keyId;
    }

    public String getData() {
        return data;
    }

    public void setData(String data) {
        this.data = data;
    }

    public String getChecksum() {
        return checksum;
    }

    public void setChecksum(String checksum) {
        this.checksum = checksum;
    }
}
