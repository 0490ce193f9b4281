package com.seveninterprise.bcavault.services;

import com.seveninterprise.bcavault.dto.EncryptionResult;
import com.seveninterprise.bcavault.exceptions.BackupEncryptionException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;

@Service
public class AesGcmBackupEncryptionService implements IBackupEncryptionService {

    private static final Logger log = LoggerFactory.getLogger(AesGcmBackupEncryptionService.class);

    private static final String CIPHER_ALGORITHM = "AES/GCM/NoPadding";
    private static final int TAG_LENGTH_BITS = 128;
    private static final int TAG_LENGTH_BYTES = TAG_LENGTH_BITS / 8;
    private static final int IV_LENGTH_BYTES = 12;
    private static final int KEY_LENGTH_BYTES = 32;

    private static final HexFormat HEX = HexFormat.of();

    private final SecureRandom secureRandom = new SecureRandom();

    @Value("${bcavault.backup.encryption.key:}")
    private String encodedKey;

    @Value("${bcavault.backup.encryption.passphrase:}")
    private String passphrase;

    @Value("${bcavault.backup.encryption.key-id:}")
    private String configuredKeyId;

    private SecretKey secretKey;
    private String keyId;

    public AesGcmBackupEncryptionService() {
    }

    public AesGcmBackupEncryptionService(String encodedKey, String passphrase, String keyId) {
        this.encodedKey = encodedKey;
        this.passphrase = passphrase;
        this.configuredKeyId = keyId;
        init();
    }

    @PostConstruct
    public void init() {
        byte[] keyBytes = null;
        if (StringUtils.hasText(encodedKey)) {
            keyBytes = Base64.getDecoder().decode(encodedKey.trim());
            if (keyBytes.length != KEY_LENGTH_BYTES) {
                throw new BackupEncryptionException(
                    "bcavault.backup.encryption.key deve ter 32 bytes (AES-256), recebido: " + keyBytes.length);
            }
        } else if (StringUtils.hasText(passphrase)) {
            keyBytes = sha256(passphrase.getBytes(StandardCharsets.UTF_8));
        }

        if (keyBytes == null) {
            log.warn("Chave de criptografia de backup não configurada; backups criptografados irão falhar");
            this.secretKey = null;
            this.keyId = null;
            return;
        }

        this.secretKey = new SecretKeySpec(keyBytes, "AES");
        this.keyId = StringUtils.hasText(configuredKeyId)
            ? configuredKeyId.trim()
            : "backup-key-" + HEX.formatHex(sha256(keyBytes)).substring(0, 12);
    }

    @Override
    public EncryptionResult encrypt(String plaintext) {
        if (secretKey == null) {
            throw new BackupEncryptionException("Chave de criptografia de backup não configurada");
        }
        try {
            byte[] iv = new byte[IV_LENGTH_BYTES];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(CIPHER_ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            // O JCE anexa a tag ao final do texto cifrado
            byte[] ciphertext = Arrays.copyOfRange(sealed, 0, sealed.length - TAG_LENGTH_BYTES);
            byte[] authTag = Arrays.copyOfRange(sealed, sealed.length - TAG_LENGTH_BYTES, sealed.length);

            return new EncryptionResult(
                HEX.formatHex(ciphertext),
                HEX.formatHex(iv),
                HEX.formatHex(authTag),
                keyId,
                ALGORITHM);
        } catch (GeneralSecurityException e) {
            throw new BackupEncryptionException("Falha ao criptografar backup: " + e.getMessage(), e);
        }
    }

    @Override
    public String decrypt(String ciphertextHex, String ivHex, String authTagHex, String requestedKeyId) {
        if (secretKey == null) {
            throw new BackupEncryptionException("Chave de criptografia de backup não configurada");
        }
        if (requestedKeyId != null && !requestedKeyId.equals(keyId)) {
            throw new BackupEncryptionException("Chave " + requestedKeyId + " não está disponível");
        }
        try {
            byte[] ciphertext = HEX.parseHex(ciphertextHex);
            byte[] iv = HEX.parseHex(ivHex);
            byte[] authTag = HEX.parseHex(authTagHex);
            if (authTag.length != TAG_LENGTH_BYTES) {
                throw new BackupEncryptionException("Tag de autenticação inválida");
            }

            byte[] sealed = new byte[ciphertext.length + authTag.length];
            System.arraycopy(ciphertext, 0, sealed, 0, ciphertext.length);
            System.arraycopy(authTag, 0, sealed, ciphertext.length, authTag.length);

            Cipher cipher = Cipher.getInstance(CIPHER_ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new BackupEncryptionException("Dados criptografados em formato inválido", e);
        } catch (GeneralSecurityException e) {
            throw new BackupEncryptionException("Falha ao descriptografar backup: " + e.getMessage(), e);
        }
    }

    @Override
    public String checksum(String data) {
        return HEX.formatHex(sha256(data.getBytes(StandardCharsets.UTF_8)));
    }

    @Override
    public boolean isConfigured() {
        return secretKey != null;
    }

    public String getKeyId() {
        return keyId;
    }

    private static byte[] sha256(byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 indisponível", e);
        }
    }
}
