package com.seveninterprise.bcavault.services;

import com.seveninterprise.bcavault.dto.EncryptionResult;

/**
 * Serviço de chaves e criptografia autenticada dos backups
 *
 * Algoritmo: AES-256-GCM. IV, tag e texto cifrado trafegam em hexadecimal.
 */
public interface IBackupEncryptionService {

    String ALGORITHM = "aes-256-gcm";

    /**
     * Criptografa o texto com a chave ativa
     *
     * @throws com.seveninterprise.bcavault.exceptions.BackupEncryptionException se não houver chave configurada
     */
    EncryptionResult encrypt(String plaintext);

    /**
     * Descriptografa e autentica o texto cifrado
     *
     * @throws com.seveninterprise.bcavault.exceptions.BackupEncryptionException se a tag não conferir
     */
    String decrypt(String ciphertextHex, String ivHex, String authTagHex, String keyId);

    /**
     * SHA-256 em hexadecimal
     */
    String checksum(String data);

    boolean isConfigured();
}
