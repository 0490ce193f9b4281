package com.seveninterprise.bcavault.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.seveninterprise.bcavault.dto.EncryptedEnvelope;
import com.seveninterprise.bcavault.dto.EncryptionResult;
import com.seveninterprise.bcavault.dto.PackagedBackup;
import com.seveninterprise.bcavault.dto.SnapshotPayload;
import com.seveninterprise.bcavault.exceptions.BackupEncryptionException;
import com.seveninterprise.bcavault.exceptions.BackupException;
import com.seveninterprise.bcavault.model.EncryptionMetadata;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

@Service
public class BackupPackager implements IBackupPackager {

    private final IBackupEncryptionService encryptionService;
    private final ObjectMapper objectMapper;

    public BackupPackager(IBackupEncryptionService encryptionService, ObjectMapper objectMapper) {
        this.encryptionService = encryptionService;
        this.objectMapper = objectMapper;
    }

    @Override
    public PackagedBackup pack(SnapshotPayload payload, boolean encrypt) {
        payload.setEncrypted(encrypt);
        String json = writeJson(payload, true);

        if (!encrypt) {
            return new PackagedBackup(json.getBytes(StandardCharsets.UTF_8), null);
        }

        EncryptionResult encrypted = encryptionService.encrypt(json);
        String checksum = encryptionService.checksum(encrypted.getCiphertext());

        EncryptedEnvelope envelope = new EncryptedEnvelope();
        envelope.setAlgorithm(encrypted.getAlgorithm());
        envelope.setIv(encrypted.getIv());
        envelope.setAuthTag(encrypted.getAuthTag());
        envelope.setKeyId(encrypted.getKeyId());
        envelope.setData(encrypted.getCiphertext());
        envelope.setChecksum(checksum);

        EncryptionMetadata metadata = new EncryptionMetadata(
            encrypted.getAlgorithm(),
            encrypted.getIv(),
            encrypted.getAuthTag(),
            encrypted.getKeyId(),
            checksum);

        return new PackagedBackup(writeJson(envelope, false).getBytes(StandardCharsets.UTF_8), metadata);
    }

    @Override
    public SnapshotPayload unpack(byte[] content) {
        JsonNode root = readTree(content);
        String json;
        if (isEnvelope(root)) {
            EncryptedEnvelope envelope = objectMapper.convertValue(root, EncryptedEnvelope.class);
            if (!checksumMatches(envelope)) {
                throw new BackupEncryptionException("Checksum do backup não confere: conteúdo adulterado ou corrompido");
            }
            json = encryptionService.decrypt(
                envelope.getData(), envelope.getIv(), envelope.getAuthTag(), envelope.getKeyId());
        } else {
            json = new String(content, StandardCharsets.UTF_8);
        }

        try {
            return objectMapper.readValue(json, SnapshotPayload.class);
        } catch (JsonProcessingException e) {
            throw new BackupException("Conteúdo do backup inválido: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public boolean verifyChecksum(byte[] content) {
        JsonNode root = readTree(content);
        if (!isEnvelope(root)) {
            return true;
        }
        return checksumMatches(objectMapper.convertValue(root, EncryptedEnvelope.class));
    }

    @Override
    public Optional<String> envelopeChecksum(byte[] content) {
        JsonNode root = readTree(content);
        if (!isEnvelope(root)) {
            return Optional.empty();
        }
        return Optional.ofNullable(root.path("checksum").textValue());
    }

    private boolean checksumMatches(EncryptedEnvelope envelope) {
        if (envelope.getData() == null || envelope.getChecksum() == null) {
            return false;
        }
        return envelope.getChecksum().equalsIgnoreCase(encryptionService.checksum(envelope.getData()));
    }

    private boolean isEnvelope(JsonNode root) {
        return root.path("encrypted").asBoolean(false) && root.has("data") && root.get("data").isTextual();
    }

    private JsonNode readTree(byte[] content) {
        try {
            return objectMapper.readTree(content);
        } catch (IOException e) {
            throw new BackupException("Conteúdo do backup não é JSON válido", e);
        }
    }

    private String writeJson(Object value, boolean pretty) {
        try {
            if (pretty) {
                return objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(value);
            }
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new BackupException("Falha ao serializar backup: " + e.getOriginalMessage(), e);
        }
    }
}
