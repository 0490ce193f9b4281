package com.seveninterprise.bcavault.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.seveninterprise.bcavault.dto.BackupMetadata;
import com.seveninterprise.bcavault.exceptions.BackupException;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Converte os metadados do ledger de/para JSON.
 * Na leitura, conteúdo ilegível resulta em vazio em vez de exceção.
 */
@Component
public class BackupMetadataCodec {

    private final ObjectMapper objectMapper;

    public BackupMetadataCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(BackupMetadata metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new BackupException("Falha ao serializar metadados do backup", e);
        }
    }

    public Optional<BackupMetadata> read(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(json, BackupMetadata.class));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
