package com.seveninterprise.bcavault.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.seveninterprise.bcavault.dto.PackagedBackup;
import com.seveninterprise.bcavault.dto.SnapshotPayload;
import com.seveninterprise.bcavault.exceptions.BackupEncryptionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Testes unitários para BackupPackager
 *
 * Testa:
 * - Envelope criptografado e metadados da cifra
 * - Leitura de volta com verificação de checksum e tag
 * - Detecção de adulteração
 * - Artefato sem criptografia
 */
class BackupPackagerTest {

    private ObjectMapper objectMapper;
    private BackupPackager packager;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        packager = new BackupPackager(new AesGcmBackupEncryptionService(null, "segredo", "key-test"), objectMapper);
    }

    @Test
    void testPack_EncryptedEnvelope() throws Exception {
        // Act
        PackagedBackup packaged = packager.pack(samplePayload(), true);

        // Assert
        assertTrue(packaged.isEncrypted());
        assertEquals("aes-256-gcm", packaged.getEncryption().getAlgorithm());
        assertEquals("key-test", packaged.getEncryption().getKeyId());

        JsonNode envelope = objectMapper.readTree(packaged.getContent());
        assertTrue(envelope.get("encrypted").asBoolean());
        assertEquals("aes-256-gcm", envelope.get("algorithm").asText());
        assertEquals(packaged.getEncryption().getIv(), envelope.get("iv").asText());
        assertEquals(packaged.getEncryption().getAuthTag(), envelope.get("authTag").asText());
        assertEquals(packaged.getEncryption().getChecksum(), envelope.get("checksum").asText());
        assertFalse(new String(packaged.getContent(), StandardCharsets.UTF_8).contains("admin@example.com"));
    }

    @Test
    void testUnpack_RestoresEncryptedPayload() {
        PackagedBackup packaged = packager.pack(samplePayload(), true);

        SnapshotPayload restored = packager.unpack(packaged.getContent());

        assertTrue(restored.isEncrypted());
        assertEquals(List.of("users", "projects"), restored.getTables());
        assertEquals(3, restored.getTotalRecords());
        assertEquals(Instant.parse("2025-01-16T08:00:00Z"), restored.getCreatedAt());
        assertEquals("admin@example.com", restored.getData().get("users").get(0).get("email"));
        assertTrue(packager.verifyChecksum(packaged.getContent()));
    }

    @Test
    void testUnpack_TamperedDataFailsChecksum() throws Exception {
        PackagedBackup packaged = packager.pack(samplePayload(), true);
        ObjectNode envelope = (ObjectNode) objectMapper.readTree(packaged.getContent());
        envelope.put("data", AesGcmBackupEncryptionServiceTest.flipFirstHexDigit(envelope.get("data").asText()));
        byte[] tampered = objectMapper.writeValueAsBytes(envelope);

        assertFalse(packager.verifyChecksum(tampered));
        assertThrows(BackupEncryptionException.class, () -> packager.unpack(tampered));
    }

    @Test
    void testUnpack_TamperedAuthTagFailsDecryption() throws Exception {
        PackagedBackup packaged = packager.pack(samplePayload(), true);
        ObjectNode envelope = (ObjectNode) objectMapper.readTree(packaged.getContent());
        envelope.put("authTag", AesGcmBackupEncryptionServiceTest.flipFirstHexDigit(envelope.get("authTag").asText()));
        byte[] tampered = objectMapper.writeValueAsBytes(envelope);

        // O checksum cobre apenas os dados; a tag é verificada na descriptografia
        assertTrue(packager.verifyChecksum(tampered));
        assertThrows(BackupEncryptionException.class, () -> packager.unpack(tampered));
    }

    @Test
    void testPack_PlainPayload() throws Exception {
        PackagedBackup packaged = packager.pack(samplePayload(), false);

        assertFalse(packaged.isEncrypted());
        assertNull(packaged.getEncryption());
        JsonNode json = objectMapper.readTree(packaged.getContent());
        assertFalse(json.get("encrypted").asBoolean());
        assertEquals("1.0", json.get("version").asText());
        assertEquals(3, json.get("totalRecords").asInt());
        assertTrue(packager.verifyChecksum(packaged.getContent()));
        assertEquals(3, packager.unpack(packaged.getContent()).getTotalRecords());
    }

    @Test
    void testPack_EncryptionRequestedWithoutKeyNeverFallsBackToPlain() {
        BackupPackager withoutKey = new BackupPackager(new AesGcmBackupEncryptionService(null, null, null), objectMapper);

        assertThrows(BackupEncryptionException.class, () -> withoutKey.pack(samplePayload(), true));
    }

    private SnapshotPayload samplePayload() {
        Map<String, List<Map<String, Object>>> data = new LinkedHashMap<>();
        data.put("users", List.of(Map.of("id", 1, "email", "admin@example.com")));
        data.put("projects", List.of(Map.of("id", 10, "name", "HQ"), Map.of("id", 11, "name", "Annex")));
        return new SnapshotPayload(Instant.parse("2025-01-16T08:00:00Z"), List.of("users", "projects"), data);
    }
}
