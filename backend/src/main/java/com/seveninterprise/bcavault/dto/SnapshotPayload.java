package com.seveninterprise.bcavault.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot lógico completo dos domínios da aplicação.
 * Estrutura efêmera: serializada, opcionalmente criptografada e enviada ao storage.
 */
@JsonPropertyOrder({"version", "type", "encrypted", "createdAt", "scheduleId", "scheduleName", "description",
    "createdBy", "tables", "recordCounts", "totalRecords", "data"})
public class SnapshotPayload {

    public static final String CURRENT_VERSION = "1.0";
    public static final String TYPE_SCHEDULED = "scheduled";
    public static final String TYPE_MANUAL = "manual";

    private String version = CURRENT_VERSION;
    private String type = TYPE_SCHEDULED;
    private boolean encrypted;
    private Instant createdAt;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Long scheduleId;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String scheduleName;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String description;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Long createdBy;
    private List<String> tables;
    private Map<String, Integer> recordCounts = new LinkedHashMap<>();
    private long totalRecords;
    private Map<String, List<Map<String, Object>>> data = new LinkedHashMap<>();

    public SnapshotPayload() {
    }

    public SnapshotPayload(Instant createdAt, List<String> tables,
                           Map<String, List<Map<String, Object>>> data) {
        this.createdAt = createdAt;
        this.tables = tables;
        this.data = data;
        long total = 0;
        for (Map.Entry<String, List<Map<String, Object>>> entry : data.entrySet()) {
            recordCounts.put(entry.getKey(), entry.getValue().size());
            total += entry.getValue().size();
        }
        this.totalRecords = total;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public boolean isEncrypted() {
        return encrypted;
    }

    public void setEncrypted(boolean encrypted) {
        this.encrypted = encrypted;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    /**
     * Identifica o agendamento de origem no próprio artefato
     */
    public void fromSchedule(Long scheduleId, String scheduleName) {
        this.type = TYPE_SCHEDULED;
        this.scheduleId = scheduleId;
        this.scheduleName = scheduleName;
    }

    public void asManual(String description, Long createdBy) {
        this.type = TYPE_MANUAL;
        this.description = description;
        this.createdBy = createdBy;
    }

    public Long getScheduleId() {
        return scheduleId;
    }

    public void setScheduleId(Long scheduleId) {
        this.scheduleId = scheduleId;
    }

    public String getScheduleName() {
        return scheduleName;
    }

    public void setScheduleName(String scheduleName) {
        this.scheduleName = scheduleName;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Long getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(Long createdBy) {
        this.createdBy = createdBy;
    }

    public List<String> getTables() {
        return tables;
    }

    public void setTables(List<String> tables) {
        this.tables = tables;
    }

    public Map<String, Integer> getRecordCounts() {
        return recordCounts;
    }

    public void setRecordCounts(Map<String, Integer> recordCounts) {
        this.recordCounts = recordCounts;
    }

    public long getTotalRecords() {
        return totalRecords;
    }

    public void setTotalRecords(long totalRecords) {
        this.totalRecords = totalRecords;
    }

    public Map<String, List<Map<String, Object>>> getData() {
        return data;
    }

    public void setData(Map<String, List<Map<String, Object>>> data) {
        this.data = data;
    }
}
