package com.seveninterprise.bcavault.dto;

import jakarta.validation.constraints.Size;

public class CreateManualBackupRequest {
    @Size(max = 500, message = "Description cannot exceed 500 characters")
    private String description;

    private boolean encrypted = false;

    private Long createdBy;

    public CreateManualBackupRequest() {}

    public CreateManualBackupRequest(String description, boolean encrypted) {
        this.description = description;
        this.encrypted = encrypted;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public boolean isEncrypted() {
        return encrypted;
    }

    public void setEncrypted(boolean encrypted) {
        this.encrypted = encrypted;
    }

    public Long getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(Long createdBy) {
        this.createdBy = createdBy;
    }
}
