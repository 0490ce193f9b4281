package com.seveninterprise.bcavault.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

public class CreateScheduleRequest {
    @NotBlank(message = "Schedule name is required")
    private String name;

    private String description;

    private String cronExpression = "0 3 * * *"; // 3h todos os dias

    private String timezone = "America/New_York";

    @Min(value = 1, message = "Retention must be at least 1 day")
    @Max(value = 365, message = "Retention cannot exceed 365 days")
    private int retentionDays = 30;

    private boolean encryptionEnabled = true;

    private boolean emailOnSuccess = true;

    private boolean emailOnFailure = true;

    private Long createdBy;

    public CreateScheduleRequest() {}

    public CreateScheduleRequest(String name, String cronExpression, String timezone) {
        this.name = name;
        this.cronExpression = cronExpression;
        this.timezone = timezone;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getCronExpression() {
        return cronExpression;
    }

    public void setCronExpression(String cronExpression) {
        this.cronExpression = cronExpression;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public int getRetentionDays() {
        return retentionDays;
    }

    public void setRetentionDays(int retentionDays) {
        this.retentionDays = retentionDays;
    }

    public boolean isEncryptionEnabled() {
        return encryptionEnabled;
    }

    public void setEncryptionEnabled(boolean encryptionEnabled) {
        this.encryptionEnabled = encryptionEnabled;
    }

    public boolean isEmailOnSuccess() {
        return emailOnSuccess;
    }

    public void setEmailOnSuccess(boolean emailOnSuccess) {
        this.emailOnSuccess = emailOnSuccess;
    }

    public boolean isEmailOnFailure() {
        return emailOnFailure;
    }

    public void setEmailOnFailure(boolean emailOnFailure) {
        this.emailOnFailure = emailOnFailure;
    }

    public Long getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(Long createdBy) {
        this.createdBy = createdBy;
    }
}
