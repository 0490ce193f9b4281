package com.seveninterprise.bcavault.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

/**
 * Atualização parcial de um agendamento: campos nulos não são alterados
 */
public class UpdateScheduleRequest {

    @Size(min = 1, message = "Schedule name cannot be empty")
    private String name;

    private String description;

    private String cronExpression;

    private String timezone;

    private Boolean enabled;

    @Min(value = 1, message = "Retention must be at least 1 day")
    @Max(value = 365, message = "Retention cannot exceed 365 days")
    private Integer retentionDays;

    private Boolean encryptionEnabled;

    private Boolean emailOnSuccess;

    private Boolean emailOnFailure;

    public UpdateScheduleRequest() {}

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

    public Boolean getEnabled() {
        return enabled;
    }

    public void setEnabled(Boolean enabled) {
        this.enabled = enabled;
    }

    public Integer getRetentionDays() {
        return retentionDays;
    }

    public void setRetentionDays(Integer retentionDays) {
        this.retentionDays = retentionDays;
    }

    public Boolean getEncryptionEnabled() {
        return encryptionEnabled;
    }

    public void setEncryptionEnabled(Boolean encryptionEnabled) {
        this.encryptionEnabled = encryptionEnabled;
    }

    public Boolean getEmailOnSuccess() {
        return emailOnSuccess;
    }

    public void setEmailOnSuccess(Boolean emailOnSuccess) {
        this.emailOnSuccess = emailOnSuccess;
    }

    public Boolean getEmailOnFailure() {
        return emailOnFailure;
    }

    public void setEmailOnFailure(Boolean emailOnFailure) {
        this.emailOnFailure = emailOnFailure;
    }
}
