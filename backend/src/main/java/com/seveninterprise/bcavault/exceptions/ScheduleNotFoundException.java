package com.seveninterprise.bcavault.exceptions;

public class ScheduleNotFoundException extends BackupException {

    private final Long scheduleId;

    public ScheduleNotFoundException(Long scheduleId) {
        super("Agendamento não encontrado: " + scheduleId);
        this.scheduleId = scheduleId;
    }

    public Long getScheduleId() {
        return scheduleId;
    }
}
