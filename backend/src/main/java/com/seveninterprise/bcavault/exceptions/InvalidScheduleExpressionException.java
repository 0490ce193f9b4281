package com.seveninterprise.bcavault.exceptions;

/**
 * Expressão cron ou fuso horário inválido em um agendamento.
 * Erro de configuração: nunca é corrigido silenciosamente.
 */
public class InvalidScheduleExpressionException extends BackupException {

    public InvalidScheduleExpressionException(String message) {
        super(message);
    }

    public InvalidScheduleExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
