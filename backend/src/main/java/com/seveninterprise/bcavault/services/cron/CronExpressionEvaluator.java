package com.seveninterprise.bcavault.services.cron;

import com.seveninterprise.bcavault.exceptions.InvalidScheduleExpressionException;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Calcula a próxima execução de expressões cron em um fuso IANA.
 * Função pura: pode ser chamada para pré-visualização e validação sem efeitos colaterais.
 */
@Component
public class CronExpressionEvaluator {

    public Instant nextRun(String expression, String timezone, Instant referenceTime) {
        ZoneId zone = resolveZone(timezone);
        return CronSchedule.parse(expression).next(referenceTime, zone);
    }

    /**
     * Próximas execuções em sequência, cada uma calculada a partir da anterior
     */
    public List<Instant> previewNextRuns(String expression, String timezone, Instant referenceTime, int count) {
        ZoneId zone = resolveZone(timezone);
        CronSchedule schedule = CronSchedule.parse(expression);

        List<Instant> runs = new ArrayList<>(Math.max(count, 0));
        Instant reference = referenceTime;
        for (int i = 0; i < count; i++) {
            reference = schedule.next(reference, zone);
            runs.add(reference);
        }
        return runs;
    }

    /**
     * Valida expressão e fuso, lançando InvalidScheduleExpressionException
     */
    public void validate(String expression, String timezone) {
        resolveZone(timezone);
        CronSchedule.parse(expression);
    }

    public ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            throw new InvalidScheduleExpressionException("Fuso horário não informado");
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new InvalidScheduleExpressionException("Fuso horário inválido: " + timezone, e);
        }
    }
}
