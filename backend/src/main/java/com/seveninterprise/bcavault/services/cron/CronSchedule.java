package com.seveninterprise.bcavault.services.cron;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.seveninterprise.bcavault.exceptions.InvalidScheduleExpressionException;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Expressão cron de 5 campos já interpretada (sintaxe UNIX do cron-utils)
 *
 * Formato: minuto hora dia-do-mês mês dia-da-semana
 *
 * Dia da semana: 0 = domingo ... 6 = sábado (7 também é domingo).
 * Quando dia-do-mês e dia-da-semana são ambos restritos, basta um deles coincidir:
 * a expressão é dividida em duas e vale a execução mais próxima.
 */
public final class CronSchedule {

    private static final int SEARCH_HORIZON_YEARS = 5;
    private static final String EXPECTED_FORMAT = "Formato esperado: minuto hora dia-do-mês mês dia-da-semana";

    private static final CronParser PARSER =
        new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private final String expression;
    private final List<ExecutionTime> executionTimes;

    private CronSchedule(String expression, List<ExecutionTime> executionTimes) {
        this.expression = expression;
        this.executionTimes = executionTimes;
    }

    public static CronSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleExpressionException("Expressão cron vazia. " + EXPECTED_FORMAT);
        }
        String trimmed = expression.trim();
        String[] fields = trimmed.split("\\s+");
        if (fields.length != 5) {
            throw new InvalidScheduleExpressionException(
                "Expressão cron inválida '" + expression + "'. " + EXPECTED_FORMAT);
        }

        List<String> variants = new ArrayList<>(2);
        if (!fields[2].startsWith("*") && !fields[4].startsWith("*")) {
            variants.add(String.join(" ", fields[0], fields[1], fields[2], fields[3], "*"));
            variants.add(String.join(" ", fields[0], fields[1], "*", fields[3], fields[4]));
        } else {
            variants.add(String.join(" ", fields));
        }

        List<ExecutionTime> executionTimes = new ArrayList<>(variants.size());
        for (String variant : variants) {
            executionTimes.add(ExecutionTime.forCron(compile(trimmed, variant)));
        }
        return new CronSchedule(trimmed, executionTimes);
    }

    /**
     * Primeiro instante estritamente posterior à referência que satisfaz a
     * expressão, com a aritmética de calendário feita no fuso informado.
     */
    public Instant next(Instant reference, ZoneId zone) {
        ZonedDateTime start = reference.atZone(zone).truncatedTo(ChronoUnit.MINUTES);
        Instant limit = start.plusYears(SEARCH_HORIZON_YEARS).toInstant();

        Instant best = null;
        for (ExecutionTime executionTime : executionTimes) {
            Optional<Instant> candidate = nextAfter(executionTime, start, reference, limit);
            if (candidate.isPresent() && (best == null || candidate.get().isBefore(best))) {
                best = candidate.get();
            }
        }
        if (best == null) {
            throw new InvalidScheduleExpressionException(
                "Expressão cron '" + expression + "' não possui execução nos próximos "
                    + SEARCH_HORIZON_YEARS + " anos");
        }
        return best;
    }

    public String getExpression() {
        return expression;
    }

    private static Optional<Instant> nextAfter(ExecutionTime executionTime, ZonedDateTime start,
                                               Instant reference, Instant limit) {
        ZonedDateTime cursor = start;
        while (true) {
            Optional<ZonedDateTime> next;
            try {
                next = executionTime.nextExecution(cursor);
            } catch (IllegalArgumentException e) {
                return Optional.empty();
            }
            if (next.isEmpty() || next.get().toInstant().isAfter(limit)) {
                return Optional.empty();
            }
            Instant instant = next.get().toInstant();
            if (instant.isAfter(reference)) {
                return Optional.of(instant);
            }
            // Execução na própria referência não conta
            cursor = instant.isAfter(cursor.toInstant()) ? next.get() : cursor.plusMinutes(1);
        }
    }

    private static Cron compile(String expression, String variant) {
        try {
            return PARSER.parse(variant).validate();
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleExpressionException(
                "Expressão cron inválida '" + expression + "': " + e.getMessage(), e);
        }
    }
}
