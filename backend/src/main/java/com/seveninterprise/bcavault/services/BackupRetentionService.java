package com.seveninterprise.bcavault.services;

import com.seveninterprise.bcavault.dto.BackupMetadata;
import com.seveninterprise.bcavault.model.BackupSchedule;
import com.seveninterprise.bcavault.model.DatabaseBackup;
import com.seveninterprise.bcavault.repositories.BackupScheduleRepository;
import com.seveninterprise.bcavault.repositories.DatabaseBackupRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class BackupRetentionService implements IBackupRetentionService {

    private static final Logger log = LoggerFactory.getLogger(BackupRetentionService.class);

    private final BackupScheduleRepository scheduleRepository;
    private final DatabaseBackupRepository backupRepository;
    private final BackupMetadataCodec metadataCodec;
    private final IBackupLedgerService ledgerService;
    private final Clock clock;

    public BackupRetentionService(BackupScheduleRepository scheduleRepository,
                                  DatabaseBackupRepository backupRepository,
                                  BackupMetadataCodec metadataCodec,
                                  IBackupLedgerService ledgerService,
                                  Clock clock) {
        this.scheduleRepository = scheduleRepository;
        this.backupRepository = backupRepository;
        this.metadataCodec = metadataCodec;
        this.ledgerService = ledgerService;
        this.clock = clock;
    }

    @Override
    public int cleanupOldBackups() {
        Instant now = Instant.now(clock);
        Map<Long, BackupSchedule> schedules = scheduleRepository.findAll().stream()
            .collect(Collectors.toMap(BackupSchedule::getId, Function.identity()));
        if (schedules.isEmpty()) {
            log.info("Limpeza de backups: nenhum agendamento cadastrado");
            return 0;
        }

        // O menor prazo de retenção define o corte mais recente; cada registro é
        // depois conferido contra o prazo do seu próprio agendamento
        int shortestRetention = schedules.values().stream()
            .mapToInt(BackupSchedule::getRetentionDays)
            .min()
            .getAsInt();
        List<DatabaseBackup> candidates = backupRepository.findByBackupTypeAndCreatedAtLessThanEqual(
            DatabaseBackup.BackupType.SCHEDULED, cutoff(now, shortestRetention));

        int deleted = 0;
        for (DatabaseBackup backup : candidates) {
            Optional<BackupMetadata> metadata = metadataCodec.read(backup.getMetadata());
            if (metadata.isEmpty() || metadata.get().getScheduleId() == null) {
                log.warn("Backup {} mantido: metadados não identificam o agendamento", backup.getId());
                continue;
            }
            BackupSchedule schedule = schedules.get(metadata.get().getScheduleId());
            if (schedule == null) {
                log.debug("Backup {} mantido: agendamento {} não existe mais",
                    backup.getId(), metadata.get().getScheduleId());
                continue;
            }
            if (backup.getCreatedAt().isAfter(cutoff(now, schedule.getRetentionDays()))) {
                continue;
            }
            if (ledgerService.delete(backup)) {
                deleted++;
            }
        }

        log.info("Limpeza de backups concluída: {} registro(s) removido(s)", deleted);
        return deleted;
    }

    private static Instant cutoff(Instant now, int retentionDays) {
        return now.minus(Duration.ofDays(retentionDays));
    }
}
