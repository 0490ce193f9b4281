package com.seveninterprise.bcavault.services;

import com.seveninterprise.bcavault.dto.SnapshotPayload;
import com.seveninterprise.bcavault.model.BackupDomain;
import com.seveninterprise.bcavault.repositories.DomainRecordReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class SnapshotCollector implements ISnapshotCollector {

    private static final Logger log = LoggerFactory.getLogger(SnapshotCollector.class);

    private final DomainRecordReader recordReader;
    private final Clock clock;

    public SnapshotCollector(DomainRecordReader recordReader, Clock clock) {
        this.recordReader = recordReader;
        this.clock = clock;
    }

    @Override
    public SnapshotPayload collect() {
        Map<String, List<Map<String, Object>>> data = new LinkedHashMap<>();
        List<String> tables = new ArrayList<>();

        for (BackupDomain domain : BackupDomain.inBackupOrder()) {
            tables.add(domain.getDomainName());
            try {
                List<Map<String, Object>> records = recordReader.readAll(domain);
                data.put(domain.getDomainName(), records != null ? records : Collections.emptyList());
            } catch (Exception e) {
                log.warn("Não foi possível incluir a tabela {} no backup: {}", domain.getTableName(), e.getMessage());
                data.put(domain.getDomainName(), Collections.emptyList());
            }
        }

        SnapshotPayload payload = new SnapshotPayload(Instant.now(clock), tables, data);
        log.debug("Snapshot coletado: {} domínios, {} registros", tables.size(), payload.getTotalRecords());
        return payload;
    }
}
