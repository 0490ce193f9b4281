package com.seveninterprise.bcavault.repositories;

import com.seveninterprise.bcavault.model.BackupDomain;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;

/**
 * Implementação JDBC: SELECT * em cada tabela de domínio.
 * Nomes de tabela vêm apenas do enum BackupDomain.
 */
@Repository
public class JdbcDomainRecordReader implements DomainRecordReader {

    private final JdbcTemplate jdbcTemplate;

    public JdbcDomainRecordReader(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<Map<String, Object>> readAll(BackupDomain domain) {
        return jdbcTemplate.queryForList("SELECT * FROM " + domain.getTableName());
    }
}
