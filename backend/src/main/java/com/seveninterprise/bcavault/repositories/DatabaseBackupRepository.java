package com.seveninterprise.bcavault.repositories;

import com.seveninterprise.bcavault.model.DatabaseBackup;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repositório do ledger de backups
 */
@Repository
public interface DatabaseBackupRepository extends JpaRepository<DatabaseBackup, Long> {

    /**
     * Busca todos os backups ordenados por data de criação (mais recente primeiro)
     */
    List<DatabaseBackup> findAllByOrderByCreatedAtDesc();

    /**
     * Backups de um tipo criados até a data de corte (candidatos à limpeza)
     */
    List<DatabaseBackup> findByBackupTypeAndCreatedAtLessThanEqual(DatabaseBackup.BackupType backupType,
                                                                   Instant cutoff);

    /**
     * Backups mais recentes de um tipo, limitados pela página
     */
    List<DatabaseBackup> findByBackupTypeOrderByCreatedAtDesc(DatabaseBackup.BackupType backupType,
                                                              Pageable pageable);

    List<DatabaseBackup> findByStatus(DatabaseBackup.BackupStatus status);

    long countByStatus(DatabaseBackup.BackupStatus status);

    /**
     * Soma dos tamanhos dos backups em um status (0 quando não há nenhum)
     */
    @Query("SELECT COALESCE(SUM(b.fileSize), 0) FROM DatabaseBackup b WHERE b.status = :status")
    long sumFileSizeByStatus(@Param("status") DatabaseBackup.BackupStatus status);

    Optional<DatabaseBackup> findFirstByStatusOrderByCreatedAtDesc(DatabaseBackup.BackupStatus status);
}
