package com.seveninterprise.bcavault.repositories;

import com.seveninterprise.bcavault.model.BackupSchedule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repositório para gerenciamento de agendamentos de backup
 */
@Repository
public interface BackupScheduleRepository extends JpaRepository<BackupSchedule, Long> {

    Optional<BackupSchedule> findFirstByName(String name);

    boolean existsByName(String name);

    /**
     * Busca agendamentos ordenados por data de criação (mais recente primeiro)
     */
    List<BackupSchedule> findAllByOrderByCreatedAtDesc();

    /**
     * Busca agendamentos habilitados cuja próxima execução já passou
     */
    @Query("SELECT s FROM BackupSchedule s WHERE " +
           "s.enabled = true AND " +
           "s.nextRunAt IS NOT NULL AND " +
           "s.nextRunAt <= :now " +
           "ORDER BY s.nextRunAt ASC")
    List<BackupSchedule> findDueSchedules(@Param("now") Instant now);

    /**
     * Grava apenas as colunas de execução, sem sobrescrever edições feitas
     * pelo administrador enquanto o backup rodava.
     *
     * @return Linhas afetadas (0 se o agendamento foi removido)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE BackupSchedule s SET " +
           "s.lastRunAt = :runAt, " +
           "s.lastRunStatus = :status, " +
           "s.lastRunBackupId = :backupId, " +
           "s.nextRunAt = :nextRunAt, " +
           "s.updatedAt = :runAt " +
           "WHERE s.id = :id")
    int recordRun(@Param("id") Long id,
                  @Param("runAt") Instant runAt,
                  @Param("status") BackupSchedule.RunStatus status,
                  @Param("backupId") Long backupId,
                  @Param("nextRunAt") Instant nextRunAt);

    long countByEnabledTrue();

    Optional<BackupSchedule> findFirstByEnabledTrueAndNextRunAtIsNotNullOrderByNextRunAtAsc();
}
