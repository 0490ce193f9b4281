package com.seveninterprise.bcavault.services;

import com.seveninterprise.bcavault.dto.BackupDownloadLink;
import com.seveninterprise.bcavault.dto.BackupHistoryStats;
import com.seveninterprise.bcavault.dto.PackagedBackup;
import com.seveninterprise.bcavault.dto.SnapshotPayload;
import com.seveninterprise.bcavault.model.BackupSchedule;
import com.seveninterprise.bcavault.model.DatabaseBackup;
import com.seveninterprise.bcavault.services.storage.UploadResult;

import java.util.List;
import java.util.Optional;

/**
 * Ledger de tentativas de backup
 *
 * Cada execução:
 * 1. Cria o registro IN_PROGRESS antes de qualquer trabalho
 * 2. Conclui uma única vez, como COMPLETED ou FAILED
 *
 * As transições sempre releem o registro pelo id, de modo que uma falha ao
 * gravar a conclusão ainda permite registrar a falha.
 */
public interface IBackupLedgerService {

    /**
     * Registra o início de um backup agendado (status IN_PROGRESS)
     */
    DatabaseBackup begin(BackupSchedule schedule);

    /**
     * Registra o início de um backup manual (status IN_PROGRESS)
     */
    DatabaseBackup beginManual(String description, Long createdBy, boolean encrypt);

    /**
     * Transição para COMPLETED com tamanho, contagens, localizador e criptografia
     */
    DatabaseBackup complete(Long backupId, SnapshotPayload payload, PackagedBackup packaged, UploadResult upload);

    /**
     * Transição para FAILED preservando a origem e a mensagem de erro
     */
    DatabaseBackup fail(Long backupId, String error);

    List<DatabaseBackup> listHistory();

    Optional<DatabaseBackup> findById(Long backupId);

    /**
     * @throws com.seveninterprise.bcavault.exceptions.BackupNotFoundException se o id não existir
     */
    DatabaseBackup getBackup(Long backupId);

    /**
     * Remove o registro e, em seguida, o artefato no storage (melhor esforço).
     *
     * @return false se o registro não pôde ser removido
     */
    boolean delete(DatabaseBackup backup);

    /**
     * Remove um backup pelo id, propagando falhas na remoção do registro
     */
    void deleteBackup(Long backupId);

    /**
     * Localizador e nome do arquivo de um backup concluído
     */
    BackupDownloadLink getDownloadLink(Long backupId);

    BackupHistoryStats getHistoryStats();
}
