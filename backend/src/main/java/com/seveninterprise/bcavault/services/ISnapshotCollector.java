package com.seveninterprise.bcavault.services;

import com.seveninterprise.bcavault.dto.SnapshotPayload;

/**
 * Coleta de snapshot lógico completo
 *
 * Percorre a lista fixa de domínios (BackupDomain) na ordem de dependência
 * e lê todos os registros de cada um. A falha de um domínio isolado não
 * aborta o snapshot: o domínio entra com zero registros.
 */
public interface ISnapshotCollector {

    /**
     * Coleta todos os domínios
     *
     * @return Payload com domínios, contagens e registros
     */
    SnapshotPayload collect();
}
