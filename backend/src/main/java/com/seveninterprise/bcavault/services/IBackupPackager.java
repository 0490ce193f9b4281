package com.seveninterprise.bcavault.services;

import com.seveninterprise.bcavault.dto.PackagedBackup;
import com.seveninterprise.bcavault.dto.SnapshotPayload;

import java.util.Optional;

/**
 * Serialização, criptografia e integridade dos artefatos de backup
 *
 * Formato do artefato:
 * - Sem criptografia: JSON do SnapshotPayload (UTF-8)
 * - Com criptografia: envelope JSON com algoritmo, IV, tag, chave, dados cifrados
 *   e checksum SHA-256 calculado sobre os dados cifrados
 */
public interface IBackupPackager {

    String CONTENT_TYPE = "application/json";

    /**
     * Empacota o snapshot. Qualquer falha criptográfica é propagada: um
     * backup que pediu criptografia nunca é gravado em texto claro.
     *
     * @param payload Snapshot coletado
     * @param encrypt Se o conteúdo deve ser criptografado
     * @return Bytes prontos para upload e metadados da cifra (quando houver)
     */
    PackagedBackup pack(SnapshotPayload payload, boolean encrypt);

    /**
     * Lê um artefato gravado, verificando checksum e tag quando criptografado
     */
    SnapshotPayload unpack(byte[] content);

    /**
     * Verifica o checksum do envelope sem descriptografar.
     * Artefatos sem criptografia não possuem checksum e retornam true.
     */
    boolean verifyChecksum(byte[] content);

    /**
     * Checksum declarado no envelope, ou vazio se o artefato não estiver criptografado
     */
    Optional<String> envelopeChecksum(byte[] content);
}
