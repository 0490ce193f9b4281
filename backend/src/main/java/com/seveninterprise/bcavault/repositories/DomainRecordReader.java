package com.seveninterprise.bcavault.repositories;

import com.seveninterprise.bcavault.model.BackupDomain;

import java.util.List;
import java.util.Map;

/**
 * Leitura completa das tabelas de domínio da aplicação (somente leitura)
 */
public interface DomainRecordReader {

    /**
     * Lê todos os registros atuais de um domínio
     *
     * @param domain Domínio a ser lido
     * @return Linhas como mapas coluna → valor, na ordem das colunas
     */
    List<Map<String, Object>> readAll(BackupDomain domain);
}
