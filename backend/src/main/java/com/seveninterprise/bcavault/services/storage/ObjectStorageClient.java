package com.seveninterprise.bcavault.services.storage;

/**
 * Abstração mínima do armazenamento de objetos dos backups
 */
public interface ObjectStorageClient {

    /**
     * Grava o objeto e devolve o localizador estável para recuperação
     *
     * @throws com.seveninterprise.bcavault.exceptions.BackupStorageException em falhas de escrita
     */
    String put(String key, byte[] content, String contentType);

    byte[] get(String key);

    /**
     * @return true se o objeto existia e foi removido
     */
    boolean delete(String key);
}
