package com.seveninterprise.bcavault.services.storage;

import com.seveninterprise.bcavault.exceptions.BackupStorageException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Armazenamento de objetos em diretório local (volume montado ou NFS).
 * Cada chave vira um caminho relativo ao diretório base.
 */
@Component
public class LocalObjectStorageClient implements ObjectStorageClient {

    private static final Logger log = LoggerFactory.getLogger(LocalObjectStorageClient.class);

    @Value("${bcavault.backup.storage.directory:./data/backups}")
    private String baseDirectory;

    @Value("${bcavault.backup.storage.public-base-url:}")
    private String publicBaseUrl;

    private Path root;

    public LocalObjectStorageClient() {
    }

    public LocalObjectStorageClient(Path root, String publicBaseUrl) {
        this.baseDirectory = root.toString();
        this.publicBaseUrl = publicBaseUrl;
        init();
    }

    @PostConstruct
    public void init() {
        this.root = Paths.get(baseDirectory).toAbsolutePath().normalize();
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            log.error("Erro ao criar diretório de backups {}: {}", root, e.getMessage());
        }
    }

    @Override
    public String put(String key, byte[] content, String contentType) {
        Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            Path temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new BackupStorageException("Falha ao gravar objeto " + key + ": " + e.getMessage(), e);
        }
        log.debug("Objeto gravado: {} ({} bytes, {})", key, content.length, contentType);
        return locatorFor(key, target);
    }

    @Override
    public byte[] get(String key) {
        Path source = resolve(key);
        try {
            return Files.readAllBytes(source);
        } catch (IOException e) {
            throw new BackupStorageException("Falha ao ler objeto " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            return Files.deleteIfExists(resolve(key));
        } catch (IOException e) {
            throw new BackupStorageException("Falha ao remover objeto " + key + ": " + e.getMessage(), e);
        }
    }

    private Path resolve(String key) {
        Path resolved = root.resolve(key).normalize();
        if (!resolved.startsWith(root)) {
            throw new BackupStorageException("Chave de objeto inválida: " + key);
        }
        return resolved;
    }

    private String locatorFor(String key, Path target) {
        if (StringUtils.hasText(publicBaseUrl)) {
            String base = publicBaseUrl.endsWith("/") ? publicBaseUrl : publicBaseUrl + "/";
            return base + key;
        }
        return target.toUri().toString();
    }
}
