package com.seveninterprise.bcavault.dto;

/**
 * Localizador do artefato de um backup concluído
 */
public class BackupDownloadLink {

    private final String url;
    private final String fileName;

    public BackupDownloadLink(String url, String fileName) {
        this.url = url;
        this.fileName = fileName;
    }

    public String getUrl() {
        return url;
    }

    public String getFileName() {
        return fileName;
    }
}
