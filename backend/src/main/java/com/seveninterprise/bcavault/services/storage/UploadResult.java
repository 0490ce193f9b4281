package com.seveninterprise.bcavault.services.storage;

public class UploadResult {

    private final String fileName;
    private final String fileKey;
    private final String locator;

    public UploadResult(String fileName, String fileKey, String locator) {
        this.fileName = fileName;
        this.fileKey = fileKey;
        this.locator = locator;
    }

    public String getFileName() {
        return fileName;
    }

    public String getFileKey() {
        return fileKey;
    }

    public String getLocator() {
        return locator;
    }
}
