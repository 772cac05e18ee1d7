package org.example.modelgen.service;

/**
 * Exception thrown when a generated asset cannot be fetched or written locally.
 */
public class AssetDownloadException extends RuntimeException {

    public AssetDownloadException(String message) {
        super(message);
    }

    public AssetDownloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
