package com.example.manifestextract.service;

/**
 * The uploaded file could not be turned into a workbook. Extraction stops with no partial result.
 */
public abstract class ManifestFileException extends RuntimeException {

    protected ManifestFileException(String message) {
        super(message);
    }

    protected ManifestFileException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String errorType();
}
