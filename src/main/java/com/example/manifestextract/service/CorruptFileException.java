package com.example.manifestextract.service;

public class CorruptFileException extends ManifestFileException {

    public CorruptFileException(String message) {
        super(message);
    }

    public CorruptFileException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorType() {
        return "CORRUPT_FILE";
    }
}
