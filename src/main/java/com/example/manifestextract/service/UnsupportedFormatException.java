package com.example.manifestextract.service;

public class UnsupportedFormatException extends ManifestFileException {

    public UnsupportedFormatException(String message) {
        super(message);
    }

    @Override
    public String errorType() {
        return "UNSUPPORTED_FORMAT";
    }
}
