package com.example.manifestextract.service;

public record SheetMatch(
        int sheetIndex,
        ManifestSheet sheet,
        HeaderCandidate header
) {
    public double matchRatio() {
        return header.matchRatio();
    }
}
