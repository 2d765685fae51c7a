package com.example.manifestextract.config;

import com.example.manifestextract.service.ExtractionOptions;
import com.example.manifestextract.service.MatchRatioMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "manifest.extract")
public class ExtractionProperties {

    private int maxHeaderSearchRows = ExtractionOptions.DEFAULT_MAX_HEADER_SEARCH_ROWS;

    private double minColumnMatchThreshold = ExtractionOptions.DEFAULT_MIN_COLUMN_MATCH_THRESHOLD;

    private MatchRatioMode ratioMode = MatchRatioMode.REQUIRED_ONLY;

    /** Uploads above this size are refused before extraction starts. */
    private int maxFileSizeMb = 50;

    private List<String> allowedExtensions = new ArrayList<>(List.of("xlsx", "xls", "csv"));

    /** Data-row cap for kinds that do not set their own; 0 disables it. */
    private int maxRows = 10000;

    private String schemaLocation = "manifest-schemas.json";

    public ExtractionOptions defaultOptions() {
        return new ExtractionOptions(maxHeaderSearchRows, minColumnMatchThreshold, ratioMode, maxRows);
    }

    public long maxFileSizeBytes() {
        return (long) maxFileSizeMb * 1024 * 1024;
    }
}
