package com.example.manifestextract.schema;

import com.example.manifestextract.service.ExtractionOptions;
import com.example.manifestextract.service.TargetField;

import java.util.List;

/**
 * Target fields and match settings for one kind of manifest. Unset settings fall back to the defaults
 * passed to {@link #options(ExtractionOptions)}.
 */
public record ManifestSchema(
        String name,
        String description,
        Double threshold,
        Integer maxHeaderSearchRows,
        Integer maxRows,
        List<TargetField> fields
) {
    public ManifestSchema {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public ExtractionOptions options(ExtractionOptions defaults) {
        ExtractionOptions options = defaults;
        if (threshold != null) {
            options = options.withThreshold(threshold);
        }
        if (maxHeaderSearchRows != null) {
            options = options.withMaxHeaderSearchRows(maxHeaderSearchRows);
        }
        if (maxRows != null) {
            options = options.withMaxRows(maxRows);
        }
        return options;
    }

    public List<String> fieldKeys() {
        return fields.stream().map(TargetField::key).toList();
    }
}
