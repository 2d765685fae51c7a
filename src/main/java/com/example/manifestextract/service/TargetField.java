package com.example.manifestextract.service;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A column the caller wants out of the manifest.
 *
 * @param key       field key used in the extracted records
 * @param aliases   accepted header spellings; the key itself is always accepted too
 * @param required  whether a failing value drops the row, and whether the field counts towards the
 *                  canonical match ratio
 * @param type      how raw cells are coerced
 * @param min       inclusive lower bound for numeric fields, or {@code null}
 * @param max       inclusive upper bound for numeric fields, or {@code null}
 * @param maxLength string values are truncated to this many characters, or {@code null}
 * @param positive  numeric values must be strictly greater than zero
 */
public record TargetField(
        String key,
        Set<String> aliases,
        boolean required,
        FieldType type,
        BigDecimal min,
        BigDecimal max,
        Integer maxLength,
        boolean positive
) {
    public TargetField {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Target field key must not be blank.");
        }
        if (maxLength != null && maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive for field " + key);
        }
        if (min != null && max != null && min.compareTo(max) > 0) {
            throw new IllegalArgumentException("min is greater than max for field " + key);
        }
        type = type == null ? FieldType.STRING : type;
        aliases = aliases == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(aliases));
    }

    public static TargetField text(String key, boolean required, Integer maxLength, String... aliases) {
        return new TargetField(key, aliasSet(aliases), required, FieldType.STRING, null, null, maxLength, false);
    }

    public static TargetField integer(String key, boolean required, BigDecimal max, String... aliases) {
        return new TargetField(key, aliasSet(aliases), required, FieldType.INTEGER, null, max, null, true);
    }

    public static TargetField decimal(String key, boolean required, BigDecimal max, boolean positive,
                                      String... aliases) {
        return new TargetField(key, aliasSet(aliases), required, FieldType.DECIMAL, null, max, null, positive);
    }

    public static TargetField date(String key, boolean required, String... aliases) {
        return new TargetField(key, aliasSet(aliases), required, FieldType.DATE, null, null, null, false);
    }

    private static Set<String> aliasSet(String... aliases) {
        return new LinkedHashSet<>(List.of(aliases));
    }
}
