package com.example.manifestextract.service;

import java.util.List;
import java.util.Map;

/**
 * How a header candidate's match ratio is computed.
 */
public enum MatchRatioMode {

    /**
     * Matched required fields over required fields. Falls back to {@link #ALL_FIELDS} when the
     * schema declares no required field at all.
     */
    REQUIRED_ONLY {
        @Override
        public double ratio(Map<String, Integer> columnMapping, List<TargetField> fields) {
            int required = 0;
            int matched = 0;
            for (TargetField field : fields) {
                if (!field.required()) {
                    continue;
                }
                required++;
                if (columnMapping.containsKey(field.key())) {
                    matched++;
                }
            }
            if (required == 0) {
                return ALL_FIELDS.ratio(columnMapping, fields);
            }
            return (double) matched / required;
        }
    },

    /**
     * Matched fields over all target fields.
     */
    ALL_FIELDS {
        @Override
        public double ratio(Map<String, Integer> columnMapping, List<TargetField> fields) {
            if (fields.isEmpty()) {
                return 0;
            }
            int matched = 0;
            for (TargetField field : fields) {
                if (columnMapping.containsKey(field.key())) {
                    matched++;
                }
            }
            return (double) matched / fields.size();
        }
    };

    public abstract double ratio(Map<String, Integer> columnMapping, List<TargetField> fields);
}
