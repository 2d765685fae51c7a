package com.example.manifestextract.service;

import org.apache.poi.ss.usermodel.DateUtil;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Coerces raw cells into typed values and applies per-field bounds.
 */
public class FieldCleaner {

    static final String MISSING_REQUIRED = "missing required field";
    static final String INVALID_NUMBER = "invalid number";
    static final String OUT_OF_RANGE = "out of range";
    static final String INVALID_DATE = "invalid date";

    private static final int MAX_LONG_DIGITS = 19;

    private static final Pattern CURRENCY_PREFIX = Pattern.compile("^(?:\\p{Sc}+|[A-Za-z]{3}(?=[\\s\\p{Sc}\\d.]))\\s*");
    private static final Pattern UNIT_SUFFIX = Pattern.compile("\\s*(?:\\p{Sc}+|[A-Za-z]{2,5})$");
    private static final Pattern PLAIN_NUMBER = Pattern.compile(
            "[+-]?(?:\\d{1,3}(?:,\\d{3})+|\\d+)(?:\\.\\d+)?(?:[eE][+-]?\\d+)?|[+-]?\\.\\d+(?:[eE][+-]?\\d+)?");

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            strict("uuuu-MM-dd"),
            strict("uuuu-M-d"),
            strict("dd/MM/uuuu"),
            strict("MM/dd/uuuu"),
            strict("uuuu/MM/dd"),
            strict("dd-MM-uuuu"),
            strict("dd.MM.uuuu")
    );
    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            strict("uuuu-MM-dd HH:mm:ss"),
            strict("uuuu-MM-dd'T'HH:mm:ss")
    );

    /**
     * Cleans every field of a row. The first failing required field drops the row and is the only error
     * reported for it. Failing optional fields are emptied and reported without dropping the row.
     */
    public RowOutcome cleanRow(RawRow row, List<TargetField> fields) {
        Map<String, Object> record = new LinkedHashMap<>();
        List<RowError> advisories = new ArrayList<>();
        for (TargetField field : fields) {
            if (!row.values().containsKey(field.key())) {
                // column not present in this sheet
                record.put(field.key(), null);
                continue;
            }
            FieldOutcome outcome = clean(row.value(field.key()), field);
            if (outcome.failed()) {
                if (field.required()) {
                    return RowOutcome.dropped(new RowError(row.rowNumber(), field.key(), outcome.error(), true));
                }
                advisories.add(new RowError(row.rowNumber(), field.key(), outcome.error(), false));
                record.put(field.key(), null);
                continue;
            }
            record.put(field.key(), outcome.value());
        }
        return new RowOutcome(record, advisories);
    }

    public FieldOutcome clean(CellValue raw, TargetField field) {
        CellValue cell = raw == null ? CellValue.EMPTY : raw;
        if (field.type() == FieldType.STRING) {
            return cleanString(cell, field);
        }
        if (field.type() == FieldType.INTEGER || field.type() == FieldType.DECIMAL) {
            return cleanNumber(cell, field);
        }
        return cleanDate(cell, field);
    }

    private FieldOutcome cleanString(CellValue cell, TargetField field) {
        String value = cell.asText().trim();
        if (value.isEmpty()) {
            return missing(field);
        }
        if (field.maxLength() != null && value.length() > field.maxLength()) {
            value = value.substring(0, field.maxLength()).trim();
        }
        return FieldOutcome.ok(value);
    }

    private FieldOutcome cleanNumber(CellValue cell, TargetField field) {
        if (cell.isEmpty()) {
            return missing(field);
        }
        BigDecimal number;
        if (cell.kind() == CellKind.NUMBER) {
            number = cell.number();
        } else if (cell.kind() == CellKind.TEXT) {
            number = parseNumber(cell.text());
        } else {
            number = null;
        }
        if (number == null) {
            return FieldOutcome.failure(INVALID_NUMBER);
        }
        if (field.type() == FieldType.INTEGER && number.stripTrailingZeros().scale() > 0) {
            return FieldOutcome.failure(INVALID_NUMBER);
        }
        if (!inRange(number, field)) {
            return FieldOutcome.failure(OUT_OF_RANGE);
        }
        if (field.type() == FieldType.INTEGER) {
            if (number.precision() - number.scale() > MAX_LONG_DIGITS) {
                return FieldOutcome.failure(OUT_OF_RANGE);
            }
            try {
                return FieldOutcome.ok(number.setScale(0, RoundingMode.UNNECESSARY).longValueExact());
            } catch (ArithmeticException e) {
                return FieldOutcome.failure(OUT_OF_RANGE);
            }
        }
        return FieldOutcome.ok(number);
    }

    private FieldOutcome cleanDate(CellValue cell, TargetField field) {
        if (cell.isEmpty()) {
            return missing(field);
        }
        LocalDate date = null;
        if (cell.kind() == CellKind.DATE) {
            date = cell.date();
        } else if (cell.kind() == CellKind.NUMBER) {
            double serial = cell.number().doubleValue();
            if (DateUtil.isValidExcelDate(serial)) {
                date = DateUtil.getLocalDateTime(serial).toLocalDate();
            }
        } else {
            date = parseDate(cell.text().trim());
        }
        if (date != null) {
            return FieldOutcome.ok(date);
        }
        // inconsistent optional dates are dropped quietly
        return field.required() ? FieldOutcome.failure(INVALID_DATE) : FieldOutcome.ok(null);
    }

    private FieldOutcome missing(TargetField field) {
        return field.required() ? FieldOutcome.failure(MISSING_REQUIRED) : FieldOutcome.ok(null);
    }

    private boolean inRange(BigDecimal number, TargetField field) {
        if (field.positive() && number.signum() <= 0) {
            return false;
        }
        if (field.min() != null && number.compareTo(field.min()) < 0) {
            return false;
        }
        return field.max() == null || number.compareTo(field.max()) <= 0;
    }

    /**
     * Reads a plain or thousands-grouped number, optionally wrapped in accounting parentheses and
     * carrying one currency symbol or code in front and a currency or unit after it. Anything else
     * is not a number.
     */
    private BigDecimal parseNumber(String text) {
        String s = text.trim();
        boolean negative = false;
        if (s.length() > 2 && s.startsWith("(") && s.endsWith(")")) {
            negative = true;
            s = s.substring(1, s.length() - 1).trim();
        }
        s = CURRENCY_PREFIX.matcher(s).replaceFirst("");
        s = UNIT_SUFFIX.matcher(s).replaceFirst("");
        if (!PLAIN_NUMBER.matcher(s).matches()) {
            return null;
        }
        if (negative && (s.startsWith("-") || s.startsWith("+"))) {
            return null;
        }
        try {
            BigDecimal number = new BigDecimal(s.replace(",", ""));
            return negative ? number.negate() : number;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private LocalDate parseDate(String text) {
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(text, format);
            } catch (DateTimeParseException ignored) {
                // try the next format
            }
        }
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            try {
                return LocalDateTime.parse(text, format).toLocalDate();
            } catch (DateTimeParseException ignored) {
                // try the next format
            }
        }
        return null;
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }

    public record FieldOutcome(Object value, String error) {

        static FieldOutcome ok(Object value) {
            return new FieldOutcome(value, null);
        }

        static FieldOutcome failure(String error) {
            return new FieldOutcome(null, error);
        }

        public boolean failed() {
            return error != null;
        }
    }

    /**
     * @param record cleaned row, or {@code null} when a required field failed
     * @param errors errors raised by the row; a dropped row has exactly one
     */
    public record RowOutcome(Map<String, Object> record, List<RowError> errors) {

        static RowOutcome dropped(RowError error) {
            return new RowOutcome(null, List.of(error));
        }

        public boolean kept() {
            return record != null;
        }
    }
}
