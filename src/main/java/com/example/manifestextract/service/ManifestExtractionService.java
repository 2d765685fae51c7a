package com.example.manifestextract.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Extracts typed records from a supplier manifest whose layout is not known in advance.
 *
 * <p>The service keeps no state between calls. File-level problems surface as
 * {@link ManifestFileException} and an oversized sheet as {@link RowLimitExceededException}; a workbook
 * without a usable header and rows with bad values are reported inside the returned {@link ExtractionResult}.
 */
@Slf4j
@Service
public class ManifestExtractionService {

    private final WorkbookReader workbookReader;
    private final SheetSelector sheetSelector;
    private final RowExtractor rowExtractor;
    private final FieldCleaner fieldCleaner;
    private final ExtractionReportBuilder reportBuilder;

    @Autowired
    public ManifestExtractionService(WorkbookReader workbookReader) {
        this(workbookReader, new SheetSelector(new HeaderLocator(new ColumnMatcher())), new RowExtractor(),
                new FieldCleaner(), new ExtractionReportBuilder());
    }

    ManifestExtractionService(WorkbookReader workbookReader,
                              SheetSelector sheetSelector,
                              RowExtractor rowExtractor,
                              FieldCleaner fieldCleaner,
                              ExtractionReportBuilder reportBuilder) {
        this.workbookReader = workbookReader;
        this.sheetSelector = sheetSelector;
        this.rowExtractor = rowExtractor;
        this.fieldCleaner = fieldCleaner;
        this.reportBuilder = reportBuilder;
    }

    public ExtractionResult extract(byte[] fileBytes, String fileName, List<TargetField> targetFields) {
        return extract(fileBytes, fileName, targetFields, ExtractionOptions.defaults());
    }

    public ExtractionResult extract(byte[] fileBytes,
                                    String fileName,
                                    List<TargetField> targetFields,
                                    ExtractionOptions options) {
        ManifestWorkbook workbook;
        try {
            workbook = workbookReader.read(fileBytes, fileName);
        } catch (ManifestFileException e) {
            log.warn("Rejected file '{}': {}", fileName, e.getMessage());
            throw e;
        }
        return extract(workbook, targetFields, options);
    }

    public ExtractionResult extract(ManifestWorkbook workbook,
                                    List<TargetField> targetFields,
                                    ExtractionOptions options) {
        if (targetFields == null || targetFields.isEmpty()) {
            throw new IllegalArgumentException("At least one target field is required.");
        }
        if (workbook.sheetCount() == 0) {
            throw new CorruptFileException("Workbook contains no sheets.");
        }

        Optional<SheetMatch> best = sheetSelector.bestMatch(workbook, targetFields, options);
        if (best.isEmpty() || !options.accepts(best.get().matchRatio())) {
            log.warn("No sheet reached match threshold {} (best ratio {})", options.minColumnMatchThreshold(),
                    best.map(SheetMatch::matchRatio).orElse(0.0));
            return reportBuilder.noMatch(best.orElse(null));
        }

        SheetMatch match = best.get();
        HeaderCandidate header = match.header();
        ExtractedRows extracted = rowExtractor.extract(match.sheet(), header.rowIndex(), header.columnMapping());
        if (options.exceedsRowLimit(extracted.rows().size())) {
            log.warn("Sheet '{}' has {} data rows, limit is {}", match.sheet().name(), extracted.rows().size(),
                    options.maxRows());
            throw new RowLimitExceededException(extracted.rows().size(), options.maxRows());
        }

        List<Map<String, Object>> records = new ArrayList<>();
        List<RowError> rowErrors = new ArrayList<>();
        for (RawRow row : extracted.rows()) {
            FieldCleaner.RowOutcome outcome = fieldCleaner.cleanRow(row, targetFields);
            rowErrors.addAll(outcome.errors());
            if (outcome.kept()) {
                records.add(outcome.record());
            }
        }

        ExtractionResult result = reportBuilder.build(match, extracted, records, rowErrors);
        log.info("Extracted {} records from sheet '{}' (header row {}, ratio {}, {} rows scanned, {} row errors)",
                result.records().size(), result.sheetName(), result.headerRowNumber(), result.matchRatio(),
                result.totalRowsScanned(), result.rowErrors().size());
        return result;
    }
}
