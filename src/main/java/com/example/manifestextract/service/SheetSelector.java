package com.example.manifestextract.service;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Picks the sheet whose header best matches the target fields. Ties keep the earlier sheet.
 */
@Slf4j
public class SheetSelector {

    private final HeaderLocator headerLocator;

    public SheetSelector(HeaderLocator headerLocator) {
        this.headerLocator = headerLocator;
    }

    public Optional<SheetMatch> select(ManifestWorkbook workbook, List<TargetField> fields, ExtractionOptions options) {
        return bestMatch(workbook, fields, options)
                .filter(match -> options.accepts(match.matchRatio()));
    }

    public Optional<SheetMatch> bestMatch(ManifestWorkbook workbook, List<TargetField> fields,
                                          ExtractionOptions options) {
        SheetMatch best = null;
        for (int i = 0; i < workbook.sheetCount(); i++) {
            ManifestSheet sheet = workbook.sheets().get(i);
            Optional<HeaderCandidate> candidate = headerLocator.bestCandidate(
                    sheet, fields, options.maxHeaderSearchRows(), options.ratioMode());
            if (candidate.isEmpty()) {
                log.debug("Sheet '{}': no header candidate in first {} rows", sheet.name(),
                        options.maxHeaderSearchRows());
                continue;
            }
            HeaderCandidate header = candidate.get();
            log.debug("Sheet '{}': header at row {} matches {} (ratio {})", sheet.name(),
                    header.rowIndex() + 1, header.columnMapping().keySet(), header.matchRatio());
            if (best == null || header.matchRatio() > best.matchRatio()) {
                best = new SheetMatch(i, sheet, header);
            }
        }
        return Optional.ofNullable(best);
    }
}
