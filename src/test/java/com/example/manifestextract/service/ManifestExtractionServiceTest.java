package com.example.manifestextract.service;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static com.example.manifestextract.service.TestWorkbooks.row;
import static com.example.manifestextract.service.TestWorkbooks.sheet;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ManifestExtractionServiceTest {

    private final ManifestExtractionService service = new ManifestExtractionService(new WorkbookReader());

    @Test
    void picksFullyMatchingSheetOverPartialAndCoverSheets() {
        byte[] bytes = TestWorkbooks.xlsx(
                sheet("Cover",
                        row("Shipment Manifest"),
                        row("Prepared for the Accra warehouse")),
                sheet("Summary",
                        row(),
                        row("Supplier: Guangzhou Trading"),
                        row(),
                        row(),
                        row("Shipping Mark", "Qty", "CBM"),
                        row("AB-1", 3, 1.2)),
                sheet("Items",
                        row("Shipping Mark", "Tracking Number", "Qty", "CBM", "Gross Weight"),
                        row("AB-1", "TRK-001", 10, 2.5, 120.5),
                        row("AB-2", "TRK-002", 4, 1.25, null)));

        ExtractionResult result = service.extract(bytes, "manifest.xlsx", ManifestFields.all(),
                ExtractionOptions.defaults());

        assertThat(result.matched()).isTrue();
        assertThat(result.sheetName()).isEqualTo("Items");
        assertThat(result.headerRowNumber()).isEqualTo(1);
        assertThat(result.matchRatio()).isEqualTo(1.0);
        assertThat(result.columnsFound())
                .containsExactly("shipping_mark", "tracking", "quantity", "volume", "weight");
        assertThat(result.columnMapping()).containsEntry("shipping_mark", 1).containsEntry("weight", 5);
        assertThat(result.totalRowsScanned()).isEqualTo(2);
        assertThat(result.rowErrors()).isEmpty();
        assertThat(result.records()).hasSize(2);

        Map<String, Object> first = result.records().get(0);
        assertThat(first).containsEntry("shipping_mark", "AB-1")
                .containsEntry("tracking", "TRK-001")
                .containsEntry("quantity", 10L)
                .containsEntry("description", null)
                .containsEntry("date_loading", null);
        assertThat((BigDecimal) first.get("volume")).isEqualByComparingTo("2.5");
        assertThat((BigDecimal) first.get("weight")).isEqualByComparingTo("120.5");
        assertThat(result.records().get(1)).containsEntry("weight", null);
    }

    @Test
    void partialSheetIsUsedWhenItIsTheOnlyOneAboveThreshold() {
        byte[] bytes = TestWorkbooks.xlsx(
                sheet("Cover", row("Shipment Manifest")),
                sheet("Summary",
                        row(), row(), row(), row(),
                        row("Shipping Mark", "Qty", "CBM"),
                        row("AB-1", 3, 1.2)));

        ExtractionResult result = service.extract(bytes, "manifest.xlsx", ManifestFields.requiredOnly(),
                ExtractionOptions.defaults());

        assertThat(result.sheetName()).isEqualTo("Summary");
        assertThat(result.headerRowNumber()).isEqualTo(5);
        assertThat(result.matchRatio()).isEqualTo(0.75);
        assertThat(result.records()).hasSize(1);
        assertThat(result.records().get(0)).containsEntry("tracking", null);
    }

    @Test
    void requiredFailureDropsRowWhileOptionalFailureIsKept() {
        byte[] bytes = TestWorkbooks.xlsx(sheet("Items",
                row("Shipping Mark", "Tracking Number", "Qty", "CBM", "Weight"),
                row("AB-1", "TRK-001", null, 2.5, "abc"),
                row("AB-2", "TRK-002", 10, 3, "abc"),
                row("AB-3", "TRK-003", 5, 1, null)));

        ExtractionResult result = service.extract(bytes, "manifest.xlsx", ManifestFields.all(),
                ExtractionOptions.defaults());

        assertThat(result.records()).extracting(r -> r.get("shipping_mark")).containsExactly("AB-2", "AB-3");
        assertThat(result.records().get(0)).containsEntry("weight", null);
        assertThat(result.rowErrors()).containsExactly(
                new RowError(2, "quantity", "missing required field", true),
                new RowError(3, "weight", "invalid number", false));
        assertThat(result.fatalErrorCount()).isEqualTo(1);
    }

    @Test
    void blankDataRowsAreSkippedButCounted() {
        byte[] bytes = TestWorkbooks.xlsx(sheet("Items",
                row("Shipping Mark", "Tracking Number", "Qty", "CBM", null, "Notes"),
                row("AB-1", "TRK-001", 2, 0.5),
                row(null, null, null, null, null, "pallet wrapped"),
                row(),
                row("AB-2", "TRK-002", 3, 0.75)));

        ExtractionResult result = service.extract(bytes, "manifest.xlsx", ManifestFields.requiredOnly(),
                ExtractionOptions.defaults());

        assertThat(result.records()).hasSize(2);
        assertThat(result.rowErrors()).isEmpty();
        assertThat(result.totalRowsScanned()).isEqualTo(4);
    }

    @Test
    void sheetOverTheRowCapIsRejected() {
        byte[] bytes = TestWorkbooks.xlsx(sheet("Items",
                row("Shipping Mark", "Tracking Number", "Qty", "CBM"),
                row("AB-1", "TRK-001", 1, 1.0),
                row(),
                row("AB-2", "TRK-002", 2, 1.0),
                row("AB-3", "TRK-003", 3, 1.0)));

        assertThatThrownBy(() -> service.extract(bytes, "manifest.xlsx", ManifestFields.requiredOnly(),
                ExtractionOptions.defaults().withMaxRows(2)))
                .isInstanceOf(RowLimitExceededException.class)
                .isNotInstanceOf(ManifestFileException.class)
                .hasMessage("Too many rows (3). Maximum 2 rows allowed.");
    }

    @Test
    void sheetAtTheRowCapIsExtracted() {
        byte[] bytes = TestWorkbooks.xlsx(sheet("Items",
                row("Shipping Mark", "Tracking Number", "Qty", "CBM"),
                row("AB-1", "TRK-001", 1, 1.0),
                row(),
                row("AB-2", "TRK-002", 2, 1.0)));

        ExtractionResult result = service.extract(bytes, "manifest.xlsx", ManifestFields.requiredOnly(),
                ExtractionOptions.defaults().withMaxRows(2));

        assertThat(result.records()).hasSize(2);
        assertThat(result.totalRowsScanned()).isEqualTo(3);
    }

    @Test
    void volumeBoundsAreEnforcedPerRow() {
        byte[] bytes = TestWorkbooks.xlsx(sheet("Items",
                row("Shipping Mark", "Tracking Number", "Qty", "Cubic Meters"),
                row("AB-1", "TRK-001", 1, -5),
                row("AB-2", "TRK-002", 1, 5000),
                row("AB-3", "TRK-003", 1, 250.75)));

        ExtractionResult result = service.extract(bytes, "manifest.xlsx", ManifestFields.requiredOnly(),
                ExtractionOptions.defaults());

        assertThat(result.records()).hasSize(1);
        assertThat((BigDecimal) result.records().get(0).get("volume")).isEqualByComparingTo("250.75");
        assertThat(result.rowErrors()).extracting(RowError::rowNumber).containsExactly(2, 3);
        assertThat(result.rowErrors()).extracting(RowError::message).containsOnly("out of range");
    }

    @Test
    void headerBeyondSearchWindowGivesNoMatch() {
        Object[][] rows = new Object[22][];
        for (int i = 0; i < 20; i++) {
            rows[i] = row();
        }
        rows[20] = row("Shipping Mark", "Tracking Number", "Qty", "CBM");
        rows[21] = row("AB-1", "TRK-001", 1, 1);
        byte[] bytes = TestWorkbooks.xlsx(sheet("Deep", rows));

        ExtractionResult result = service.extract(bytes, "manifest.xlsx", ManifestFields.requiredOnly(),
                ExtractionOptions.defaults());

        assertThat(result.matched()).isFalse();
        assertThat(result.records()).isEmpty();
        assertThat(result.sheetName()).isNull();
    }

    @Test
    void belowThresholdReportsBestRatioAndColumnsFound() {
        byte[] bytes = TestWorkbooks.xlsx(sheet("Items",
                row("Shipping Mark", "Supplier", "Remarks"),
                row("AB-1", "Acme", "fragile")));

        ExtractionResult result = service.extract(bytes, "manifest.xlsx", ManifestFields.requiredOnly(),
                ExtractionOptions.defaults());

        assertThat(result.matched()).isFalse();
        assertThat(result.records()).isEmpty();
        assertThat(result.matchRatio()).isEqualTo(0.25);
        assertThat(result.columnsFound()).containsExactly("shipping_mark");
        assertThat(result.sheetName()).isEqualTo("Items");
    }

    @Test
    void lowerThresholdAcceptsTheSameSheet() {
        byte[] bytes = TestWorkbooks.xlsx(sheet("Items",
                row("Shipping Mark", "Qty", "Remarks"),
                row("AB-1", 2, "fragile")));

        ExtractionResult strict = service.extract(bytes, "m.xlsx", ManifestFields.all(),
                ExtractionOptions.defaults().withThreshold(0.6));
        ExtractionResult lenient = service.extract(bytes, "m.xlsx", ManifestFields.all(),
                ExtractionOptions.defaults().withThreshold(0.4));

        assertThat(strict.matched()).isFalse();
        assertThat(lenient.matched()).isTrue();
        assertThat(lenient.records()).hasSize(1);
    }

    @Test
    void extractionIsIdempotent() {
        byte[] bytes = TestWorkbooks.xlsx(sheet("Items",
                row("Shipping Mark", "Tracking Number", "Qty", "CBM", "Loading Date", "Weight"),
                row("AB-1", "TRK-001", 10, 2.5, LocalDate.of(2024, 6, 1), "heavy"),
                row("AB-2", null, 4, 1.25, "01/06/2024", 80)));

        ExtractionResult first = service.extract(bytes, "manifest.xlsx", ManifestFields.all(),
                ExtractionOptions.defaults());
        ExtractionResult second = service.extract(bytes, "manifest.xlsx", ManifestFields.all(),
                ExtractionOptions.defaults());

        assertThat(second).isEqualTo(first);
        assertThat(first.records().get(0)).containsEntry("date_loading", LocalDate.of(2024, 6, 1));
    }

    @Test
    void csvUploadsAreExtracted() {
        String csv = "Packing list,,,\n"
                + "Shipping Mark,Tracking No,Qty,CBM\n"
                + "AB-1,TRK-001,\"1,000\",2.5\n";

        ExtractionResult result = service.extract(csv.getBytes(StandardCharsets.UTF_8), "manifest.csv",
                ManifestFields.requiredOnly(), ExtractionOptions.defaults());

        assertThat(result.sheetName()).isEqualTo("csv");
        assertThat(result.headerRowNumber()).isEqualTo(2);
        assertThat(result.records()).singleElement().satisfies(record ->
                assertThat(record).containsEntry("quantity", 1000L).containsEntry("tracking", "TRK-001"));
    }

    @Test
    void fileLevelFailuresPropagate() {
        assertThatThrownBy(() -> service.extract("garbage".getBytes(StandardCharsets.UTF_8), "manifest.xlsx",
                ManifestFields.requiredOnly()))
                .isInstanceOf(CorruptFileException.class);
        assertThatThrownBy(() -> service.extract("garbage".getBytes(StandardCharsets.UTF_8), "manifest.docx",
                ManifestFields.requiredOnly()))
                .isInstanceOf(UnsupportedFormatException.class);
    }

    @Test
    void emptyWorkbookIsAFileLevelFailure() {
        assertThatThrownBy(() -> service.extract(new ManifestWorkbook(List.of()), ManifestFields.requiredOnly(),
                ExtractionOptions.defaults()))
                .isInstanceOf(CorruptFileException.class);
    }

    @Test
    void targetFieldsAreRequired() {
        assertThatThrownBy(() -> service.extract(new ManifestWorkbook(List.of()), List.of(),
                ExtractionOptions.defaults()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
