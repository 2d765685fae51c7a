package com.example.manifestextract.service;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.poifs.filesystem.FileMagic;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Decodes uploaded bytes into a {@link ManifestWorkbook}. Excel files (.xlsx and .xls) are recognised by
 * their content; CSV by the .csv extension and read as a single sheet.
 */
@Slf4j
@Component
public class WorkbookReader {

    static final String CSV_SHEET_NAME = "csv";

    private static final char BOM = '\uFEFF';
    private static final Charset WINDOWS_1252 = Charset.forName("windows-1252");

    public ManifestWorkbook read(byte[] bytes, String fileName) {
        if (bytes == null || bytes.length == 0) {
            throw new CorruptFileException("File is empty.");
        }
        FileMagic magic = detect(bytes);
        if (magic == FileMagic.OLE2 || magic == FileMagic.OOXML) {
            return readSpreadsheet(bytes);
        }
        String extension = extensionOf(fileName);
        if ("csv".equals(extension)) {
            return readCsv(bytes);
        }
        if ("xlsx".equals(extension) || "xls".equals(extension)) {
            throw new CorruptFileException("File '" + fileName + "' is not a readable Excel workbook.");
        }
        throw new UnsupportedFormatException("Unsupported file format: "
                + (extension.isEmpty() ? "unknown" : "." + extension) + ". Expected .xlsx, .xls or .csv.");
    }

    static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot + 1).trim().toLowerCase(Locale.ROOT);
    }

    private FileMagic detect(byte[] bytes) {
        try (InputStream in = FileMagic.prepareToCheckMagic(new ByteArrayInputStream(bytes))) {
            return FileMagic.valueOf(in);
        } catch (IOException e) {
            throw new CorruptFileException("Unable to read file header: " + e.getMessage(), e);
        }
    }

    private ManifestWorkbook readSpreadsheet(byte[] bytes) {
        List<ManifestSheet> sheets = new ArrayList<>();
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(bytes))) {
            for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                sheets.add(readSheet(workbook.getSheetAt(i)));
            }
        } catch (EncryptedDocumentException e) {
            throw new CorruptFileException("Workbook is password protected.", e);
        } catch (IOException | RuntimeException e) {
            throw new CorruptFileException("Workbook could not be parsed: " + e.getMessage(), e);
        }
        if (sheets.isEmpty()) {
            throw new CorruptFileException("Workbook contains no sheets.");
        }
        return new ManifestWorkbook(sheets);
    }

    private ManifestSheet readSheet(Sheet sheet) {
        List<List<CellValue>> rows = new ArrayList<>();
        for (int r = 0; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            List<CellValue> cells = new ArrayList<>();
            if (row != null) {
                for (int c = 0; c < row.getLastCellNum(); c++) {
                    cells.add(toCellValue(row.getCell(c)));
                }
            }
            rows.add(trimTrailingEmpty(cells));
        }
        trimTrailingEmptyRows(rows);
        log.debug("Read sheet '{}' with {} rows", sheet.getSheetName(), rows.size());
        return new ManifestSheet(sheet.getSheetName(), rows);
    }

    private CellValue toCellValue(Cell cell) {
        if (cell == null) {
            return CellValue.EMPTY;
        }
        CellType cellType = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();
        if (cellType == CellType.STRING) {
            return CellValue.text(cell.getStringCellValue());
        }
        if (cellType == CellType.NUMERIC) {
            if (DateUtil.isCellDateFormatted(cell)) {
                return CellValue.date(cell.getLocalDateTimeCellValue().toLocalDate());
            }
            return CellValue.number(cell.getNumericCellValue());
        }
        if (cellType == CellType.BOOLEAN) {
            return CellValue.text(String.valueOf(cell.getBooleanCellValue()));
        }
        return CellValue.EMPTY;
    }

    private ManifestWorkbook readCsv(byte[] bytes) {
        List<List<CellValue>> rows = new ArrayList<>();
        try (CSVReader csvReader = new CSVReaderBuilder(new StringReader(decodeCsv(bytes))).build()) {
            boolean first = true;
            String[] line;
            while ((line = csvReader.readNext()) != null) {
                List<CellValue> cells = new ArrayList<>();
                for (String value : line) {
                    if (first && !value.isEmpty() && value.charAt(0) == BOM) {
                        value = value.substring(1);
                    }
                    first = false;
                    cells.add(CellValue.text(value));
                }
                rows.add(trimTrailingEmpty(cells));
            }
        } catch (IOException | CsvException e) {
            throw new CorruptFileException("CSV could not be parsed: " + e.getMessage(), e);
        }
        trimTrailingEmptyRows(rows);
        return new ManifestWorkbook(List.of(new ManifestSheet(CSV_SHEET_NAME, rows)));
    }

    /**
     * UTF-8 when the bytes are valid UTF-8, otherwise Windows-1252 as written by Excel's plain CSV export.
     */
    static String decodeCsv(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            log.debug("CSV is not valid UTF-8, reading it as windows-1252");
            return new String(bytes, WINDOWS_1252);
        }
    }

    private List<CellValue> trimTrailingEmpty(List<CellValue> cells) {
        int end = cells.size();
        while (end > 0 && cells.get(end - 1).isEmpty()) {
            end--;
        }
        return new ArrayList<>(cells.subList(0, end));
    }

    private void trimTrailingEmptyRows(List<List<CellValue>> rows) {
        while (!rows.isEmpty() && rows.get(rows.size() - 1).isEmpty()) {
            rows.remove(rows.size() - 1);
        }
    }
}
