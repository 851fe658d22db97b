package com.example.laborhours.export.core;

import com.example.laborhours.export.exception.TemplateCorruptException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Small Apache POI helpers shared by the scanner, the expansion engine and the
 * renderers.
 */
public final class WorkbookSupport {

    private WorkbookSupport() {
    }

    /**
     * Parse xlsx bytes into a fresh, caller-owned workbook.
     */
    public static Workbook open(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new TemplateCorruptException("Template file is empty");
        }
        try {
            return new XSSFWorkbook(new ByteArrayInputStream(bytes));
        } catch (IOException | RuntimeException e) {
            throw new TemplateCorruptException("Template is not a readable xlsx workbook: " + e.getMessage(), e);
        }
    }

    public static byte[] toBytes(Workbook workbook) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            workbook.write(baos);
            return baos.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize Excel workbook", e);
        }
    }

    /**
     * Text of a string cell, or null for any other cell type. Placeholders are
     * only recognized in literal text, never in formulas or numbers.
     */
    public static String stringValue(Cell cell) {
        if (cell == null || cell.getCellType() != CellType.STRING) {
            return null;
        }
        return cell.getStringCellValue();
    }

    /**
     * Returns the merged region containing the cell, or null if none.
     */
    public static CellRangeAddress mergedRegionAt(Sheet sheet, int row, int col) {
        for (CellRangeAddress range : sheet.getMergedRegions()) {
            if (range.isInRange(row, col)) {
                return range;
            }
        }
        return null;
    }
}
