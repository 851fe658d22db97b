package com.example.laborhours.export.renderer;

import com.example.laborhours.export.aspect.LogExecutionTime;
import com.example.laborhours.export.core.PlaceholderTokenizer;
import com.example.laborhours.export.core.WorkbookSupport;
import com.example.laborhours.export.exception.UnresolvableFieldException;
import com.example.laborhours.export.model.BindingContext;
import com.example.laborhours.export.model.ExpansionPlan;
import com.example.laborhours.export.model.ImageReference;
import com.example.laborhours.export.model.PageOrientation;
import com.example.laborhours.export.model.PlaceholderKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.PrintSetup;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellRangeAddress;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Materializes a template for one student.
 *
 * List tables are expanded first, top to bottom per sheet, so the row shift of
 * an earlier table moves the anchor of a later one. When a table needs more
 * rows than the template reserves, rows are inserted above its terminator (or
 * appended at the end of the sheet) and everything below moves down in every
 * column. Inserted rows copy the style, height, single-row merges and non-list
 * content of the last reserved row, and vertical merges spanning the insertion
 * point grow with the table. Rows appended to a table without a terminator copy
 * only style and height. Scalars are substituted afterwards in one pass over
 * the final grid.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RowExpansionEngine {
    private static final int MAX_COLUMN_WIDTH = 255 * 256;
    private static final float LINE_HEIGHT_POINTS = 15f;

    private final SignatureImageWriter imageWriter;

    /**
     * Builds the materialized workbook on a private copy of the template bytes.
     * Either the full workbook is returned or an exception is thrown; nothing
     * partially expanded ever leaves this method.
     */
    @LogExecutionTime("expand template")
    public byte[] materialize(byte[] templateBytes, List<ExpansionPlan> plans, BindingContext context,
                              PageOrientation orientation) {
        try (Workbook workbook = WorkbookSupport.open(templateBytes)) {
            expand(workbook, plans, context);
            applyPageSetup(workbook, orientation);
            return WorkbookSupport.toBytes(workbook);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to close materialized workbook", e);
        }
    }

    public void expand(Workbook workbook, List<ExpansionPlan> plans, BindingContext context) {
        Map<String, List<ExpansionPlan>> plansBySheet = new LinkedHashMap<>();
        for (ExpansionPlan plan : plans) {
            plansBySheet.computeIfAbsent(plan.getSheetName(), k -> new ArrayList<>()).add(plan);
        }

        Set<String> filledCells = new HashSet<>();
        for (Map.Entry<String, List<ExpansionPlan>> entry : plansBySheet.entrySet()) {
            Sheet sheet = workbook.getSheet(entry.getKey());
            if (sheet == null) {
                throw new IllegalStateException("Sheet '" + entry.getKey() + "' disappeared from the template");
            }
            List<ExpansionPlan> sheetPlans = new ArrayList<>(entry.getValue());
            sheetPlans.sort(Comparator.comparingInt(ExpansionPlan::getAnchorRow));
            int offset = 0;
            for (ExpansionPlan plan : sheetPlans) {
                offset += expandTable(sheet, plan, offset, context, filledCells);
            }
        }

        for (Sheet sheet : workbook) {
            substituteScalars(sheet, context, filledCells);
        }
    }

    public void applyPageSetup(Workbook workbook, PageOrientation orientation) {
        for (Sheet sheet : workbook) {
            PrintSetup printSetup = sheet.getPrintSetup();
            printSetup.setPaperSize(PrintSetup.A4_PAPERSIZE);
            printSetup.setLandscape(orientation != null && orientation.isLandscape());
        }
    }

    /**
     * @return number of rows inserted
     */
    private int expandTable(Sheet sheet, ExpansionPlan plan, int offset, BindingContext context, Set<String> filledCells) {
        int anchor = plan.getAnchorRow() + offset;
        Integer terminator = plan.hasTerminator() ? plan.getTerminatorRow() + offset : null;
        int recordCount = context.getRowCount();
        int available = terminator != null
                ? terminator - anchor
                : Math.max(1, sheet.getLastRowNum() - anchor + 1);

        int inserted = 0;
        if (recordCount > available) {
            inserted = recordCount - available;
            int insertAt = terminator != null ? terminator : anchor + available;
            insertRows(sheet, insertAt, inserted, plan);
            if (terminator != null) {
                terminator += inserted;
            }
        }
        log.debug("Sheet '{}' table at row {}: {} record(s), {} reserved row(s), {} inserted",
                sheet.getSheetName(), anchor + 1, recordCount, available, inserted);

        for (int i = 0; i < recordCount; i++) {
            int rowIndex = anchor + i;
            for (ExpansionPlan.ListColumn column : plan.getColumns()) {
                Object value = context.getListValue(i, column.getFieldKey());
                if (writeValue(sheet, rowIndex, column.getColumnIndex(), value)) {
                    filledCells.add(cellKey(sheet, rowIndex, column.getColumnIndex()));
                }
            }
        }

        int clearTo = terminator != null ? terminator : (recordCount == 0 ? anchor : -1);
        for (int rowIndex = anchor + recordCount; rowIndex <= clearTo; rowIndex++) {
            for (ExpansionPlan.ListColumn column : plan.getColumns()) {
                blankCell(sheet, rowIndex, column.getColumnIndex());
            }
        }
        return inserted;
    }

    private void insertRows(Sheet sheet, int insertAt, int count, ExpansionPlan plan) {
        int lastRow = sheet.getLastRowNum();
        int sourceIndex = insertAt - 1;
        if (insertAt <= lastRow) {
            // shiftRows leaves regions that straddle the insertion point untouched
            List<Integer> spanningIndexes = new ArrayList<>();
            List<CellRangeAddress> spanning = new ArrayList<>();
            List<CellRangeAddress> regions = sheet.getMergedRegions();
            for (int i = 0; i < regions.size(); i++) {
                CellRangeAddress range = regions.get(i);
                if (range.getFirstRow() < insertAt && insertAt <= range.getLastRow()) {
                    spanningIndexes.add(i);
                    spanning.add(range);
                }
            }
            if (!spanningIndexes.isEmpty()) {
                sheet.removeMergedRegions(spanningIndexes);
            }
            sheet.shiftRows(insertAt, lastRow, count, true, false);
            for (CellRangeAddress range : spanning) {
                sheet.addMergedRegion(new CellRangeAddress(range.getFirstRow(), range.getLastRow() + count,
                        range.getFirstColumn(), range.getLastColumn()));
            }
        }
        Row source = sheet.getRow(sourceIndex);
        List<CellRangeAddress> sourceMerges = new ArrayList<>();
        for (CellRangeAddress range : sheet.getMergedRegions()) {
            if (range.getFirstRow() == sourceIndex && range.getLastRow() == sourceIndex) {
                sourceMerges.add(range);
            }
        }

        for (int i = 0; i < count; i++) {
            int targetIndex = insertAt + i;
            Row target = sheet.getRow(targetIndex);
            if (target == null) {
                target = sheet.createRow(targetIndex);
            }
            if (source != null) {
                copyRow(source, target, plan, plan.hasTerminator());
            }
            for (CellRangeAddress range : sourceMerges) {
                sheet.addMergedRegion(new CellRangeAddress(targetIndex, targetIndex,
                        range.getFirstColumn(), range.getLastColumn()));
            }
        }
    }

    private void copyRow(Row source, Row target, ExpansionPlan plan, boolean copyValues) {
        target.setHeight(source.getHeight());
        if (source.isFormatted()) {
            target.setRowStyle(source.getRowStyle());
        }
        for (Cell sourceCell : source) {
            Cell targetCell = target.createCell(sourceCell.getColumnIndex());
            targetCell.setCellStyle(sourceCell.getCellStyle());
            if (!copyValues || plan.isListColumn(sourceCell.getColumnIndex())) {
                continue;
            }
            switch (sourceCell.getCellType()) {
                case STRING:
                    targetCell.setCellValue(sourceCell.getRichStringCellValue());
                    break;
                case NUMERIC:
                    targetCell.setCellValue(sourceCell.getNumericCellValue());
                    break;
                case BOOLEAN:
                    targetCell.setCellValue(sourceCell.getBooleanCellValue());
                    break;
                case FORMULA:
                    targetCell.setCellFormula(sourceCell.getCellFormula());
                    break;
                default:
                    break;
            }
        }
    }

    private void substituteScalars(Sheet sheet, BindingContext context, Set<String> filledCells) {
        for (Row row : sheet) {
            for (Cell cell : row) {
                String text = WorkbookSupport.stringValue(cell);
                if (!PlaceholderTokenizer.mayContainPlaceholder(text)
                        || filledCells.contains(cellKey(sheet, cell.getRowIndex(), cell.getColumnIndex()))) {
                    continue;
                }
                List<PlaceholderTokenizer.Token> tokens = PlaceholderTokenizer.tokenize(text);
                if (tokens.isEmpty()) {
                    continue;
                }
                if (tokens.size() == 1 && text.trim().equals(tokens.get(0).getRawText())) {
                    substituteWholeCell(sheet, cell, tokens.get(0), context);
                } else {
                    writeValue(sheet, cell.getRowIndex(), cell.getColumnIndex(), substituteInline(text, tokens, sheet, cell, context));
                }
            }
        }
    }

    private void substituteWholeCell(Sheet sheet, Cell cell, PlaceholderTokenizer.Token token, BindingContext context) {
        if (token.getKind() != PlaceholderKind.SCALAR) {
            cell.setBlank();
            return;
        }
        Object value = scalarValue(token, sheet, cell, context);
        if (value instanceof ImageReference) {
            cell.setBlank();
            imageWriter.insert(sheet, cell.getRowIndex(), cell.getColumnIndex(), (ImageReference) value);
            return;
        }
        writeValue(sheet, cell.getRowIndex(), cell.getColumnIndex(), value);
    }

    private String substituteInline(String text, List<PlaceholderTokenizer.Token> tokens, Sheet sheet, Cell cell,
                                    BindingContext context) {
        StringBuilder out = new StringBuilder();
        int position = 0;
        for (PlaceholderTokenizer.Token token : tokens) {
            out.append(text, position, token.getStart());
            if (token.getKind() == PlaceholderKind.SCALAR) {
                Object value = scalarValue(token, sheet, cell, context);
                if (value instanceof ImageReference) {
                    imageWriter.insert(sheet, cell.getRowIndex(), cell.getColumnIndex(), (ImageReference) value);
                } else {
                    out.append(format(value));
                }
            }
            position = token.getEnd();
        }
        out.append(text.substring(position));
        return out.toString();
    }

    private Object scalarValue(PlaceholderTokenizer.Token token, Sheet sheet, Cell cell, BindingContext context) {
        if (!context.hasScalar(token.getFieldKey())) {
            throw new UnresolvableFieldException(String.format("Sheet '%s' cell %s: no value bound for '%s'",
                    sheet.getSheetName(), cell.getAddress().formatAsString(), token.getFieldKey()));
        }
        return context.getScalar(token.getFieldKey());
    }

    /**
     * Writes a resolved value, keeping the cell's style. Numbers become numeric
     * cells. Cells hidden inside a merged region are left alone.
     *
     * @return false if the cell was skipped
     */
    private boolean writeValue(Sheet sheet, int rowIndex, int columnIndex, Object value) {
        CellRangeAddress merged = WorkbookSupport.mergedRegionAt(sheet, rowIndex, columnIndex);
        if (merged != null && (merged.getFirstRow() != rowIndex || merged.getFirstColumn() != columnIndex)) {
            return false;
        }
        Row row = sheet.getRow(rowIndex);
        if (row == null) {
            row = sheet.createRow(rowIndex);
        }
        Cell cell = row.getCell(columnIndex);
        if (cell == null) {
            cell = row.createCell(columnIndex);
        }

        if (value instanceof Number) {
            cell.setCellValue(((Number) value).doubleValue());
        } else if (value instanceof ImageReference) {
            cell.setBlank();
        } else {
            cell.setCellValue(format(value));
        }
        fitToContent(sheet, row, columnIndex, format(value));
        return true;
    }

    private void blankCell(Sheet sheet, int rowIndex, int columnIndex) {
        Row row = sheet.getRow(rowIndex);
        if (row == null) {
            return;
        }
        Cell cell = row.getCell(columnIndex);
        if (cell != null && cell.getCellType() != CellType.BLANK) {
            cell.setBlank();
        }
    }

    /**
     * Widens the column and heightens the row to fit the written text. Never shrinks.
     */
    private void fitToContent(Sheet sheet, Row row, int columnIndex, String text) {
        if (text.isEmpty()) {
            return;
        }
        String[] lines = text.split("\n", -1);
        int longest = 0;
        for (String line : lines) {
            longest = Math.max(longest, line.length());
        }
        int width = Math.min(MAX_COLUMN_WIDTH, (int) (longest * 1.2 * 256));
        if (width > sheet.getColumnWidth(columnIndex)) {
            sheet.setColumnWidth(columnIndex, width);
        }
        float height = LINE_HEIGHT_POINTS * lines.length;
        if (height > row.getHeightInPoints()) {
            row.setHeightInPoints(height);
        }
    }

    static String format(Object value) {
        if (value == null || value instanceof ImageReference) {
            return "";
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            BigDecimal decimal = value instanceof BigDecimal
                    ? (BigDecimal) value
                    : BigDecimal.valueOf(((Number) value).doubleValue());
            return decimal.stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }

    private static String cellKey(Sheet sheet, int rowIndex, int columnIndex) {
        return sheet.getSheetName() + "!" + rowIndex + ":" + columnIndex;
    }
}
