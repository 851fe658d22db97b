package com.example.laborhours.export.core;

import com.example.laborhours.export.model.Placeholder;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Walks every sheet of a template and turns placeholder tokens into typed
 * {@link Placeholder}s, in sheet, row, column order.
 */
@Component
public class TemplateScanner {

    public List<Placeholder> scan(byte[] templateBytes) {
        try (Workbook workbook = WorkbookSupport.open(templateBytes)) {
            return scan(workbook);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to close template workbook", e);
        }
    }

    public List<Placeholder> scan(Workbook workbook) {
        List<Placeholder> placeholders = new ArrayList<>();
        for (Sheet sheet : workbook) {
            for (Row row : sheet) {
                for (Cell cell : row) {
                    collect(sheet.getSheetName(), cell, placeholders);
                }
            }
        }
        return placeholders;
    }

    private void collect(String sheetName, Cell cell, List<Placeholder> out) {
        String text = WorkbookSupport.stringValue(cell);
        if (!PlaceholderTokenizer.mayContainPlaceholder(text)) {
            return;
        }
        String trimmed = text.trim();
        for (PlaceholderTokenizer.Token token : PlaceholderTokenizer.tokenize(text)) {
            out.add(Placeholder.builder()
                    .rawText(token.getRawText())
                    .kind(token.getKind())
                    .fieldKey(token.getFieldKey())
                    .sheetName(sheetName)
                    .rowIndex(cell.getRowIndex())
                    .columnIndex(cell.getColumnIndex())
                    .standalone(trimmed.equals(token.getRawText()))
                    .build());
        }
    }
}
