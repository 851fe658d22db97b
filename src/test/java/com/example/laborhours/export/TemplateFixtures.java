package com.example.laborhours.export;

import com.example.laborhours.export.config.ExportProperties;
import com.example.laborhours.export.core.WorkbookSupport;
import com.example.laborhours.export.model.AwardRecord;
import com.example.laborhours.export.model.StudentProfile;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellReference;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.List;

/**
 * In-memory workbook and student fixtures shared by the tests.
 */
public final class TemplateFixtures {
    private static final DataFormatter FORMATTER = new DataFormatter();

    private TemplateFixtures() {
    }

    public static Workbook newWorkbook() {
        return new XSSFWorkbook();
    }

    /**
     * Writes string values to cells given by A1 references: put(sheet, "B5", "{{list:contest_name}}", "B8", "{{/list}}")
     */
    public static Sheet put(Sheet sheet, String... refsAndValues) {
        for (int i = 0; i < refsAndValues.length; i += 2) {
            CellReference ref = new CellReference(refsAndValues[i]);
            Row row = sheet.getRow(ref.getRow());
            if (row == null) {
                row = sheet.createRow(ref.getRow());
            }
            row.createCell(ref.getCol()).setCellValue(refsAndValues[i + 1]);
        }
        return sheet;
    }

    public static byte[] toBytes(Workbook workbook) {
        try (Workbook wb = workbook) {
            return WorkbookSupport.toBytes(wb);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Single-sheet template from A1 references and values.
     */
    public static byte[] template(String... refsAndValues) {
        Workbook workbook = newWorkbook();
        put(workbook.createSheet("Sheet1"), refsAndValues);
        return toBytes(workbook);
    }

    public static Workbook read(byte[] bytes) {
        return WorkbookSupport.open(bytes);
    }

    /**
     * Displayed text of a cell, "" for a missing cell.
     */
    public static String text(Sheet sheet, String ref) {
        CellReference cellReference = new CellReference(ref);
        Row row = sheet.getRow(cellReference.getRow());
        if (row == null) {
            return "";
        }
        Cell cell = row.getCell(cellReference.getCol());
        return cell == null ? "" : FORMATTER.formatCellValue(cell);
    }

    public static CellType type(Sheet sheet, String ref) {
        CellReference cellReference = new CellReference(ref);
        return sheet.getRow(cellReference.getRow()).getCell(cellReference.getCol()).getCellType();
    }

    public static ExportProperties properties(String... customFields) {
        ExportProperties properties = new ExportProperties();
        properties.setCustomFields(List.of(customFields));
        return properties;
    }

    public static StudentProfile student(String studentNo) {
        return StudentProfile.builder()
                .studentNo(studentNo)
                .name("Li Lei")
                .gender("M")
                .department("Computer Science")
                .major("Software Engineering")
                .className("SE-2101")
                .phone("13800000000")
                .build();
    }

    /**
     * A final-reviewed record submitted {@code minute} minutes after the epoch.
     */
    public static AwardRecord record(String id, String contestName, int minute, int selfHours, Integer finalHours) {
        return AwardRecord.builder()
                .id(id)
                .contestYear(2024)
                .contestCategory("A")
                .contestName(contestName)
                .contestLevel("国家级")
                .contestRole("负责人")
                .awardLevel("一等奖")
                .selfHours(selfHours)
                .firstReviewHours(finalHours)
                .finalReviewHours(finalHours)
                .status(finalHours != null ? AwardRecord.STATUS_FINAL_REVIEWED : AwardRecord.STATUS_SUBMITTED)
                .createdAt(Instant.EPOCH.plusSeconds(60L * minute))
                .updatedAt(Instant.EPOCH.plusSeconds(60L * minute))
                .build();
    }
}
