package com.example.laborhours.export.renderer;

import com.example.laborhours.export.core.WorkbookSupport;
import com.example.laborhours.export.model.ImageReference;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.poifs.filesystem.FileMagic;
import org.apache.poi.ss.usermodel.ClientAnchor;
import org.apache.poi.ss.usermodel.CreationHelper;
import org.apache.poi.ss.usermodel.Drawing;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellRangeAddress;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Embeds a signature image over a cell, or over the merged region the cell
 * belongs to, scaled to fill it. Images that cannot be read are skipped with a
 * warning so a missing signature never fails an export.
 */
@Slf4j
@Component
public class SignatureImageWriter {

    /**
     * @return true if a picture was added
     */
    public boolean insert(Sheet sheet, int rowIndex, int columnIndex, ImageReference image) {
        if (image == null || !image.isPresent()) {
            return false;
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(Path.of(image.getPath()));
        } catch (IOException | RuntimeException e) {
            log.warn("Signature image '{}' could not be read, leaving cell empty: {}", image.getPath(), e.getMessage());
            return false;
        }
        int pictureType = pictureType(bytes);
        if (pictureType < 0) {
            log.warn("Signature image '{}' is neither PNG nor JPEG, leaving cell empty", image.getPath());
            return false;
        }

        Workbook workbook = sheet.getWorkbook();
        int pictureIndex = workbook.addPicture(bytes, pictureType);

        CellRangeAddress region = WorkbookSupport.mergedRegionAt(sheet, rowIndex, columnIndex);
        int firstRow = region != null ? region.getFirstRow() : rowIndex;
        int firstCol = region != null ? region.getFirstColumn() : columnIndex;
        int lastRow = region != null ? region.getLastRow() : rowIndex;
        int lastCol = region != null ? region.getLastColumn() : columnIndex;

        CreationHelper helper = workbook.getCreationHelper();
        ClientAnchor anchor = helper.createClientAnchor();
        anchor.setRow1(firstRow);
        anchor.setCol1(firstCol);
        anchor.setRow2(lastRow + 1);
        anchor.setCol2(lastCol + 1);
        anchor.setAnchorType(ClientAnchor.AnchorType.MOVE_AND_RESIZE);

        Drawing<?> drawing = sheet.createDrawingPatriarch();
        drawing.createPicture(anchor, pictureIndex);
        log.debug("Inserted signature '{}' at {}!R{}C{}", image.getPath(), sheet.getSheetName(), firstRow + 1, firstCol + 1);
        return true;
    }

    static int pictureType(byte[] bytes) {
        switch (FileMagic.valueOf(bytes)) {
            case PNG:
                return Workbook.PICTURE_TYPE_PNG;
            case JPEG:
                return Workbook.PICTURE_TYPE_JPEG;
            default:
                return -1;
        }
    }
}
