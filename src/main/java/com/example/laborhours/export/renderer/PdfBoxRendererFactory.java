package com.example.laborhours.export.renderer;

import com.example.laborhours.export.core.WorkbookSupport;
import com.example.laborhours.export.exception.RendererCrashedException;
import com.example.laborhours.export.model.RenderJob;
import com.example.laborhours.export.renderer.pool.RendererFactory;
import com.example.laborhours.export.renderer.pool.RendererHandle;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process renderer that lays each sheet out as plain text lines on A4 pages.
 * It needs no external converter, which makes it the choice for tests and for
 * hosts without LibreOffice. Only the standard Helvetica font is used, so
 * characters outside printable ASCII are shown as '?'.
 */
@Slf4j
public class PdfBoxRendererFactory implements RendererFactory {
    private static final float FONT_SIZE = 9f;
    private static final float LEADING = 12f;
    private static final float MARGIN = 40f;

    private final AtomicInteger sequence = new AtomicInteger();

    @Override
    public RendererHandle create() {
        return new PdfBoxHandle("pdfbox-" + sequence.incrementAndGet());
    }

    @Override
    public String getName() {
        return "internal";
    }

    private static final class PdfBoxHandle implements RendererHandle {
        private final String id;
        private final DataFormatter formatter = new DataFormatter();

        private PdfBoxHandle(String id) {
            this.id = id;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public byte[] render(RenderJob job) throws InterruptedException {
            List<List<String>> sheets;
            try (Workbook workbook = WorkbookSupport.open(job.getWorkbookBytes())) {
                sheets = new ArrayList<>();
                for (Sheet sheet : workbook) {
                    sheets.add(toLines(sheet));
                }
            } catch (IOException e) {
                throw new RendererCrashedException("Could not read materialized workbook for '" + job.getLabel() + "'", e);
            }

            PDRectangle pageSize = job.getOrientation() != null && job.getOrientation().isLandscape()
                    ? new PDRectangle(PDRectangle.A4.getHeight(), PDRectangle.A4.getWidth())
                    : PDRectangle.A4;
            PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            int linesPerPage = (int) ((pageSize.getHeight() - 2 * MARGIN) / LEADING);

            try (PDDocument document = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
                for (List<String> lines : sheets) {
                    for (int from = 0; from < Math.max(1, lines.size()); from += linesPerPage) {
                        if (Thread.currentThread().isInterrupted()) {
                            throw new InterruptedException("Rendering of '" + job.getLabel() + "' was cancelled");
                        }
                        PDPage page = new PDPage(pageSize);
                        document.addPage(page);
                        writePage(document, page, font, lines.subList(Math.min(from, lines.size()),
                                Math.min(from + linesPerPage, lines.size())));
                    }
                }
                document.save(out);
                log.debug("Renderer {} produced {} page(s) for '{}'", id, document.getNumberOfPages(), job.getLabel());
                return out.toByteArray();
            } catch (IOException e) {
                throw new RendererCrashedException("PDF generation failed for '" + job.getLabel() + "'", e);
            }
        }

        private void writePage(PDDocument document, PDPage page, PDType1Font font, List<String> lines) throws IOException {
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                content.beginText();
                content.setFont(font, FONT_SIZE);
                content.setLeading(LEADING);
                content.newLineAtOffset(MARGIN, page.getMediaBox().getHeight() - MARGIN);
                for (String line : lines) {
                    content.showText(line);
                    content.newLine();
                }
                content.endText();
            }
        }

        private List<String> toLines(Sheet sheet) {
            List<String> lines = new ArrayList<>();
            lines.add(printable("[" + sheet.getSheetName() + "]"));
            for (Row row : sheet) {
                StringBuilder line = new StringBuilder();
                for (Cell cell : row) {
                    String text = formatter.formatCellValue(cell);
                    if (!text.isEmpty()) {
                        if (line.length() > 0) {
                            line.append("  |  ");
                        }
                        line.append(text.replace('\n', ' '));
                    }
                }
                if (line.length() > 0) {
                    lines.add(printable(line.toString()));
                }
            }
            return lines;
        }

        private static String printable(String text) {
            StringBuilder out = new StringBuilder(text.length());
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                out.append(c >= 0x20 && c <= 0x7E ? c : '?');
            }
            return out.toString();
        }

        @Override
        public void close() {
            log.debug("Renderer {} closed", id);
        }
    }
}
