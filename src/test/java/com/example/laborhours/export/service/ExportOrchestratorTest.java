package com.example.laborhours.export.service;

import com.example.laborhours.export.config.ExportProperties;
import com.example.laborhours.export.config.LaborHourRuleProperties;
import com.example.laborhours.export.core.ExpansionPlanner;
import com.example.laborhours.export.core.TemplateScanner;
import com.example.laborhours.export.exception.ExportCancelledException;
import com.example.laborhours.export.exception.RendererCrashedException;
import com.example.laborhours.export.exception.RendererTimeoutException;
import com.example.laborhours.export.exception.StudentNotFoundException;
import com.example.laborhours.export.exception.TemplateInvalidException;
import com.example.laborhours.export.exception.TemplateNotFoundException;
import com.example.laborhours.export.exception.UnresolvableFieldException;
import com.example.laborhours.export.model.ExportFormat;
import com.example.laborhours.export.model.ExportTemplate;
import com.example.laborhours.export.model.PageOrientation;
import com.example.laborhours.export.model.RenderJob;
import com.example.laborhours.export.model.RenderedDocument;
import com.example.laborhours.export.renderer.RowExpansionEngine;
import com.example.laborhours.export.renderer.SignatureImageWriter;
import com.example.laborhours.export.renderer.pool.RendererPool;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.util.List;

import static com.example.laborhours.export.TemplateFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ExportOrchestratorTest {
    private static final byte[] PDF = "%PDF-1.7 fake".getBytes();

    private ExportTemplateService templateService;
    private RendererPool rendererPool;
    private InMemoryStudentExportDataSource dataSource;
    private ExportOrchestrator orchestrator;

    @BeforeEach
    public void setup() {
        templateService = Mockito.mock(ExportTemplateService.class);
        rendererPool = Mockito.mock(RendererPool.class);
        dataSource = new InMemoryStudentExportDataSource();

        ExportProperties properties = properties("sponsor");
        FieldCatalog catalog = new FieldCatalog(new CustomFieldRegistry(properties));
        TemplateScanner scanner = new TemplateScanner();
        ExpansionPlanner planner = new ExpansionPlanner();
        orchestrator = new ExportOrchestrator(
                templateService,
                scanner,
                new TemplateValidator(scanner, planner, catalog),
                planner,
                new BindingResolver(catalog, new LaborHourRuleCalculator(new LaborHourRuleProperties()), dataSource),
                new RowExpansionEngine(new SignatureImageWriter()),
                rendererPool,
                dataSource,
                properties);

        dataSource.saveStudent(student("2023001"));
        dataSource.saveRecords("2023001", List.of(
                record("r1", "ACM", 1, 4, 3),
                record("r2", "Math", 2, 5, 9)));
    }

    @Test
    public void testXlsxExportReturnsMaterializedWorkbook() throws Exception {
        givenTemplate(template(
                "A1", "{{name}}",
                "A3", "{{list:seq}}", "B3", "{{list:contest_name}}",
                "A4", "{{/list}}", "B4", "{{/list}}",
                "A6", "合计：{{total_approved_hours}}学时"));

        RenderedDocument document = orchestrator.export("labor_hours", "2023001", ExportFormat.XLSX);

        assertEquals("2023001-labor_hours.xlsx", document.getFileName());
        assertEquals(ExportFormat.XLSX.getContentType(), document.getContentType());
        try (Workbook workbook = read(document.getContent())) {
            Sheet sheet = workbook.getSheetAt(0);
            assertEquals("Li Lei", text(sheet, "A1"));
            assertEquals("ACM", text(sheet, "B3"));
            assertEquals("Math", text(sheet, "B4"));
            assertEquals("2", text(sheet, "A4"));
            assertEquals("", text(sheet, "B5"), "Terminator moved down and blanked");
            assertEquals("合计：12学时", text(sheet, "A7"));
        }
        verify(rendererPool, never()).render(any());
    }

    @Test
    public void testPdfExportGoesThroughThePool() throws Exception {
        givenTemplate(template("A1", "{{name}}"), PageOrientation.LANDSCAPE);
        when(rendererPool.render(any())).thenReturn(PDF);

        RenderedDocument document = orchestrator.export("labor_hours", "2023001", ExportFormat.PDF);

        assertArrayEquals(PDF, document.getContent());
        assertEquals("application/pdf", document.getContentType());
        assertEquals("2023001-labor_hours.pdf", document.getFileName());
        ArgumentCaptor<RenderJob> job = ArgumentCaptor.forClass(RenderJob.class);
        verify(rendererPool).render(job.capture());
        assertEquals(PageOrientation.LANDSCAPE, job.getValue().getOrientation());
        assertTrue(job.getValue().remaining().toMillis() > 0);
    }

    @Test
    public void testCrashedRenderIsRetriedOnce() throws Exception {
        givenTemplate(template("A1", "{{name}}"));
        when(rendererPool.render(any()))
                .thenThrow(new RendererCrashedException("converter died"))
                .thenReturn(PDF);

        RenderedDocument document = orchestrator.export("labor_hours", "2023001", ExportFormat.PDF);

        assertArrayEquals(PDF, document.getContent());
        verify(rendererPool, times(2)).render(any());
    }

    @Test
    public void testSecondCrashIsSurfaced() throws Exception {
        givenTemplate(template("A1", "{{name}}"));
        when(rendererPool.render(any())).thenThrow(new RendererCrashedException("converter died"));

        assertThrows(RendererCrashedException.class,
                () -> orchestrator.export("labor_hours", "2023001", ExportFormat.PDF));
        verify(rendererPool, times(2)).render(any());
    }

    @Test
    public void testTimeoutIsNotRetried() throws Exception {
        givenTemplate(template("A1", "{{name}}"));
        when(rendererPool.render(any())).thenThrow(new RendererTimeoutException("too slow"));

        RendererTimeoutException e = assertThrows(RendererTimeoutException.class,
                () -> orchestrator.export("labor_hours", "2023001", ExportFormat.PDF));
        assertTrue(e.isRetryable());
        verify(rendererPool, times(1)).render(any());
    }

    @Test
    public void testInvalidTemplateIsRefused() throws Exception {
        givenTemplate(template("A1", "{{nickname}}", "C9", "{{/list}}"));

        TemplateInvalidException e = assertThrows(TemplateInvalidException.class,
                () -> orchestrator.export("labor_hours", "2023001", ExportFormat.PDF));

        assertEquals(1, e.getIssues().size(), "Advisory issues do not block: " + e.getIssues());
        assertTrue(e.getIssues().get(0).contains("nickname"));
        verify(rendererPool, never()).render(any());
    }

    @Test
    public void testUnconfiguredCustomFieldIsUnresolvable() {
        givenTemplate(template("A1", "{{custom.advisor}}"));

        assertThrows(UnresolvableFieldException.class,
                () -> orchestrator.export("labor_hours", "2023001", ExportFormat.XLSX));
    }

    @Test
    public void testUnknownStudent() {
        givenTemplate(template("A1", "{{name}}"));

        assertThrows(StudentNotFoundException.class,
                () -> orchestrator.export("labor_hours", "1999999", ExportFormat.XLSX));
    }

    @Test
    public void testUnknownTemplate() {
        when(templateService.get("labor_hours")).thenThrow(new TemplateNotFoundException("nothing uploaded"));

        assertThrows(TemplateNotFoundException.class,
                () -> orchestrator.export("labor_hours", "2023001", ExportFormat.PDF));
    }

    @Test
    public void testInterruptedRenderIsCancelled() throws Exception {
        givenTemplate(template("A1", "{{name}}"));
        when(rendererPool.render(any())).thenThrow(new InterruptedException());

        try {
            assertThrows(ExportCancelledException.class,
                    () -> orchestrator.export("labor_hours", "2023001", ExportFormat.PDF));
            assertTrue(Thread.currentThread().isInterrupted(), "Interrupt status is restored");
        } finally {
            Thread.interrupted();
        }
    }

    private void givenTemplate(byte[] bytes) {
        givenTemplate(bytes, PageOrientation.PORTRAIT);
    }

    private void givenTemplate(byte[] bytes, PageOrientation orientation) {
        when(templateService.get("labor_hours")).thenReturn(ExportTemplate.builder()
                .key("labor_hours")
                .name("Labor hours certificate")
                .orientation(orientation)
                .rawBytes(bytes)
                .build());
    }
}
