package com.example.laborhours.export.service;

import com.example.laborhours.export.aspect.LogExecutionTime;
import com.example.laborhours.export.config.ExportProperties;
import com.example.laborhours.export.core.ExpansionPlanner;
import com.example.laborhours.export.core.TemplateScanner;
import com.example.laborhours.export.exception.ExportCancelledException;
import com.example.laborhours.export.exception.ExportException;
import com.example.laborhours.export.exception.RendererCrashedException;
import com.example.laborhours.export.exception.StudentNotFoundException;
import com.example.laborhours.export.exception.TemplateInvalidException;
import com.example.laborhours.export.exception.UnresolvableFieldException;
import com.example.laborhours.export.model.AwardRecord;
import com.example.laborhours.export.model.BindingContext;
import com.example.laborhours.export.model.ExpansionPlan;
import com.example.laborhours.export.model.ExportFormat;
import com.example.laborhours.export.model.ExportTemplate;
import com.example.laborhours.export.model.Placeholder;
import com.example.laborhours.export.model.RenderJob;
import com.example.laborhours.export.model.RenderedDocument;
import com.example.laborhours.export.model.StudentProfile;
import com.example.laborhours.export.model.ValidationIssue;
import com.example.laborhours.export.model.ValidationReport;
import com.example.laborhours.export.renderer.RowExpansionEngine;
import com.example.laborhours.export.renderer.pool.RendererPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs one export end to end: snapshot the template, re-validate it, resolve
 * the student's data, expand the workbook and hand it to the renderer pool.
 *
 * Every intermediate artifact belongs to the calling thread. A failure at any
 * stage surfaces as an {@link ExportException} and no partial document is
 * returned. A crashed renderer is retried once on another handle; timeouts and
 * pool exhaustion go straight back to the caller as retryable errors.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExportOrchestrator {
    private final ExportTemplateService templateService;
    private final TemplateScanner scanner;
    private final TemplateValidator validator;
    private final ExpansionPlanner planner;
    private final BindingResolver resolver;
    private final RowExpansionEngine expansionEngine;
    private final RendererPool rendererPool;
    private final StudentExportDataSource dataSource;
    private final ExportProperties properties;

    @LogExecutionTime("export document")
    public RenderedDocument export(String templateKey, String studentNo, ExportFormat format) {
        log.info("Exporting template '{}' for student {} as {}", templateKey, studentNo, format);
        try {
            ExportTemplate template = templateService.get(templateKey);
            byte[] templateBytes = template.getRawBytes();

            List<Placeholder> placeholders = scanner.scan(templateBytes);
            rejectInvalid(templateKey, validator.validate(placeholders));

            StudentProfile student = dataSource.findStudent(studentNo)
                    .orElseThrow(() -> new StudentNotFoundException("No student with number '" + studentNo + "'"));
            List<AwardRecord> records = dataSource.findAwardRecords(studentNo);

            List<ExpansionPlan> plans = planner.planOrThrow(placeholders);
            BindingContext context = resolver.resolve(placeholders, student, records);
            byte[] workbook = expansionEngine.materialize(templateBytes, plans, context, template.getOrientation());

            String baseName = studentNo + "-" + templateKey;
            if (format == ExportFormat.XLSX) {
                log.info("Export of '{}' complete. Size: {} bytes", baseName, workbook.length);
                return new RenderedDocument(workbook, format.getContentType(), baseName + "." + format.getExtension());
            }

            byte[] pdf = render(baseName, workbook, template);
            log.info("Export of '{}' complete. Size: {} bytes", baseName, pdf.length);
            return new RenderedDocument(pdf, format.getContentType(), baseName + "." + format.getExtension());
        } catch (ExportException e) {
            log.error("Export of template '{}' for student {} failed: {}", templateKey, studentNo, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Export of template '{}' for student {} failed unexpectedly", templateKey, studentNo, e);
            throw new IllegalStateException("Failed to export template '" + templateKey + "'", e);
        }
    }

    private void rejectInvalid(String templateKey, ValidationReport report) {
        List<ValidationIssue> blocking = report.getBlockingIssues();
        if (!blocking.isEmpty()) {
            throw new TemplateInvalidException(templateKey,
                    blocking.stream().map(ValidationIssue::getMessage).collect(Collectors.toList()));
        }
        List<ValidationIssue> unresolved = report.issuesOfType(ValidationIssue.Type.UNRESOLVED_CUSTOM_FIELD);
        if (!unresolved.isEmpty()) {
            throw new UnresolvableFieldException(unresolved.stream()
                    .map(ValidationIssue::getMessage)
                    .collect(Collectors.joining("; ")));
        }
    }

    private byte[] render(String label, byte[] workbook, ExportTemplate template) {
        try {
            try {
                return rendererPool.render(newJob(label, workbook, template));
            } catch (RendererCrashedException e) {
                log.warn("Renderer crashed on '{}', retrying once: {}", label, e.getDescription());
                return rendererPool.render(newJob(label, workbook, template));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExportCancelledException("Export of '" + label + "' was cancelled while rendering", e);
        }
    }

    private RenderJob newJob(String label, byte[] workbook, ExportTemplate template) {
        Instant deadline = Instant.now().plus(properties.getRenderer().getRenderTimeout());
        return new RenderJob(label, workbook, deadline, template.getOrientation());
    }
}
