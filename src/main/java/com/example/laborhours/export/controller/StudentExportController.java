package com.example.laborhours.export.controller;

import com.example.laborhours.export.exception.ExportException;
import com.example.laborhours.export.model.ExportFormat;
import com.example.laborhours.export.model.RenderedDocument;
import com.example.laborhours.export.service.ExportOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Export boundary: renders one student's certification document from a template.
 */
@Slf4j
@RestController
@RequestMapping("/api/exports")
@RequiredArgsConstructor
public class StudentExportController {
    private final ExportOrchestrator orchestrator;

    /**
     * GET /api/exports/labor_hours/students/2023001?format=pdf
     *
     * @param format pdf (default) or xlsx for the materialized workbook
     */
    @GetMapping("/{templateKey}/students/{studentNo}")
    public ResponseEntity<?> exportStudent(
            @PathVariable String templateKey,
            @PathVariable String studentNo,
            @RequestParam(required = false) String format) {
        log.info("Received export request for template '{}' and student {}", templateKey, studentNo);
        try {
            RenderedDocument document = orchestrator.export(templateKey, studentNo, ExportFormat.fromString(format));

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.parseMediaType(document.getContentType()));
            headers.setContentDispositionFormData("attachment", document.getFileName());
            headers.setContentLength(document.getContent().length);
            return new ResponseEntity<>(document.getContent(), headers, HttpStatus.OK);
        } catch (ExportException e) {
            return ExportErrorResponses.of(e);
        } catch (IllegalArgumentException e) {
            return ExportErrorResponses.badRequest("Unsupported export format '" + format + "'");
        }
    }
}
