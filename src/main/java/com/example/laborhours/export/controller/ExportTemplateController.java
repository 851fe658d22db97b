package com.example.laborhours.export.controller;

import com.example.laborhours.export.exception.ExportException;
import com.example.laborhours.export.model.ExportTemplate;
import com.example.laborhours.export.model.ExportTemplateResponse;
import com.example.laborhours.export.model.PageOrientation;
import com.example.laborhours.export.service.ExportTemplateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * Administrator endpoints for uploading export templates and reviewing their
 * validation issues.
 */
@Slf4j
@RestController
@RequestMapping("/api/export-templates")
@RequiredArgsConstructor
public class ExportTemplateController {
    private final ExportTemplateService templateService;

    @GetMapping("/{key}")
    public ResponseEntity<?> getTemplate(@PathVariable String key) {
        try {
            return ResponseEntity.ok(ExportTemplateResponse.from(templateService.get(key)));
        } catch (ExportException e) {
            return ExportErrorResponses.of(e);
        }
    }

    /**
     * Upload or replace a template.
     *
     * POST /api/export-templates/labor_hours  (multipart: file, name, orientation=portrait|landscape)
     *
     * The response lists the validation issues; issues never prevent the upload.
     */
    @PostMapping(value = "/{key}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> uploadTemplate(
            @PathVariable String key,
            @RequestParam("file") MultipartFile file,
            @RequestParam(required = false) String name,
            @RequestParam(defaultValue = "portrait") String orientation) {
        log.info("Received template upload for key '{}' ({} bytes)", key, file.getSize());
        try {
            ExportTemplate saved = templateService.upload(key, name, PageOrientation.fromString(orientation), file.getBytes());
            return ResponseEntity.ok(ExportTemplateResponse.from(saved));
        } catch (ExportException e) {
            return ExportErrorResponses.of(e);
        } catch (IllegalArgumentException e) {
            return ExportErrorResponses.badRequest(e.getMessage());
        } catch (IOException e) {
            log.warn("Could not read uploaded template for key '{}'", key, e);
            return ExportErrorResponses.badRequest("Uploaded file could not be read");
        }
    }

    @PostMapping("/{key}/revalidate")
    public ResponseEntity<?> revalidate(@PathVariable String key) {
        try {
            return ResponseEntity.ok(ExportTemplateResponse.from(templateService.revalidate(key)));
        } catch (ExportException e) {
            return ExportErrorResponses.of(e);
        }
    }
}
