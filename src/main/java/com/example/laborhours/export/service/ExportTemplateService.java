package com.example.laborhours.export.service;

import com.example.laborhours.export.exception.TemplateNotFoundException;
import com.example.laborhours.export.model.ExportTemplate;
import com.example.laborhours.export.model.PageOrientation;
import com.example.laborhours.export.model.ValidationReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Upload boundary for administrators: stores templates together with their
 * current validation issues. Issues never block an upload; only bytes that
 * are not a workbook at all are refused.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExportTemplateService {
    private final TemplateStore store;
    private final TemplateValidator validator;

    public ExportTemplate upload(String key, String name, PageOrientation orientation, byte[] bytes) {
        if (!store.isKnownKey(key)) {
            throw new IllegalArgumentException("Unknown template key '" + key + "'; allowed: " + store.getKnownKeys());
        }
        ValidationReport report = validator.validate(bytes);
        ExportTemplate template = ExportTemplate.builder()
                .key(key)
                .name(name == null || name.isBlank() ? key : name)
                .orientation(orientation)
                .rawBytes(bytes)
                .validationIssues(report.getMessages())
                .updatedAt(Instant.now())
                .build();
        log.info("Uploading template '{}' ({} bytes, orientation {}) with {} issue(s)",
                key, bytes.length, template.getOrientation(), report.getIssues().size());
        return store.save(template);
    }

    /**
     * Re-runs validation against the current field catalog and stores the
     * refreshed issue list.
     */
    public ExportTemplate revalidate(String key) {
        ExportTemplate current = get(key);
        ValidationReport report = validator.validate(current.getRawBytes());
        log.info("Revalidated template '{}': {} issue(s)", key, report.getIssues().size());
        return store.save(current.toBuilder()
                .validationIssues(report.getMessages())
                .updatedAt(Instant.now())
                .build());
    }

    public ExportTemplate get(String key) {
        return store.find(key)
                .orElseThrow(() -> new TemplateNotFoundException("No template has been uploaded under key '" + key + "'"));
    }
}
