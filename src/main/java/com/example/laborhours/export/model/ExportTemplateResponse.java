package com.example.laborhours.export.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Template metadata returned by the upload endpoints. The template bytes
 * themselves are never echoed back.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExportTemplateResponse {
    private String key;
    private String name;
    private PageOrientation orientation;

    /**
     * Validation issues found at the last upload or revalidation; empty means valid
     */
    @Builder.Default
    private List<String> issues = new ArrayList<>();
    private Instant updatedAt;
    private int size;

    public static ExportTemplateResponse from(ExportTemplate template) {
        return ExportTemplateResponse.builder()
                .key(template.getKey())
                .name(template.getName())
                .orientation(template.getOrientation())
                .issues(new ArrayList<>(template.getValidationIssues()))
                .updatedAt(template.getUpdatedAt())
                .size(template.size())
                .build();
    }
}
