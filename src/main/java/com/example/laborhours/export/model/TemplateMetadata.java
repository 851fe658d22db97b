package com.example.laborhours.export.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * YAML sidecar stored next to the template bytes.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TemplateMetadata {
    private String key;
    private String name;
    private PageOrientation orientation;
    private List<String> issues = new ArrayList<>();
    private Instant updatedAt;
}
