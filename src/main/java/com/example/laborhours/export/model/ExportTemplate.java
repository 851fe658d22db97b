package com.example.laborhours.export.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * An uploaded spreadsheet template plus its metadata.
 *
 * Instances are immutable snapshots: the byte array is copied on the way in
 * and on the way out, so a re-upload under the same key never changes a
 * template an export is already working on.
 */
@Value
public class ExportTemplate {
    String key;
    String name;
    PageOrientation orientation;
    byte[] rawBytes;
    List<String> validationIssues;
    Instant updatedAt;

    @Builder(toBuilder = true)
    public ExportTemplate(String key, String name, PageOrientation orientation, byte[] rawBytes,
                          List<String> validationIssues, Instant updatedAt) {
        this.key = key;
        this.name = name;
        this.orientation = orientation != null ? orientation : PageOrientation.PORTRAIT;
        this.rawBytes = rawBytes != null ? rawBytes.clone() : new byte[0];
        this.validationIssues = validationIssues != null ? List.copyOf(validationIssues) : List.of();
        this.updatedAt = updatedAt;
    }

    public byte[] getRawBytes() {
        return rawBytes.clone();
    }

    public int size() {
        return rawBytes.length;
    }
}
