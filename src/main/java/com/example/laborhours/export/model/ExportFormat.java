package com.example.laborhours.export.model;

import java.util.Locale;

public enum ExportFormat {
    PDF("application/pdf", "pdf"),
    XLSX("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", "xlsx");

    private final String contentType;
    private final String extension;

    ExportFormat(String contentType, String extension) {
        this.contentType = contentType;
        this.extension = extension;
    }

    public String getContentType() {
        return contentType;
    }

    public String getExtension() {
        return extension;
    }

    public static ExportFormat fromString(String value) {
        if (value == null || value.isBlank()) {
            return PDF;
        }
        return ExportFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
