package com.example.laborhours.export.exception;

/**
 * Raised when template bytes cannot be read as an xlsx workbook.
 */
public class TemplateCorruptException extends ExportException {

    public TemplateCorruptException(String description) {
        super(ExportErrorCode.TEMPLATE_CORRUPT, description);
    }

    public TemplateCorruptException(String description, Throwable cause) {
        super(ExportErrorCode.TEMPLATE_CORRUPT, description, cause);
    }
}
