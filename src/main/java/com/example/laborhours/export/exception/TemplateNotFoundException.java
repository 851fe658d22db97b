package com.example.laborhours.export.exception;

/**
 * Raised when no template is stored under the requested key.
 */
public class TemplateNotFoundException extends ExportException {

    public TemplateNotFoundException(String description) {
        super(ExportErrorCode.TEMPLATE_NOT_FOUND, description);
    }

    public TemplateNotFoundException(String description, Throwable cause) {
        super(ExportErrorCode.TEMPLATE_NOT_FOUND, description, cause);
    }
}
