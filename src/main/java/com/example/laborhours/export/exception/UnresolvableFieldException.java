package com.example.laborhours.export.exception;

/**
 * Raised when a field referenced by the template has no catalog entry at export time.
 */
public class UnresolvableFieldException extends ExportException {

    public UnresolvableFieldException(String description) {
        super(ExportErrorCode.UNRESOLVABLE_FIELD, description);
    }

    public UnresolvableFieldException(String description, Throwable cause) {
        super(ExportErrorCode.UNRESOLVABLE_FIELD, description, cause);
    }
}
