package com.example.laborhours.export.exception;

/**
 * Raised when list tables on one sheet cannot be expanded independently.
 */
public class ExpansionConflictException extends ExportException {

    public ExpansionConflictException(String description) {
        super(ExportErrorCode.EXPANSION_CONFLICT, description);
    }

    public ExpansionConflictException(String description, Throwable cause) {
        super(ExportErrorCode.EXPANSION_CONFLICT, description, cause);
    }
}
