package com.example.laborhours.export.exception;

/**
 * Base for every failure the export pipeline reports to its caller.
 * Carries a stable code plus a description meant for administrators.
 */
public class ExportException extends RuntimeException {
    private final ExportErrorCode code;
    private final String description;

    public ExportException(ExportErrorCode code, String description) {
        super(code + ": " + description);
        this.code = code;
        this.description = description;
    }

    public ExportException(ExportErrorCode code, String description, Throwable cause) {
        super(code + ": " + description, cause);
        this.code = code;
        this.description = description;
    }

    public ExportErrorCode getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }
}
