package com.example.laborhours.export.exception;

/**
 * Stable error codes surfaced to callers of the export boundary.
 */
public enum ExportErrorCode {
    TEMPLATE_NOT_FOUND(false),
    TEMPLATE_INVALID(false),
    TEMPLATE_CORRUPT(false),
    UNRESOLVABLE_FIELD(false),
    EXPANSION_CONFLICT(false),
    STUDENT_NOT_FOUND(false),
    RENDERER_TIMEOUT(true),
    RENDERER_CRASHED(false),
    RENDERER_POOL_EXHAUSTED(true),
    EXPORT_CANCELLED(true);

    private final boolean retryable;

    ExportErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
