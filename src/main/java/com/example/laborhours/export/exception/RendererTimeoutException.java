package com.example.laborhours.export.exception;

/**
 * Raised when a render job misses its deadline. Retryable by the caller.
 */
public class RendererTimeoutException extends ExportException {

    public RendererTimeoutException(String description) {
        super(ExportErrorCode.RENDERER_TIMEOUT, description);
    }

    public RendererTimeoutException(String description, Throwable cause) {
        super(ExportErrorCode.RENDERER_TIMEOUT, description, cause);
    }
}
