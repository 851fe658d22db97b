package com.example.laborhours.export.exception;

/**
 * Raised when no renderer handle frees up within the queue-wait timeout.
 */
public class RendererPoolExhaustedException extends ExportException {

    public RendererPoolExhaustedException(String description) {
        super(ExportErrorCode.RENDERER_POOL_EXHAUSTED, description);
    }

    public RendererPoolExhaustedException(String description, Throwable cause) {
        super(ExportErrorCode.RENDERER_POOL_EXHAUSTED, description, cause);
    }
}
