package com.example.laborhours.export.exception;

public class RendererCrashedException extends ExportException {

    public RendererCrashedException(String description) {
        super(ExportErrorCode.RENDERER_CRASHED, description);
    }

    public RendererCrashedException(String description, Throwable cause) {
        super(ExportErrorCode.RENDERER_CRASHED, description, cause);
    }
}
