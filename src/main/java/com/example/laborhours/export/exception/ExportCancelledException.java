package com.example.laborhours.export.exception;

public class ExportCancelledException extends ExportException {

    public ExportCancelledException(String description) {
        super(ExportErrorCode.EXPORT_CANCELLED, description);
    }

    public ExportCancelledException(String description, Throwable cause) {
        super(ExportErrorCode.EXPORT_CANCELLED, description, cause);
    }
}
