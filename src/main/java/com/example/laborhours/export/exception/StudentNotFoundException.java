package com.example.laborhours.export.exception;

public class StudentNotFoundException extends ExportException {

    public StudentNotFoundException(String description) {
        super(ExportErrorCode.STUDENT_NOT_FOUND, description);
    }

    public StudentNotFoundException(String description, Throwable cause) {
        super(ExportErrorCode.STUDENT_NOT_FOUND, description, cause);
    }
}
