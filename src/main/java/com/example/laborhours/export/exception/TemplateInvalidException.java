package com.example.laborhours.export.exception;

import java.util.List;

/**
 * Raised when the template still has validation issues at export time.
 * The issue list is returned to the caller verbatim.
 */
public class TemplateInvalidException extends ExportException {
    private final List<String> issues;

    public TemplateInvalidException(String templateKey, List<String> issues) {
        super(ExportErrorCode.TEMPLATE_INVALID,
                "Template '" + templateKey + "' has " + issues.size() + " validation issue(s)");
        this.issues = List.copyOf(issues);
    }

    public List<String> getIssues() {
        return issues;
    }
}
