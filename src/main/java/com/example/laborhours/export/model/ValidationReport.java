package com.example.laborhours.export.model;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered result of validating one template. Empty means valid.
 */
@Value
public class ValidationReport {
    List<ValidationIssue> issues;

    public ValidationReport(List<ValidationIssue> issues) {
        this.issues = List.copyOf(issues);
    }

    public List<String> getMessages() {
        return issues.stream().map(ValidationIssue::getMessage).collect(Collectors.toList());
    }

    public boolean isValid() {
        return issues.isEmpty();
    }

    public List<ValidationIssue> issuesOfType(ValidationIssue.Type type) {
        return issues.stream().filter(issue -> issue.getType() == type).collect(Collectors.toList());
    }

    public List<ValidationIssue> getBlockingIssues() {
        return issues.stream().filter(issue -> issue.getType().blocksExport()).collect(Collectors.toList());
    }
}
