package com.example.laborhours.export.service;

import com.example.laborhours.export.aspect.LogExecutionTime;
import com.example.laborhours.export.core.ExpansionPlanner;
import com.example.laborhours.export.core.TemplateScanner;
import com.example.laborhours.export.model.Placeholder;
import com.example.laborhours.export.model.ValidationIssue;
import com.example.laborhours.export.model.ValidationReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a template for authoring errors without touching any student data.
 *
 * Field issues are reported in scan order (sheet, row, column), followed by the
 * structural issues of list heads and terminators. The result depends only on
 * the template bytes and the current field catalog, so validating the same
 * bytes twice yields the same report.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TemplateValidator {
    private final TemplateScanner scanner;
    private final ExpansionPlanner planner;
    private final FieldCatalog catalog;

    /**
     * @throws com.example.laborhours.export.exception.TemplateCorruptException if the bytes are not an xlsx workbook
     */
    @LogExecutionTime("validate template")
    public ValidationReport validate(byte[] templateBytes) {
        ValidationReport report = validate(scanner.scan(templateBytes));
        log.info("Template validation finished with {} issue(s), {} blocking",
                report.getIssues().size(), report.getBlockingIssues().size());
        return report;
    }

    public ValidationReport validate(List<Placeholder> placeholders) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (Placeholder placeholder : placeholders) {
            checkPlaceholder(placeholder, issues);
        }
        issues.addAll(planner.plan(placeholders).getIssues());
        return new ValidationReport(issues);
    }

    private void checkPlaceholder(Placeholder placeholder, List<ValidationIssue> issues) {
        if (placeholder.isTerminator()) {
            if (!placeholder.isStandalone()) {
                issues.add(issue(ValidationIssue.Type.NOT_STANDALONE, placeholder,
                        "list terminator {{/list}} must occupy a cell by itself"));
            }
            return;
        }

        String fieldKey = placeholder.getFieldKey();
        boolean listHead = placeholder.isListHead();
        if (listHead && !placeholder.isStandalone()) {
            issues.add(issue(ValidationIssue.Type.NOT_STANDALONE, placeholder,
                    "list head " + placeholder.getRawText() + " must occupy a cell by itself"));
        }

        if (FieldCatalog.isCustomKey(fieldKey)) {
            String name = FieldCatalog.customName(fieldKey);
            if (name.isEmpty()) {
                issues.add(issue(ValidationIssue.Type.UNKNOWN_FIELD, placeholder,
                        "custom field reference '" + fieldKey + "' has no field name"));
            } else if (!catalog.isRegisteredCustomKey(fieldKey)) {
                issues.add(issue(ValidationIssue.Type.UNRESOLVED_CUSTOM_FIELD, placeholder,
                        "custom field '" + name + "' is not configured (yet)"));
            }
            return;
        }

        if (listHead) {
            if (catalog.isListKey(fieldKey)) {
                return;
            }
            if (catalog.isScalarKey(fieldKey)) {
                issues.add(issue(ValidationIssue.Type.WRONG_BINDING_KIND, placeholder,
                        "'" + fieldKey + "' is a single-value field and cannot be used as a list column"));
            } else {
                issues.add(issue(ValidationIssue.Type.UNKNOWN_FIELD, placeholder,
                        "unknown list field '" + fieldKey + "'"));
            }
            return;
        }

        if (catalog.isScalarKey(fieldKey)) {
            return;
        }
        if (catalog.isListKey(fieldKey)) {
            issues.add(issue(ValidationIssue.Type.WRONG_BINDING_KIND, placeholder,
                    "'" + fieldKey + "' is a list field; use {{list:" + fieldKey + "}}"));
        } else {
            issues.add(issue(ValidationIssue.Type.UNKNOWN_FIELD, placeholder,
                    "unknown field '" + fieldKey + "'"));
        }
    }

    private static ValidationIssue issue(ValidationIssue.Type type, Placeholder placeholder, String detail) {
        String message = String.format("Sheet '%s' cell %s: %s",
                placeholder.getSheetName(), placeholder.getCellAddress(), detail);
        return new ValidationIssue(type, placeholder.getSheetName(), placeholder.getCellAddress(), message);
    }
}
