package com.example.laborhours.export.service;

import com.example.laborhours.export.core.ExpansionPlanner;
import com.example.laborhours.export.core.TemplateScanner;
import com.example.laborhours.export.exception.TemplateCorruptException;
import com.example.laborhours.export.model.ValidationIssue;
import com.example.laborhours.export.model.ValidationReport;
import org.apache.poi.ss.usermodel.Workbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static com.example.laborhours.export.TemplateFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class TemplateValidatorTest {

    private CustomFieldRegistry customFields;
    private TemplateValidator validator;

    @BeforeEach
    public void setup() {
        customFields = new CustomFieldRegistry(properties("sponsor"));
        validator = new TemplateValidator(new TemplateScanner(), new ExpansionPlanner(), new FieldCatalog(customFields));
    }

    @Test
    public void testValidTemplateHasNoIssues() {
        byte[] template = template(
                "A1", "姓名：{{name}}  学号：{{student_no}}",
                "A4", "{{list:seq}}", "B4", "{{list:contest_name}}", "C4", "{{list:custom.sponsor}}",
                "A7", "{{/list}}", "B7", "{{/list}}", "C7", "{{/list}}",
                "A9", "合计：{{total_approved_hours}}学时",
                "D9", "{{final_signature_image}}");

        ValidationReport report = validator.validate(template);

        assertTrue(report.isValid(), "Unexpected issues: " + report.getMessages());
    }

    @Test
    public void testValidationIsIdempotent() {
        byte[] template = template(
                "A1", "{{nickname}}",
                "B3", "{{list:contest_name}}", "C3", "{{list:seq}}",
                "B6", "{{/list}}", "C7", "{{/list}}",
                "E1", "{{/list}}");

        ValidationReport first = validator.validate(template);
        ValidationReport second = validator.validate(template.clone());

        assertFalse(first.isValid());
        assertEquals(first.getMessages(), second.getMessages());
    }

    @Test
    public void testUnknownFieldsAndWrongBindingKind() {
        ValidationReport report = validator.validate(template(
                "A1", "{{nickname}}",
                "A2", "{{contest_name}}",
                "A3", "{{list:name}}",
                "A4", "{{list:shoe_size}}"));

        assertEquals(2, report.issuesOfType(ValidationIssue.Type.UNKNOWN_FIELD).size());
        assertEquals(2, report.issuesOfType(ValidationIssue.Type.WRONG_BINDING_KIND).size());
        assertEquals("A1", report.getIssues().get(0).getCellAddress(), "Issues follow scan order");
        assertTrue(report.getMessages().get(0).contains("nickname"));
    }

    @Test
    public void testOrphanTerminatorIsAdvisoryOnly() {
        ValidationReport report = validator.validate(template("A1", "{{name}}", "C5", "{{/list}}"));

        assertEquals(1, report.getIssues().size());
        ValidationIssue issue = report.getIssues().get(0);
        assertEquals(ValidationIssue.Type.ORPHAN_TERMINATOR, issue.getType());
        assertTrue(issue.getMessage().contains("terminator without matching list head"));
        assertTrue(report.getBlockingIssues().isEmpty());
    }

    @Test
    public void testNestedListHeadsAreReported() {
        ValidationReport report = validator.validate(template(
                "B2", "{{list:contest_name}}", "B3", "{{list:award_level}}", "B6", "{{/list}}"));

        assertEquals(1, report.issuesOfType(ValidationIssue.Type.NESTED_LIST).size());
        assertTrue(report.getMessages().get(0).contains("nested/duplicate list binding"));
    }

    @Test
    public void testSiblingColumnsWithDifferentTerminatorsAreAnError() {
        ValidationReport report = validator.validate(template(
                "A5", "{{list:seq}}", "B5", "{{list:contest_name}}",
                "A8", "{{/list}}", "B9", "{{/list}}"));

        assertEquals(1, report.issuesOfType(ValidationIssue.Type.EXPANSION_CONFLICT).size());
        assertFalse(report.getBlockingIssues().isEmpty());
    }

    @Test
    public void testListHeadMustBeAloneInItsCell() {
        ValidationReport report = validator.validate(template("A3", "No. {{list:seq}}"));

        assertEquals(1, report.issuesOfType(ValidationIssue.Type.NOT_STANDALONE).size());
    }

    @Test
    public void testUnknownCustomFieldIsAdvisoryUntilRegistered() {
        byte[] template = template("A3", "{{list:custom.advisor}}");

        ValidationReport before = validator.validate(template);
        assertEquals(1, before.issuesOfType(ValidationIssue.Type.UNRESOLVED_CUSTOM_FIELD).size());
        assertTrue(before.getBlockingIssues().isEmpty());

        customFields.register("advisor");
        assertTrue(validator.validate(template).isValid());
    }

    @Test
    public void testPlaceholdersOnEverySheetAreChecked() {
        Workbook workbook = newWorkbook();
        put(workbook.createSheet("Summary"), "A1", "{{name}}");
        put(workbook.createSheet("Details"), "A1", "{{nickname}}");

        ValidationReport report = validator.validate(toBytes(workbook));

        assertEquals(1, report.getIssues().size());
        assertEquals("Details", report.getIssues().get(0).getSheetName());
    }

    @Test
    public void testUnreadableBytesAreCorrupt() {
        assertThrows(TemplateCorruptException.class,
                () -> validator.validate("not a workbook".getBytes(StandardCharsets.UTF_8)));
        assertThrows(TemplateCorruptException.class, () -> validator.validate(new byte[0]));
    }
}
