package com.example.laborhours.export.controller;

import com.example.laborhours.export.model.AwardRecord;
import com.example.laborhours.export.service.InMemoryStudentExportDataSource;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.example.laborhours.export.TemplateFixtures.*;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Upload a template over HTTP, then export a student's document with the
 * in-process renderer.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
public class StudentExportIntegrationTest {
    private static final Path STORAGE_DIR = createStorageDir();

    private static final byte[] LABOR_HOURS_TEMPLATE = template(
            "A1", "学生劳动教育学时认定表",
            "A2", "姓名：{{name}}", "C2", "学号：{{student_no}}",
            "A4", "{{list:seq}}", "B4", "{{list:contest_name}}", "C4", "{{list:approved_hours}}", "D4", "{{list:custom.sponsor}}",
            "A6", "{{/list}}", "B6", "{{/list}}", "C6", "{{/list}}", "D6", "{{/list}}",
            "A7", "合计：{{total_approved_hours}}学时",
            "C8", "{{final_signature_image}}");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private InMemoryStudentExportDataSource dataSource;

    @DynamicPropertySource
    static void storage(DynamicPropertyRegistry registry) {
        registry.add("export.templates.storage-dir", STORAGE_DIR::toString);
    }

    @BeforeEach
    public void seedStudents() {
        dataSource.clear();
        dataSource.saveStudent(student("2023001"));
        AwardRecord acm = record("r1", "ACM", 1, 4, 3);
        acm.getCustomFields().put("sponsor", "Huawei");
        dataSource.saveRecords("2023001", List.of(acm, record("r2", "Math", 2, 5, 9), record("r3", "Robotics", 3, 2, null)));
    }

    @Test
    public void testUploadReturnsValidationIssues() throws Exception {
        byte[] withOrphan = template("A1", "{{name}}", "F3", "{{/list}}");

        mockMvc.perform(multipart("/api/export-templates/certificate")
                        .file(xlsx(withOrphan))
                        .param("name", "Certificate")
                        .param("orientation", "landscape"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.key").value("certificate"))
                .andExpect(jsonPath("$.orientation").value("LANDSCAPE"))
                .andExpect(jsonPath("$.issues", hasSize(1)))
                .andExpect(jsonPath("$.issues[0]").value(containsString("terminator without matching list head")));

        mockMvc.perform(get("/api/export-templates/certificate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Certificate"))
                .andExpect(jsonPath("$.issues", hasSize(1)));
    }

    @Test
    public void testUploadRejectsUnreadableBytesAndUnknownKeys() throws Exception {
        mockMvc.perform(multipart("/api/export-templates/certificate")
                        .file(xlsx("definitely not a spreadsheet".getBytes(StandardCharsets.UTF_8))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("TEMPLATE_CORRUPT"));

        mockMvc.perform(multipart("/api/export-templates/payroll").file(xlsx(LABOR_HOURS_TEMPLATE)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    public void testExportPdf() throws Exception {
        upload("labor_hours", LABOR_HOURS_TEMPLATE);

        MvcResult result = mockMvc.perform(get("/api/exports/labor_hours/students/2023001"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Type", MediaType.APPLICATION_PDF_VALUE))
                .andExpect(header().string("Content-Disposition", containsString("2023001-labor_hours.pdf")))
                .andReturn();

        String head = new String(result.getResponse().getContentAsByteArray(), 0, 5, StandardCharsets.US_ASCII);
        assertEquals("%PDF-", head);
    }

    @Test
    public void testExportXlsxExpandsRecordTable() throws Exception {
        upload("labor_hours", LABOR_HOURS_TEMPLATE);

        MvcResult result = mockMvc.perform(get("/api/exports/labor_hours/students/2023001").param("format", "xlsx"))
                .andExpect(status().isOk())
                .andReturn();

        try (Workbook workbook = read(result.getResponse().getContentAsByteArray())) {
            Sheet sheet = workbook.getSheetAt(0);
            assertEquals("姓名：Li Lei", text(sheet, "A2"));
            assertEquals("ACM", text(sheet, "B4"));
            assertEquals("Huawei", text(sheet, "D4"));
            assertEquals("Math", text(sheet, "B5"));
            assertEquals("Robotics", text(sheet, "B6"));
            assertEquals("", text(sheet, "C6"), "Pending record has no approved hours yet");
            assertEquals("", text(sheet, "D5"), "Missing custom value renders empty");
            assertEquals("", text(sheet, "B7"), "Terminator is blank");
            assertEquals("合计：12学时", text(sheet, "A8"));
        }
    }

    @Test
    public void testExportErrors() throws Exception {
        mockMvc.perform(get("/api/exports/empty_slot/students/2023001"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("TEMPLATE_NOT_FOUND"))
                .andExpect(jsonPath("$.retryable").value(false));

        upload("certificate", template("A1", "{{nickname}}", "A3", "{{list:name}}"));
        mockMvc.perform(get("/api/exports/certificate/students/2023001"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("TEMPLATE_INVALID"))
                .andExpect(jsonPath("$.issues", hasSize(2)));

        upload("labor_hours", LABOR_HOURS_TEMPLATE);
        mockMvc.perform(get("/api/exports/labor_hours/students/1999999"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("STUDENT_NOT_FOUND"));

        mockMvc.perform(get("/api/exports/labor_hours/students/2023001").param("format", "docx"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    public void testRegisteringCustomFieldClearsIssueOnRevalidate() throws Exception {
        upload("empty_slot_for_advisor", template("A1", "{{custom.advisor}}"));
        mockMvc.perform(get("/api/exports/empty_slot_for_advisor/students/2023001").param("format", "xlsx"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("UNRESOLVABLE_FIELD"));

        mockMvc.perform(post("/api/admin/custom-fields/advisor")).andExpect(status().isOk());

        mockMvc.perform(post("/api/export-templates/empty_slot_for_advisor/revalidate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.issues", hasSize(0)));
        mockMvc.perform(get("/api/exports/empty_slot_for_advisor/students/2023001").param("format", "xlsx"))
                .andExpect(status().isOk());
    }

    private void upload(String key, byte[] bytes) throws Exception {
        mockMvc.perform(multipart("/api/export-templates/" + key).file(xlsx(bytes)))
                .andExpect(status().isOk());
    }

    private static MockMultipartFile xlsx(byte[] bytes) {
        return new MockMultipartFile("file", "template.xlsx",
                "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", bytes);
    }

    private static Path createStorageDir() {
        try {
            return Files.createTempDirectory("export-templates-it");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
