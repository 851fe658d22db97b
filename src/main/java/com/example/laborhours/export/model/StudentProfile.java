package com.example.laborhours.export.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Identity and demographic data of one student, as provided by the intake system.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StudentProfile {
    private String studentNo;
    private String name;
    private String gender;
    private String department;
    private String major;
    private String className;
    private String phone;

    /**
     * Student-level values of administrator-defined form fields, keyed without
     * the "custom." prefix
     */
    @Builder.Default
    private Map<String, String> customFields = new HashMap<>();
}
