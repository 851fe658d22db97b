package com.example.laborhours.export.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

/**
 * One contest award record submitted by a student for labor-hours credit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AwardRecord {
    public static final String STATUS_SUBMITTED = "submitted";
    public static final String STATUS_FIRST_REVIEWED = "first_reviewed";
    public static final String STATUS_FINAL_REVIEWED = "final_reviewed";
    public static final String STATUS_REJECTED = "rejected";

    private String id;
    private Integer contestYear;
    private String contestCategory;
    private String contestName;
    private String contestLevel;
    private String contestRole;
    private String awardLevel;
    private LocalDate awardDate;
    private int selfHours;
    private Integer firstReviewHours;
    private Integer finalReviewHours;
    private String status;
    private String rejectionReason;
    private String firstReviewerId;
    private String finalReviewerId;
    private boolean deleted;

    /**
     * Submission time; defines the natural output order of records
     */
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Per-record values of administrator-defined form fields, keyed without
     * the "custom." prefix
     */
    @Builder.Default
    private Map<String, String> customFields = new HashMap<>();
}
