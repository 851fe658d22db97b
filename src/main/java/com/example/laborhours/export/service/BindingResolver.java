package com.example.laborhours.export.service;

import com.example.laborhours.export.aspect.LogExecutionTime;
import com.example.laborhours.export.exception.UnresolvableFieldException;
import com.example.laborhours.export.model.AwardRecord;
import com.example.laborhours.export.model.BindingContext;
import com.example.laborhours.export.model.ImageReference;
import com.example.laborhours.export.model.Placeholder;
import com.example.laborhours.export.model.StudentProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns one student's profile and award records into the {@link BindingContext}
 * of an export.
 *
 * Records are emitted in submission order with soft-deleted ones removed, and
 * {@code seq} is numbered after that filtering. Optional values that are absent
 * resolve to an empty string. Signature images resolve to a file reference, or
 * to {@link ImageReference#NONE} when the reviewer never uploaded one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BindingResolver {
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private static final Comparator<AwardRecord> SUBMISSION_ORDER = Comparator
            .comparing(AwardRecord::getCreatedAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparing(AwardRecord::getId, Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private final FieldCatalog catalog;
    private final LaborHourRuleCalculator ruleCalculator;
    private final StudentExportDataSource dataSource;

    @LogExecutionTime("resolve bindings")
    public BindingContext resolve(List<Placeholder> placeholders, StudentProfile student, List<AwardRecord> records) {
        Set<String> customScalars = new LinkedHashSet<>();
        Set<String> customListFields = new LinkedHashSet<>();
        for (Placeholder placeholder : placeholders) {
            if (placeholder.isTerminator()) {
                continue;
            }
            String fieldKey = placeholder.getFieldKey();
            if (FieldCatalog.isCustomKey(fieldKey)) {
                if (!catalog.isRegisteredCustomKey(fieldKey)) {
                    throw new UnresolvableFieldException(String.format(
                            "Sheet '%s' cell %s references custom field '%s' which is not configured",
                            placeholder.getSheetName(), placeholder.getCellAddress(), fieldKey));
                }
                (placeholder.isListHead() ? customListFields : customScalars).add(fieldKey);
            } else if (placeholder.isListHead() ? !catalog.isListKey(fieldKey) : !catalog.isScalarKey(fieldKey)) {
                throw new UnresolvableFieldException(String.format(
                        "Sheet '%s' cell %s references field '%s' which has no %s binding",
                        placeholder.getSheetName(), placeholder.getCellAddress(), fieldKey,
                        placeholder.isListHead() ? "list" : "scalar"));
            }
        }

        List<AwardRecord> active = records.stream()
                .filter(record -> !record.isDeleted())
                .sorted(SUBMISSION_ORDER)
                .collect(Collectors.toList());

        BindingContext.Builder context = BindingContext.builder();
        resolveScalars(context, student, active);
        for (String fieldKey : customScalars) {
            context.scalar(fieldKey, student.getCustomFields().getOrDefault(FieldCatalog.customName(fieldKey), ""));
        }
        for (int i = 0; i < active.size(); i++) {
            context.row(resolveRow(i + 1, active.get(i), customListFields));
        }

        BindingContext resolved = context.build();
        log.debug("Resolved {} scalar(s) and {} record row(s) for student {}",
                resolved.getScalars().size(), resolved.getRowCount(), student.getStudentNo());
        return resolved;
    }

    private void resolveScalars(BindingContext.Builder context, StudentProfile student, List<AwardRecord> records) {
        context.scalar(FieldCatalog.STUDENT_NO, student.getStudentNo())
                .scalar(FieldCatalog.NAME, student.getName())
                .scalar(FieldCatalog.GENDER, student.getGender())
                .scalar(FieldCatalog.DEPARTMENT, student.getDepartment())
                .scalar(FieldCatalog.MAJOR, student.getMajor())
                .scalar(FieldCatalog.CLASS_NAME, student.getClassName())
                .scalar(FieldCatalog.PHONE, student.getPhone());

        int totalSelfHours = records.stream().mapToInt(AwardRecord::getSelfHours).sum();
        int totalApprovedHours = records.stream()
                .filter(record -> AwardRecord.STATUS_FINAL_REVIEWED.equals(record.getStatus()))
                .map(AwardRecord::getFinalReviewHours)
                .filter(Objects::nonNull)
                .mapToInt(Integer::intValue)
                .sum();
        String totalReason = records.stream()
                .filter(record -> AwardRecord.STATUS_REJECTED.equals(record.getStatus()))
                .map(AwardRecord::getRejectionReason)
                .filter(Objects::nonNull)
                .collect(Collectors.joining(";"));
        context.scalar(FieldCatalog.TOTAL_SELF_HOURS, totalSelfHours)
                .scalar(FieldCatalog.TOTAL_APPROVED_HOURS, totalApprovedHours)
                .scalar(FieldCatalog.TOTAL_REASON, totalReason);

        Optional<String> firstSignature = latestSignature(records, AwardRecord::getFirstReviewerId);
        Optional<String> finalSignature = latestSignature(records, AwardRecord::getFinalReviewerId);
        context.scalar(FieldCatalog.FIRST_SIGNATURE_PATH, firstSignature.orElse(""))
                .scalar(FieldCatalog.FINAL_SIGNATURE_PATH, finalSignature.orElse(""))
                .scalar(FieldCatalog.FIRST_SIGNATURE_IMAGE, firstSignature.map(ImageReference::of).orElse(ImageReference.NONE))
                .scalar(FieldCatalog.FINAL_SIGNATURE_IMAGE, finalSignature.map(ImageReference::of).orElse(ImageReference.NONE));
    }

    /**
     * Signature of the reviewer on the most recently updated record that has one.
     */
    private Optional<String> latestSignature(List<AwardRecord> records, Function<AwardRecord, String> reviewer) {
        return records.stream()
                .filter(record -> reviewer.apply(record) != null)
                .max(Comparator.comparing(AwardRecord::getUpdatedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder())))
                .flatMap(record -> dataSource.findSignaturePath(reviewer.apply(record)));
    }

    private Map<String, Object> resolveRow(int seq, AwardRecord record, Set<String> customListFields) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(FieldCatalog.SEQ, seq);
        row.put(FieldCatalog.CONTEST_YEAR, orEmpty(record.getContestYear()));
        row.put(FieldCatalog.CONTEST_CATEGORY, orEmpty(record.getContestCategory()));
        row.put(FieldCatalog.CONTEST_NAME, orEmpty(record.getContestName()));
        row.put(FieldCatalog.CONTEST_LEVEL, orEmpty(record.getContestLevel()));
        row.put(FieldCatalog.CONTEST_ROLE, orEmpty(record.getContestRole()));
        row.put(FieldCatalog.AWARD_LEVEL, orEmpty(record.getAwardLevel()));
        row.put(FieldCatalog.AWARD_DATE, record.getAwardDate() != null ? DATE_FORMAT.format(record.getAwardDate()) : "");
        row.put(FieldCatalog.SELF_HOURS, record.getSelfHours());
        row.put(FieldCatalog.FIRST_REVIEW_HOURS, orEmpty(record.getFirstReviewHours()));
        row.put(FieldCatalog.FINAL_REVIEW_HOURS, orEmpty(record.getFinalReviewHours()));
        row.put(FieldCatalog.APPROVED_HOURS, orEmpty(record.getFinalReviewHours()));
        row.put(FieldCatalog.RECOMMENDED_HOURS, ruleCalculator.recommendedHours(record));
        row.put(FieldCatalog.STATUS, orEmpty(record.getStatus()));
        row.put(FieldCatalog.REJECTION_REASON, orEmpty(record.getRejectionReason()));
        for (String fieldKey : customListFields) {
            row.put(fieldKey, record.getCustomFields().getOrDefault(FieldCatalog.customName(fieldKey), ""));
        }
        return row;
    }

    private static Object orEmpty(Object value) {
        return value != null ? value : "";
    }
}
