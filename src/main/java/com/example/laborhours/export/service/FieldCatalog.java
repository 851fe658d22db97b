package com.example.laborhours.export.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Which field keys may be bound where. Scalar keys describe the student as a
 * whole, list keys describe one award record. Keys in the "custom." namespace
 * are legal in both positions and resolve against {@link CustomFieldRegistry}.
 */
@Component
@RequiredArgsConstructor
public class FieldCatalog {
    public static final String CUSTOM_PREFIX = "custom.";
    public static final String SEQ = "seq";

    public static final String STUDENT_NO = "student_no";
    public static final String NAME = "name";
    public static final String GENDER = "gender";
    public static final String DEPARTMENT = "department";
    public static final String MAJOR = "major";
    public static final String CLASS_NAME = "class_name";
    public static final String PHONE = "phone";
    public static final String TOTAL_SELF_HOURS = "total_self_hours";
    public static final String TOTAL_APPROVED_HOURS = "total_approved_hours";
    public static final String TOTAL_REASON = "total_reason";
    public static final String FIRST_SIGNATURE_PATH = "first_signature_path";
    public static final String FINAL_SIGNATURE_PATH = "final_signature_path";
    public static final String FIRST_SIGNATURE_IMAGE = "first_signature_image";
    public static final String FINAL_SIGNATURE_IMAGE = "final_signature_image";

    public static final String CONTEST_YEAR = "contest_year";
    public static final String CONTEST_CATEGORY = "contest_category";
    public static final String CONTEST_NAME = "contest_name";
    public static final String CONTEST_LEVEL = "contest_level";
    public static final String CONTEST_ROLE = "contest_role";
    public static final String AWARD_LEVEL = "award_level";
    public static final String AWARD_DATE = "award_date";
    public static final String SELF_HOURS = "self_hours";
    public static final String FIRST_REVIEW_HOURS = "first_review_hours";
    public static final String FINAL_REVIEW_HOURS = "final_review_hours";
    public static final String APPROVED_HOURS = "approved_hours";
    public static final String RECOMMENDED_HOURS = "recommended_hours";
    public static final String STATUS = "status";
    public static final String REJECTION_REASON = "rejection_reason";

    public static final List<String> SCALAR_KEYS = List.of(
            STUDENT_NO, NAME, GENDER, DEPARTMENT, MAJOR, CLASS_NAME, PHONE,
            TOTAL_SELF_HOURS, TOTAL_APPROVED_HOURS, TOTAL_REASON,
            FIRST_SIGNATURE_PATH, FINAL_SIGNATURE_PATH, FIRST_SIGNATURE_IMAGE, FINAL_SIGNATURE_IMAGE);

    public static final List<String> LIST_KEYS = List.of(
            SEQ, CONTEST_YEAR, CONTEST_CATEGORY, CONTEST_NAME, CONTEST_LEVEL, CONTEST_ROLE,
            AWARD_LEVEL, AWARD_DATE, SELF_HOURS, FIRST_REVIEW_HOURS, FINAL_REVIEW_HOURS,
            APPROVED_HOURS, RECOMMENDED_HOURS, STATUS, REJECTION_REASON);

    private static final Set<String> SCALARS = Set.copyOf(SCALAR_KEYS);
    private static final Set<String> LISTS = Set.copyOf(LIST_KEYS);
    private static final Set<String> IMAGES = Set.of(FIRST_SIGNATURE_IMAGE, FINAL_SIGNATURE_IMAGE);

    private final CustomFieldRegistry customFields;

    public boolean isScalarKey(String fieldKey) {
        return SCALARS.contains(fieldKey);
    }

    public boolean isListKey(String fieldKey) {
        return LISTS.contains(fieldKey);
    }

    public boolean isImageKey(String fieldKey) {
        return IMAGES.contains(fieldKey);
    }

    public static boolean isCustomKey(String fieldKey) {
        return fieldKey != null && fieldKey.startsWith(CUSTOM_PREFIX);
    }

    /**
     * The identifier after "custom.", or null for a non-custom key.
     */
    public static String customName(String fieldKey) {
        return isCustomKey(fieldKey) ? fieldKey.substring(CUSTOM_PREFIX.length()) : null;
    }

    public boolean isRegisteredCustomKey(String fieldKey) {
        String name = customName(fieldKey);
        return name != null && !name.isEmpty() && customFields.contains(name);
    }

    /**
     * Whether the key names anything at all, in either binding position.
     */
    public boolean isKnown(String fieldKey) {
        return isScalarKey(fieldKey) || isListKey(fieldKey) || isCustomKey(fieldKey);
    }
}
