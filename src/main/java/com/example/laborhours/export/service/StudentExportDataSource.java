package com.example.laborhours.export.service;

import com.example.laborhours.export.model.AwardRecord;
import com.example.laborhours.export.model.StudentProfile;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the intake and review system, as far as exports need it.
 */
public interface StudentExportDataSource {

    Optional<StudentProfile> findStudent(String studentNo);

    /**
     * All award records of the student, including soft-deleted ones, in no
     * particular order.
     */
    List<AwardRecord> findAwardRecords(String studentNo);

    /**
     * Path of the uploaded signature image of a reviewer, if they have one.
     */
    Optional<String> findSignaturePath(String reviewerId);
}
