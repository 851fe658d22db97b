package com.example.laborhours.export.service;

import com.example.laborhours.export.model.AwardRecord;
import com.example.laborhours.export.model.StudentProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Map-backed data source used when the service runs without the portal
 * database, and in tests.
 */
@Slf4j
@Component
public class InMemoryStudentExportDataSource implements StudentExportDataSource {
    private final Map<String, StudentProfile> students = new ConcurrentHashMap<>();
    private final Map<String, List<AwardRecord>> records = new ConcurrentHashMap<>();
    private final Map<String, String> signatures = new ConcurrentHashMap<>();

    public void saveStudent(StudentProfile student) {
        students.put(student.getStudentNo(), student);
        log.debug("Stored student {}", student.getStudentNo());
    }

    public void saveRecord(String studentNo, AwardRecord record) {
        records.computeIfAbsent(studentNo, k -> new CopyOnWriteArrayList<>()).add(record);
    }

    public void saveRecords(String studentNo, List<AwardRecord> awardRecords) {
        awardRecords.forEach(record -> saveRecord(studentNo, record));
    }

    public void saveSignature(String reviewerId, String path) {
        signatures.put(reviewerId, path);
    }

    public void clear() {
        students.clear();
        records.clear();
        signatures.clear();
    }

    @Override
    public Optional<StudentProfile> findStudent(String studentNo) {
        return Optional.ofNullable(students.get(studentNo));
    }

    @Override
    public List<AwardRecord> findAwardRecords(String studentNo) {
        return new ArrayList<>(records.getOrDefault(studentNo, List.of()));
    }

    @Override
    public Optional<String> findSignaturePath(String reviewerId) {
        if (reviewerId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(signatures.get(reviewerId));
    }
}
