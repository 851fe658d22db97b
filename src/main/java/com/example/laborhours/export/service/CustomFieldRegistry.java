package com.example.laborhours.export.service;

import com.example.laborhours.export.config.ExportProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The administrator-defined form fields that "custom.&lt;key&gt;" placeholders may
 * refer to. Seeded from configuration; fields added later make previously
 * advisory validation issues go away on the next revalidation.
 */
@Slf4j
@Component
public class CustomFieldRegistry {
    private final Set<String> fields = ConcurrentHashMap.newKeySet();

    public CustomFieldRegistry(ExportProperties properties) {
        for (String field : properties.getCustomFields()) {
            register(field);
        }
    }

    public void register(String fieldKey) {
        if (fieldKey == null || fieldKey.isBlank()) {
            throw new IllegalArgumentException("Custom field key must not be blank");
        }
        if (fields.add(fieldKey.trim())) {
            log.info("Registered custom field '{}'", fieldKey.trim());
        }
    }

    public boolean contains(String fieldKey) {
        return fields.contains(fieldKey);
    }

    public Set<String> snapshot() {
        return new TreeSet<>(fields);
    }
}
