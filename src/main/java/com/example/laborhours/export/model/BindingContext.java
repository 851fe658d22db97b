package com.example.laborhours.export.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolved, read-only data for one export: scalar values keyed by field and one
 * value row per list record, in output order. Values are String, Number or
 * {@link ImageReference}. Built fresh per export and never shared.
 */
public final class BindingContext {
    private final Map<String, Object> scalars;
    private final List<Map<String, Object>> rows;

    private BindingContext(Map<String, Object> scalars, List<Map<String, Object>> rows) {
        this.scalars = Collections.unmodifiableMap(new LinkedHashMap<>(scalars));
        List<Map<String, Object>> copied = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            copied.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        this.rows = Collections.unmodifiableList(copied);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Object> getScalars() {
        return scalars;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public int getRowCount() {
        return rows.size();
    }

    public boolean hasScalar(String fieldKey) {
        return scalars.containsKey(fieldKey);
    }

    public Object getScalar(String fieldKey) {
        return scalars.get(fieldKey);
    }

    /**
     * Value of a list field for the record at the given output position,
     * or an empty string when the record has no value for it.
     */
    public Object getListValue(int rowIndex, String fieldKey) {
        Object value = rows.get(rowIndex).get(fieldKey);
        return value != null ? value : "";
    }

    public static final class Builder {
        private final Map<String, Object> scalars = new LinkedHashMap<>();
        private final List<Map<String, Object>> rows = new ArrayList<>();

        public Builder scalar(String fieldKey, Object value) {
            scalars.put(fieldKey, value != null ? value : "");
            return this;
        }

        public Builder row(Map<String, Object> row) {
            rows.add(row);
            return this;
        }

        public BindingContext build() {
            return new BindingContext(scalars, rows);
        }
    }
}
