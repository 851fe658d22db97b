package com.example.laborhours.export.core;

import com.example.laborhours.export.exception.ExpansionConflictException;
import com.example.laborhours.export.model.ExpansionPlan;
import com.example.laborhours.export.model.Placeholder;
import com.example.laborhours.export.model.ValidationIssue;
import lombok.Value;
import org.apache.poi.ss.util.CellReference;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Pairs list heads with their terminators and groups the resulting list
 * columns into tables that can be expanded independently.
 *
 * A terminator closes the nearest open head above it in the same column. List
 * columns on one sheet that share an anchor row form one table and must share
 * the terminator row as well. Tables on a sheet may not overlap; a table
 * without a terminator runs to the end of the sheet.
 */
@Component
public class ExpansionPlanner {

    @Value
    public static class Result {
        List<ExpansionPlan> plans;
        List<ValidationIssue> issues;

        public boolean hasConflicts() {
            return issues.stream().anyMatch(issue -> issue.getType() == ValidationIssue.Type.EXPANSION_CONFLICT);
        }
    }

    @Value
    private static class ColumnBinding {
        String sheetName;
        int columnIndex;
        int anchorRow;
        Integer terminatorRow;
        String fieldKey;
    }

    public Result plan(List<Placeholder> placeholders) {
        List<ValidationIssue> issues = new ArrayList<>();
        List<ColumnBinding> bindings = pairHeadsWithTerminators(placeholders, issues);
        List<ExpansionPlan> plans = groupIntoTables(bindings, issues);
        checkTablesDoNotOverlap(plans, issues);
        return new Result(plans, issues);
    }

    /**
     * Plans for export, refusing any layout the validator would have rejected.
     */
    public List<ExpansionPlan> planOrThrow(List<Placeholder> placeholders) {
        Result result = plan(placeholders);
        List<String> conflicts = result.getIssues().stream()
                .filter(issue -> issue.getType() == ValidationIssue.Type.EXPANSION_CONFLICT
                        || issue.getType() == ValidationIssue.Type.NESTED_LIST)
                .map(ValidationIssue::getMessage)
                .collect(Collectors.toList());
        if (!conflicts.isEmpty()) {
            throw new ExpansionConflictException(String.join("; ", conflicts));
        }
        return result.getPlans();
    }

    private List<ColumnBinding> pairHeadsWithTerminators(List<Placeholder> placeholders, List<ValidationIssue> issues) {
        // sheet -> column -> markers, kept in scan order of sheets
        Map<String, Map<Integer, List<Placeholder>>> markers = new LinkedHashMap<>();
        for (Placeholder placeholder : placeholders) {
            if (placeholder.isScalar() || !placeholder.isStandalone()) {
                continue;
            }
            markers.computeIfAbsent(placeholder.getSheetName(), k -> new LinkedHashMap<>())
                    .computeIfAbsent(placeholder.getColumnIndex(), k -> new ArrayList<>())
                    .add(placeholder);
        }

        List<ColumnBinding> bindings = new ArrayList<>();
        for (Map<Integer, List<Placeholder>> columns : markers.values()) {
            List<Integer> columnOrder = new ArrayList<>(columns.keySet());
            columnOrder.sort(Comparator.naturalOrder());
            for (Integer column : columnOrder) {
                List<Placeholder> columnMarkers = new ArrayList<>(columns.get(column));
                columnMarkers.sort(Comparator.comparingInt(Placeholder::getRowIndex));
                Placeholder open = null;
                for (Placeholder marker : columnMarkers) {
                    if (marker.isListHead()) {
                        if (open != null) {
                            issues.add(new ValidationIssue(ValidationIssue.Type.NESTED_LIST, marker.getSheetName(),
                                    marker.getCellAddress(),
                                    String.format("Sheet '%s' cell %s: list head opened while the list at %s in the same column is still open (nested/duplicate list binding)",
                                            marker.getSheetName(), marker.getCellAddress(), open.getCellAddress())));
                            continue;
                        }
                        open = marker;
                    } else if (open == null) {
                        issues.add(new ValidationIssue(ValidationIssue.Type.ORPHAN_TERMINATOR, marker.getSheetName(),
                                marker.getCellAddress(),
                                String.format("Sheet '%s' cell %s: terminator without matching list head; it will be blanked and otherwise ignored",
                                        marker.getSheetName(), marker.getCellAddress())));
                    } else {
                        bindings.add(new ColumnBinding(open.getSheetName(), column, open.getRowIndex(),
                                marker.getRowIndex(), open.getFieldKey()));
                        open = null;
                    }
                }
                if (open != null) {
                    bindings.add(new ColumnBinding(open.getSheetName(), column, open.getRowIndex(), null,
                            open.getFieldKey()));
                }
            }
        }
        return bindings;
    }

    private List<ExpansionPlan> groupIntoTables(List<ColumnBinding> bindings, List<ValidationIssue> issues) {
        Map<String, List<ColumnBinding>> tables = new LinkedHashMap<>();
        for (ColumnBinding binding : bindings) {
            tables.computeIfAbsent(binding.getSheetName() + "#" + binding.getAnchorRow(), k -> new ArrayList<>())
                    .add(binding);
        }

        List<ExpansionPlan> plans = new ArrayList<>();
        for (List<ColumnBinding> table : tables.values()) {
            table.sort(Comparator.comparingInt(ColumnBinding::getColumnIndex));
            ColumnBinding first = table.get(0);
            boolean consistent = true;
            for (ColumnBinding other : table.subList(1, table.size())) {
                if (!sameTerminator(first.getTerminatorRow(), other.getTerminatorRow())) {
                    consistent = false;
                    issues.add(new ValidationIssue(ValidationIssue.Type.EXPANSION_CONFLICT, other.getSheetName(),
                            address(other.getAnchorRow(), other.getColumnIndex()),
                            String.format("Sheet '%s': list columns %s and %s start on row %d but end on different rows (%s vs %s)",
                                    other.getSheetName(), column(first.getColumnIndex()), column(other.getColumnIndex()),
                                    first.getAnchorRow() + 1, describeEnd(first.getTerminatorRow()),
                                    describeEnd(other.getTerminatorRow()))));
                }
            }
            if (!consistent) {
                continue;
            }
            List<ExpansionPlan.ListColumn> columns = table.stream()
                    .map(binding -> new ExpansionPlan.ListColumn(binding.getColumnIndex(), binding.getFieldKey()))
                    .collect(Collectors.toList());
            plans.add(new ExpansionPlan(first.getSheetName(), first.getAnchorRow(), first.getTerminatorRow(), columns));
        }
        return plans;
    }

    private void checkTablesDoNotOverlap(List<ExpansionPlan> plans, List<ValidationIssue> issues) {
        Map<String, List<ExpansionPlan>> bySheet = new LinkedHashMap<>();
        for (ExpansionPlan plan : plans) {
            bySheet.computeIfAbsent(plan.getSheetName(), k -> new ArrayList<>()).add(plan);
        }
        for (List<ExpansionPlan> sheetPlans : bySheet.values()) {
            sheetPlans.sort(Comparator.comparingInt(ExpansionPlan::getAnchorRow));
            for (int i = 1; i < sheetPlans.size(); i++) {
                ExpansionPlan upper = sheetPlans.get(i - 1);
                ExpansionPlan lower = sheetPlans.get(i);
                boolean overlaps = !upper.hasTerminator() || lower.getAnchorRow() <= upper.getTerminatorRow();
                if (overlaps) {
                    int upperColumn = upper.getColumns().get(0).getColumnIndex();
                    int lowerColumn = lower.getColumns().get(0).getColumnIndex();
                    issues.add(new ValidationIssue(ValidationIssue.Type.EXPANSION_CONFLICT, lower.getSheetName(),
                            address(lower.getAnchorRow(), lowerColumn),
                            String.format("Sheet '%s': list at %s overlaps the list at %s (which ends %s); list columns of one table must share the anchor row",
                                    lower.getSheetName(), address(lower.getAnchorRow(), lowerColumn),
                                    address(upper.getAnchorRow(), upperColumn),
                                    upper.hasTerminator() ? "on row " + (upper.getTerminatorRow() + 1) : "at the end of the sheet")));
                }
            }
        }
    }

    private static boolean sameTerminator(Integer a, Integer b) {
        return a == null ? b == null : a.equals(b);
    }

    private static String describeEnd(Integer terminatorRow) {
        return terminatorRow == null ? "end of sheet" : "row " + (terminatorRow + 1);
    }

    private static String column(int columnIndex) {
        return CellReference.convertNumToColString(columnIndex);
    }

    private static String address(int row, int column) {
        return new CellReference(row, column).formatAsString();
    }
}
