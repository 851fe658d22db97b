package com.example.laborhours.export.model;

import lombok.Value;

import java.util.List;

/**
 * Expansion instructions for one list table: the list-bound columns that share
 * an anchor row on a sheet, and the terminator row that closes them if any.
 * Rows are zero based and refer to the unexpanded template.
 */
@Value
public class ExpansionPlan {

    @Value
    public static class ListColumn {
        int columnIndex;
        String fieldKey;
    }

    String sheetName;
    int anchorRow;
    /** Null when the table runs to the end of the sheet */
    Integer terminatorRow;
    List<ListColumn> columns;

    public ExpansionPlan(String sheetName, int anchorRow, Integer terminatorRow, List<ListColumn> columns) {
        this.sheetName = sheetName;
        this.anchorRow = anchorRow;
        this.terminatorRow = terminatorRow;
        this.columns = List.copyOf(columns);
    }

    public boolean hasTerminator() {
        return terminatorRow != null;
    }

    /**
     * Rows available to the table before any insertion: the rows between the
     * anchor and the terminator, or every row from the anchor to the sheet's
     * current last row when there is no terminator.
     */
    public int getAvailableRows(int lastRowIndex) {
        if (terminatorRow != null) {
            return terminatorRow - anchorRow;
        }
        return Math.max(1, lastRowIndex - anchorRow + 1);
    }

    public boolean isListColumn(int columnIndex) {
        return columns.stream().anyMatch(column -> column.getColumnIndex() == columnIndex);
    }
}
