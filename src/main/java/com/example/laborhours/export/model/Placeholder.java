package com.example.laborhours.export.model;

import lombok.Builder;
import lombok.Value;
import org.apache.poi.ss.util.CellReference;

/**
 * One placeholder token found in a template cell. Row and column indexes are
 * zero based, as in Apache POI.
 */
@Value
@Builder
public class Placeholder {
    String rawText;
    PlaceholderKind kind;
    /** Field key for scalar and list-head tokens; null for terminators */
    String fieldKey;
    String sheetName;
    int rowIndex;
    int columnIndex;
    /** True when the token is the only content of its cell */
    boolean standalone;

    public String getCellAddress() {
        return new CellReference(rowIndex, columnIndex).formatAsString();
    }

    public boolean isListHead() {
        return kind == PlaceholderKind.LIST_HEAD;
    }

    public boolean isTerminator() {
        return kind == PlaceholderKind.LIST_TERMINATOR;
    }

    public boolean isScalar() {
        return kind == PlaceholderKind.SCALAR;
    }
}
