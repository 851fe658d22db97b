package com.example.laborhours.export.model;

import lombok.Value;

@Value
public class ValidationIssue {

    public enum Type {
        UNKNOWN_FIELD(true),
        WRONG_BINDING_KIND(true),
        UNRESOLVED_CUSTOM_FIELD(false),
        NOT_STANDALONE(true),
        ORPHAN_TERMINATOR(false),
        NESTED_LIST(true),
        EXPANSION_CONFLICT(true);

        private final boolean blocksExport;

        Type(boolean blocksExport) {
            this.blocksExport = blocksExport;
        }

        /**
         * Whether an export against a template carrying this issue must be refused
         * as invalid. Unresolved custom fields are reported separately at export time.
         */
        public boolean blocksExport() {
            return blocksExport;
        }
    }

    Type type;
    String sheetName;
    String cellAddress;
    String message;
}
