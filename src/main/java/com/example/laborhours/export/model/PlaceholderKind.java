package com.example.laborhours.export.model;

public enum PlaceholderKind {
    /** {{field}}, may be embedded in surrounding text */
    SCALAR,
    /** {{list:field}}, anchors a vertically expanding column */
    LIST_HEAD,
    /** {{/list}}, closes the list column above it */
    LIST_TERMINATOR
}
