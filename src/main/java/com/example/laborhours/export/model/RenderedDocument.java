package com.example.laborhours.export.model;

import lombok.Value;

/**
 * Final artifact returned by the export boundary.
 */
@Value
public class RenderedDocument {
    byte[] content;
    String contentType;
    String fileName;
}
