package com.example.laborhours.export.model;

import lombok.Value;

/**
 * Points at an image file to embed at write time. The bytes are read lazily by
 * the workbook writer; a reference without a path embeds nothing.
 */
@Value
public class ImageReference {
    public static final ImageReference NONE = new ImageReference(null);

    String path;

    public static ImageReference of(String path) {
        if (path == null || path.isBlank()) {
            return NONE;
        }
        return new ImageReference(path);
    }

    public boolean isPresent() {
        return path != null;
    }

    @Override
    public String toString() {
        return path == null ? "" : path;
    }
}
