package com.example.laborhours.export.model;

import java.util.Locale;

public enum PageOrientation {
    PORTRAIT,
    LANDSCAPE;

    /**
     * Lenient parse used at the upload boundary; anything other than
     * "landscape" falls back to portrait.
     */
    public static PageOrientation fromString(String value) {
        if (value != null && value.trim().toLowerCase(Locale.ROOT).equals("landscape")) {
            return LANDSCAPE;
        }
        return PORTRAIT;
    }

    public boolean isLandscape() {
        return this == LANDSCAPE;
    }
}
