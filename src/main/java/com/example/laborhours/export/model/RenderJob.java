package com.example.laborhours.export.model;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * A materialized workbook waiting to be converted by a renderer. Consumed once.
 */
@Value
public class RenderJob {
    String label;
    byte[] workbookBytes;
    Instant deadline;
    PageOrientation orientation;

    public Duration remaining() {
        Duration left = Duration.between(Instant.now(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }
}
