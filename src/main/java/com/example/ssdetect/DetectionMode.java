package com.example.ssdetect;

import java.util.Locale;

/**
 * Which detectors run for each image.
 */
public enum DetectionMode {
    HORIZONTAL,
    OCR,
    BOTH;

    public boolean usesHorizontal() {
        return this == HORIZONTAL || this == BOTH;
    }

    public boolean usesOcr() {
        return this == OCR || this == BOTH;
    }

    public static DetectionMode parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("mode must be one of horizontal, ocr, both but was '" + value + "'.", ex);
        }
    }
}
