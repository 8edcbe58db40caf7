package com.example.ssdetect;

/**
 * The detector that decided a verdict, or {@link #NONE} when no detector got that far.
 */
public enum DetectionMethod {
    HORIZONTAL,
    OCR,
    NONE
}
