package com.example.ssdetect.detect;

/**
 * Verdict of a single detector plus its numeric evidence (line count or character count).
 */
public record DetectorOutcome(boolean screenshot, double metric) {
}
