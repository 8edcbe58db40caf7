package com.example.ssdetect.detect;

/**
 * A recognized block of text with a confidence in [0, 1] and its bounding box in pixels.
 */
public record TextRegion(String text, double confidence, int x, int y, int width, int height) {
    public int length() {
        return text == null ? 0 : text.length();
    }
}
