package com.example.ssdetect.detect;

import com.example.ssdetect.DetectionMethod;

import java.time.Duration;

/**
 * Final decision of the adapter for one image: which detector decided, what it measured,
 * and how long the whole image took including decoding.
 */
public record Classification(boolean screenshot, DetectionMethod method, double metric, Duration elapsed) {
}
