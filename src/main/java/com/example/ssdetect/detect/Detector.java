package com.example.ssdetect.detect;

import com.example.ssdetect.DetectionMethod;

import java.awt.image.BufferedImage;

/**
 * One loaded detection model. Instances are owned by a single worker and are not shared
 * between threads.
 */
public interface Detector extends AutoCloseable {
    DetectionMethod method();

    /**
     * Classifies a decoded image. Must not write to any shared state.
     */
    DetectorOutcome detect(BufferedImage image) throws DetectionException;

    @Override
    default void close() {
        // no-op
    }
}
