package com.example.ssdetect.detect;

import java.awt.image.BufferedImage;
import java.util.List;

@FunctionalInterface
public interface OcrEngine extends AutoCloseable {
    List<TextRegion> recognize(BufferedImage image) throws DetectionException;

    @Override
    default void close() {
        // no-op
    }
}
