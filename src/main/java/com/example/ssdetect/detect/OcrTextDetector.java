package com.example.ssdetect.detect;

import com.example.ssdetect.DetectionMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Decides from recognized text whether an image is a screenshot. The base rule needs enough
 * characters at a sufficient average confidence; the optional extra heuristics catch caption
 * style and dense text layouts that fall short of it.
 */
public class OcrTextDetector implements Detector {
    private static final Logger LOGGER = LoggerFactory.getLogger(OcrTextDetector.class);

    private static final double HIGH_CONFIDENCE = 0.7;
    private static final int LARGE_BLOCK_CHARS = 20;

    private final OcrEngine engine;
    private final int minChars;
    private final double minConfidence;
    private final double resizeFactor;
    private final boolean extraHeuristics;

    public OcrTextDetector(OcrEngine engine, int minChars, double minConfidence,
                           double resizeFactor, boolean extraHeuristics) {
        this.engine = engine;
        this.minChars = minChars;
        this.minConfidence = minConfidence;
        this.resizeFactor = resizeFactor;
        this.extraHeuristics = extraHeuristics;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.OCR;
    }

    @Override
    public DetectorOutcome detect(BufferedImage image) throws DetectionException {
        BufferedImage input = resize(image);
        List<TextRegion> regions = engine.recognize(input);
        if (regions.isEmpty()) {
            return new DetectorOutcome(false, 0);
        }
        TextStats stats = TextStats.of(regions, input.getHeight());
        boolean screenshot = decide(stats);
        LOGGER.debug("OCR classification: chars={} avgConfidence={} highConfidenceRegions={} largeBlocks={} "
                        + "bottomText={} density={} screenshot={}",
                stats.totalChars(), stats.averageConfidence(), stats.highConfidenceRegions(),
                stats.largeTextBlocks(), stats.mostlyBottomText(), stats.density(), screenshot);
        return new DetectorOutcome(screenshot, stats.totalChars());
    }

    boolean decide(TextStats stats) {
        if (stats.totalChars() >= minChars && stats.averageConfidence() >= minConfidence) {
            return true;
        }
        if (!extraHeuristics) {
            return false;
        }
        boolean captionLike = stats.highConfidenceRegions() >= 2
                && stats.largeTextBlocks() >= 2
                && stats.mostlyBottomText()
                && stats.totalChars() >= 30
                && stats.density() > 10;
        if (captionLike) {
            return true;
        }
        return stats.density() > 15 && stats.averageConfidence() > 0.45 && stats.totalChars() >= 50;
    }

    private BufferedImage resize(BufferedImage image) {
        if (resizeFactor >= 1.0) {
            return image;
        }
        int width = Math.max(1, (int) Math.round(image.getWidth() * resizeFactor));
        int height = Math.max(1, (int) Math.round(image.getHeight() * resizeFactor));
        BufferedImage scaled = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = scaled.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            graphics.drawImage(image, 0, 0, width, height, null);
        } finally {
            graphics.dispose();
        }
        return scaled;
    }

    @Override
    public void close() {
        engine.close();
    }

    record TextStats(
            int regions,
            int totalChars,
            double averageConfidence,
            int highConfidenceRegions,
            int largeTextBlocks,
            boolean mostlyBottomText,
            double density
    ) {
        static TextStats of(List<TextRegion> regions, int imageHeight) {
            int totalChars = 0;
            double confidenceSum = 0;
            int highConfidence = 0;
            int largeBlocks = 0;
            int bottom = 0;
            double bottomThirdY = imageHeight * 2.0 / 3.0;
            for (TextRegion region : regions) {
                totalChars += region.length();
                confidenceSum += region.confidence();
                if (region.confidence() > HIGH_CONFIDENCE) {
                    highConfidence++;
                }
                if (region.length() > LARGE_BLOCK_CHARS) {
                    largeBlocks++;
                }
                if (region.y() > bottomThirdY) {
                    bottom++;
                }
            }
            int count = regions.size();
            return new TextStats(
                    count,
                    totalChars,
                    confidenceSum / count,
                    highConfidence,
                    largeBlocks,
                    bottom > count / 2.0,
                    totalChars / (double) count
            );
        }
    }
}
