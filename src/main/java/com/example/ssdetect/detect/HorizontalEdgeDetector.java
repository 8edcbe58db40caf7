package com.example.ssdetect.detect;

import com.example.ssdetect.DetectionMethod;

import java.awt.image.BufferedImage;

/**
 * Flags images that contain long, perfectly uniform horizontal edges, which UI chrome
 * (title bars, toolbars, table rules) produces and photographs almost never do.
 *
 * <p>The grayscale image is convolved with a vertical-gradient kernel
 * {@code [[-1,-1,-1],[0,0,0],[1,1,1]]} using mirrored borders, scaled to integer levels
 * 0..10, and each row is searched for a run of one non-zero level spanning at least
 * {@code minRunFraction} of the width.
 */
public class HorizontalEdgeDetector implements Detector {
    static final int LEVELS = 10;
    static final double DEFAULT_MIN_RUN_FRACTION = 0.5;

    private final double minRunFraction;

    public HorizontalEdgeDetector() {
        this(DEFAULT_MIN_RUN_FRACTION);
    }

    public HorizontalEdgeDetector(double minRunFraction) {
        if (minRunFraction <= 0.0 || minRunFraction > 1.0) {
            throw new IllegalArgumentException("minRunFraction must be in (0, 1]");
        }
        this.minRunFraction = minRunFraction;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.HORIZONTAL;
    }

    @Override
    public DetectorOutcome detect(BufferedImage image) throws DetectionException {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] gray = toGray(image);
        int[] edges = new int[width * height];
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (int y = 0; y < height; y++) {
            int above = mirror(y - 1, height);
            int below = mirror(y + 1, height);
            for (int x = 0; x < width; x++) {
                int value = Math.abs(rowSum(gray, width, below, x) - rowSum(gray, width, above, x));
                edges[y * width + x] = value;
                min = Math.min(min, value);
                max = Math.max(max, value);
            }
        }
        int lines = countLines(edges, width, height, min, max);
        return new DetectorOutcome(lines >= 1, lines);
    }

    int countLines(int[] edges, int width, int height, int min, int max) {
        if (min == max) {
            return 0;
        }
        int required = Math.max(1, (int) Math.ceil(width * minRunFraction));
        double range = max - min;
        int lines = 0;
        for (int y = 0; y < height; y++) {
            int runLevel = -1;
            int runLength = 0;
            boolean found = false;
            for (int x = 0; x < width && !found; x++) {
                int level = (int) ((edges[y * width + x] - min) * LEVELS / range);
                if (level != 0 && level == runLevel) {
                    runLength++;
                } else {
                    runLevel = level;
                    runLength = level == 0 ? 0 : 1;
                }
                found = runLength >= required;
            }
            if (found) {
                lines++;
            }
        }
        return lines;
    }

    private static int rowSum(int[] gray, int width, int row, int x) {
        int offset = row * width;
        return gray[offset + mirror(x - 1, width)] + gray[offset + x] + gray[offset + mirror(x + 1, width)];
    }

    // Symmetric boundary: index -1 maps to 0 and index n maps to n - 1.
    private static int mirror(int index, int size) {
        if (index < 0) {
            return 0;
        }
        if (index >= size) {
            return size - 1;
        }
        return index;
    }

    private static int[] toGray(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] gray = new int[width * height];
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            image.getRGB(0, y, width, 1, row, 0, width);
            for (int x = 0; x < width; x++) {
                int rgb = row[x];
                int r = (rgb >> 16) & 0xFF;
                int g = (rgb >> 8) & 0xFF;
                int b = rgb & 0xFF;
                gray[y * width + x] = (r * 299 + g * 587 + b * 114) / 1000;
            }
        }
        return gray;
    }
}
