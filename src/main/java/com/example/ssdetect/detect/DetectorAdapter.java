package com.example.ssdetect.detect;

import com.example.ssdetect.DetectionMethod;
import com.example.ssdetect.DetectionMode;
import com.example.ssdetect.DetectorConfig;
import com.example.ssdetect.ImageTask;
import org.apache.tika.Tika;

import java.awt.image.BufferedImage;
import java.time.Duration;

/**
 * Holds the loaded detectors of one worker behind a single synchronous call.
 *
 * <p>In {@link DetectionMode#BOTH} the cheap horizontal detector runs first and a positive
 * result is final; OCR only runs when it says "regular". A decode failure ends the image for
 * every mode since neither detector could read it.
 */
public final class DetectorAdapter implements AutoCloseable {
    private final DetectionMode mode;
    private final ImageDecoder decoder;
    private final Detector horizontal;
    private final Detector ocr;

    DetectorAdapter(DetectionMode mode, ImageDecoder decoder, Detector horizontal, Detector ocr) {
        this.mode = mode;
        this.decoder = decoder;
        this.horizontal = horizontal;
        this.ocr = ocr;
    }

    /**
     * Loads every detector the configured mode needs. Expensive; call once per worker.
     */
    public static DetectorAdapter initialize(DetectorConfig config, DetectorProvider provider) throws ModelLoadException {
        DetectionMode mode = config.mode();
        Detector horizontal = null;
        Detector ocr = null;
        try {
            if (mode.usesHorizontal()) {
                horizontal = provider.horizontal(config);
            }
            if (mode.usesOcr()) {
                ocr = provider.ocr(config);
            }
        } catch (ModelLoadException ex) {
            closeLoaded(horizontal);
            throw ex;
        } catch (RuntimeException ex) {
            closeLoaded(horizontal);
            throw new ModelLoadException("Detector initialization failed: " + ex.getMessage(), ex);
        }
        return new DetectorAdapter(mode, new ImageDecoder(new Tika()), horizontal, ocr);
    }

    public DetectionMode mode() {
        return mode;
    }

    public Classification classify(ImageTask task) throws ImageProcessingException {
        long started = System.nanoTime();
        try {
            BufferedImage image = decoder.decode(task.path());
            if (task.mode().usesHorizontal()) {
                DetectorOutcome edges = require(horizontal, task).detect(image);
                if (edges.screenshot() || !task.mode().usesOcr()) {
                    return new Classification(edges.screenshot(), DetectionMethod.HORIZONTAL, edges.metric(), since(started));
                }
            }
            DetectorOutcome text = require(ocr, task).detect(image);
            return new Classification(text.screenshot(), DetectionMethod.OCR, text.metric(), since(started));
        } catch (OutOfMemoryError ex) {
            throw new DetectionException("Image too large to process", ex);
        } catch (RuntimeException ex) {
            throw new DetectionException("Failed to classify: " + ex.getMessage(), ex);
        }
    }

    private Detector require(Detector detector, ImageTask task) throws DetectionException {
        if (detector == null) {
            throw new DetectionException("Mode " + task.mode() + " needs a detector this worker did not load for " + mode);
        }
        return detector;
    }

    private static void closeLoaded(Detector detector) {
        if (detector != null) {
            detector.close();
        }
    }

    private static Duration since(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    @Override
    public void close() {
        closeLoaded(horizontal);
        closeLoaded(ocr);
    }
}
