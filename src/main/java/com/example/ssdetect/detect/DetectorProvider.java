package com.example.ssdetect.detect;

import com.example.ssdetect.DetectorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Loads the detector models a worker needs. Called once per worker lifetime.
 */
public interface DetectorProvider {
    Detector horizontal(DetectorConfig config) throws ModelLoadException;

    Detector ocr(DetectorConfig config) throws ModelLoadException;

    /**
     * Production provider: the in-process edge detector and Tesseract for OCR.
     */
    static DetectorProvider defaults() {
        return new DetectorProvider() {
            private final Logger logger = LoggerFactory.getLogger(DetectorProvider.class);

            @Override
            public Detector horizontal(DetectorConfig config) {
                return new HorizontalEdgeDetector();
            }

            @Override
            public Detector ocr(DetectorConfig config) throws ModelLoadException {
                if (config.gpuEnabled()) {
                    logger.info("GPU acceleration requested but Tesseract runs on CPU only; using CPU");
                }
                Path tessdata = config.tessdataPath()
                        .or(() -> Optional.ofNullable(System.getenv("TESSDATA_PREFIX")).map(Path::of))
                        .orElse(Path.of("tessdata"));
                OcrEngine engine = TesseractOcrEngine.open(tessdata, config.ocrLanguage());
                return new OcrTextDetector(
                        engine,
                        config.ocrMinChars(),
                        config.ocrMinConfidence(),
                        config.ocrResizeFactor(),
                        config.extraHeuristics()
                );
            }
        };
    }
}
