package com.example.ssdetect.detect;

import com.sun.jna.Pointer;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.ITessAPI.TessBaseAPI;
import net.sourceforge.tess4j.ITessAPI.TessPageIterator;
import net.sourceforge.tess4j.ITessAPI.TessResultIterator;
import net.sourceforge.tess4j.TessAPI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.nio.ByteBuffer;
import java.nio.IntBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Tesseract engine bound to one native {@code TessBaseAPI} handle. The trained data is loaded
 * once in {@link #open(Path, String)} and reused for every image until {@link #close()}, so an
 * instance must stay confined to a single worker thread.
 */
public final class TesseractOcrEngine implements OcrEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(TesseractOcrEngine.class);
    private static final int LEVEL = ITessAPI.TessPageIteratorLevel.RIL_TEXTLINE;

    private final TessAPI api;
    private TessBaseAPI handle;

    private TesseractOcrEngine(TessAPI api, TessBaseAPI handle) {
        this.api = api;
        this.handle = handle;
    }

    public static TesseractOcrEngine open(Path tessdata, String language) throws ModelLoadException {
        for (String part : language.split("\\+")) {
            Path model = tessdata.resolve(part + ".traineddata");
            if (!Files.isRegularFile(model)) {
                throw new ModelLoadException("Missing Tesseract model " + model.toAbsolutePath());
            }
        }
        TessAPI api;
        try {
            api = TessAPI.INSTANCE;
        } catch (LinkageError ex) {
            throw new ModelLoadException("Tesseract native library is not available: " + ex.getMessage(), ex);
        }
        TessBaseAPI handle = api.TessBaseAPICreate();
        int status = api.TessBaseAPIInit3(handle, tessdata.toAbsolutePath().toString(), language);
        if (status != 0) {
            api.TessBaseAPIDelete(handle);
            throw new ModelLoadException("Tesseract failed to initialize language '" + language
                    + "' from " + tessdata.toAbsolutePath() + " (status " + status + ")");
        }
        LOGGER.debug("Loaded Tesseract language {} from {}", language, tessdata);
        return new TesseractOcrEngine(api, handle);
    }

    @Override
    public List<TextRegion> recognize(BufferedImage image) throws DetectionException {
        if (handle == null) {
            throw new DetectionException("OCR engine is closed");
        }
        BufferedImage gray = toGray(image);
        byte[] pixels = ((DataBufferByte) gray.getRaster().getDataBuffer()).getData();
        ByteBuffer buffer = ByteBuffer.allocateDirect(pixels.length);
        buffer.put(pixels).flip();
        try {
            api.TessBaseAPISetImage(handle, buffer, gray.getWidth(), gray.getHeight(), 1, gray.getWidth());
            if (api.TessBaseAPIRecognize(handle, null) != 0) {
                throw new DetectionException("Tesseract recognition failed");
            }
            return collectRegions();
        } finally {
            api.TessBaseAPIClear(handle);
        }
    }

    private List<TextRegion> collectRegions() {
        List<TextRegion> regions = new ArrayList<>();
        TessResultIterator results = api.TessBaseAPIGetIterator(handle);
        if (results == null) {
            return regions;
        }
        try {
            TessPageIterator page = api.TessResultIteratorGetPageIterator(results);
            api.TessPageIteratorBegin(page);
            do {
                Pointer textPointer = api.TessResultIteratorGetUTF8Text(results, LEVEL);
                if (textPointer == null) {
                    continue;
                }
                String text = textPointer.getString(0, "UTF-8").strip();
                api.TessDeleteText(textPointer);
                if (text.isEmpty()) {
                    continue;
                }
                float confidence = api.TessResultIteratorConfidence(results, LEVEL);
                IntBuffer left = IntBuffer.allocate(1);
                IntBuffer top = IntBuffer.allocate(1);
                IntBuffer right = IntBuffer.allocate(1);
                IntBuffer bottom = IntBuffer.allocate(1);
                api.TessPageIteratorBoundingBox(page, LEVEL, left, top, right, bottom);
                regions.add(new TextRegion(
                        text,
                        Math.max(0.0, Math.min(1.0, confidence / 100.0)),
                        left.get(0),
                        top.get(0),
                        right.get(0) - left.get(0),
                        bottom.get(0) - top.get(0)
                ));
            } while (api.TessPageIteratorNext(page, LEVEL) == ITessAPI.TRUE);
        } finally {
            api.TessResultIteratorDelete(results);
        }
        return regions;
    }

    // Always redrawn so the raster is tightly packed at one byte per pixel.
    private static BufferedImage toGray(BufferedImage image) {
        BufferedImage gray = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D graphics = gray.createGraphics();
        try {
            graphics.drawImage(image, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        return gray;
    }

    @Override
    public void close() {
        if (handle == null) {
            return;
        }
        api.TessBaseAPIEnd(handle);
        api.TessBaseAPIDelete(handle);
        handle = null;
    }
}
