package com.example.ssdetect.detect;

import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Sniffs the real content type with Tika before handing the bytes to ImageIO, so that
 * renamed non-image files fail as decode errors instead of surfacing as detector noise.
 */
public class ImageDecoder {
    private final Tika tika;

    public ImageDecoder(Tika tika) {
        this.tika = tika;
    }

    public BufferedImage decode(Path path) throws DecodeException {
        MediaType mediaType = detectMediaType(path);
        if (mediaType != null && !"image".equals(mediaType.getType())
                && !MediaType.OCTET_STREAM.equals(mediaType)) {
            throw new DecodeException("Not an image: detected " + mediaType);
        }
        BufferedImage image;
        try (var input = Files.newInputStream(path)) {
            image = ImageIO.read(input);
        } catch (IOException ex) {
            throw new DecodeException("Failed to open image: " + ex.getMessage(), ex);
        }
        if (image == null) {
            String type = mediaType == null ? "unknown" : mediaType.toString();
            throw new DecodeException("Unsupported image format: " + type);
        }
        if (image.getWidth() == 0 || image.getHeight() == 0) {
            throw new DecodeException("Image has no pixels");
        }
        return image;
    }

    private MediaType detectMediaType(Path path) throws DecodeException {
        try {
            return MediaType.parse(tika.detect(path));
        } catch (IOException ex) {
            throw new DecodeException("Failed to read " + path.getFileName() + ": " + ex.getMessage(), ex);
        }
    }
}
