package com.example.ssdetect;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

public final class TestImages {
    private TestImages() {
    }

    public static BufferedImage blank(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = image.createGraphics();
        try {
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, width, height);
        } finally {
            graphics.dispose();
        }
        return image;
    }

    /**
     * White image with a black horizontal segment on row {@code y} from {@code fromX} to {@code toX} inclusive.
     */
    public static BufferedImage withLine(int width, int height, int y, int fromX, int toX) {
        BufferedImage image = blank(width, height);
        for (int x = fromX; x <= toX; x++) {
            image.setRGB(x, y, Color.BLACK.getRGB());
        }
        return image;
    }

    public static Path screenshot(Path file) throws IOException {
        return write(withLine(100, 100, 50, 0, 99), file);
    }

    public static Path photo(Path file) throws IOException {
        return write(blank(100, 100), file);
    }

    public static Path write(BufferedImage image, Path file) throws IOException {
        ImageIO.write(image, "png", file.toFile());
        return file;
    }
}
