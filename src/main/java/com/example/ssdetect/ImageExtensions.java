package com.example.ssdetect;

import java.nio.file.Path;
import java.util.Set;

public final class ImageExtensions {
    public static final Set<String> SUPPORTED = Set.of(
            "jpg",
            "jpeg",
            "png",
            "bmp",
            "gif",
            "webp",
            "tiff",
            "tif",
            "heic",
            "heif",
            "avif"
    );

    private ImageExtensions() {
    }

    public static boolean isSupported(Path path) {
        return SUPPORTED.contains(FileNames.lowerExtension(path));
    }
}
