package com.example.ssdetect;

import java.nio.file.Path;
import java.util.Locale;

final class FileNames {
    private FileNames() {
    }

    /**
     * Name without its last extension; a leading dot does not start an extension.
     */
    static String stem(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * Last extension including the dot, or an empty string.
     */
    static String extension(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot) : "";
    }

    static String lowerExtension(Path path) {
        String extension = extension(path.getFileName().toString());
        return extension.isEmpty() ? "" : extension.substring(1).toLowerCase(Locale.ROOT);
    }
}
