package com.photonamer.util;

import java.nio.file.Path;
import java.util.Locale;

public final class FileNames {

    private FileNames() {
    }

    public static String stem(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /**
     * Extension including the leading dot, lowercased; empty when there is none.
     */
    public static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(dot).toLowerCase(Locale.ROOT) : "";
    }

    public static String extension(Path path) {
        return extension(path.getFileName().toString());
    }
}
