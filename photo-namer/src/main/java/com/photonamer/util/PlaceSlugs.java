package com.photonamer.util;

import java.text.Normalizer;
import java.util.Locale;

public final class PlaceSlugs {

    public static final String UNKNOWN_PLACE = "unknown_place";

    private PlaceSlugs() {
    }

    /**
     * Turns a free-text place name into a filesystem-safe slug. Unicode letters
     * are kept, so "Hatsinanpuisto Länsi" becomes "hatsinanpuisto_länsi".
     */
    public static String slugify(String text) {
        if (text == null) {
            return UNKNOWN_PLACE;
        }
        String slug = Normalizer.normalize(text.strip().toLowerCase(Locale.ROOT), Normalizer.Form.NFC)
                .replaceAll("\\s+", "_")
                .replaceAll("[^\\p{L}\\p{N}_]+", "_")
                .replaceAll("_+", "_")
                .replaceAll("^_|_$", "");
        return slug.isEmpty() ? UNKNOWN_PLACE : slug;
    }

    public static boolean isUnknown(String slug) {
        return slug == null || UNKNOWN_PLACE.equals(slug);
    }
}
