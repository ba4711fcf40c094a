package com.photonamer.model;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;

/**
 * Coordinates and optional capture time read from a photo's embedded metadata.
 */
public class GeoTag {
    private final double latitude;
    private final double longitude;
    private final LocalDateTime captureTime;

    public GeoTag(double latitude, double longitude, LocalDateTime captureTime) {
        this.latitude = latitude;
        this.longitude = longitude;
        this.captureTime = captureTime;
    }

    public GeoTag(double latitude, double longitude) {
        this(latitude, longitude, null);
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    public Optional<LocalDateTime> getCaptureTime() {
        return Optional.ofNullable(captureTime);
    }

    @Override
    public String toString() {
        if (captureTime != null) {
            return String.format(Locale.ROOT, "(%.6f, %.6f @ %s)", latitude, longitude, captureTime);
        }
        return String.format(Locale.ROOT, "(%.6f, %.6f)", latitude, longitude);
    }
}
