package com.photonamer.model;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;

/**
 * One geotagged photo moving through the rename pipeline. Each stage fills its
 * own fields; only {@code sourcePath} changes after naming, as files are moved.
 */
public class PhotoRecord {
    public static final int UNASSIGNED = -1;

    private Path sourcePath;
    private final String originalName;
    private final LocalDateTime captureTime;
    private final double latitude;
    private final double longitude;

    private String address = "";
    private String placeSlug = "";
    private int locationGroupId = UNASSIGNED;
    private int locationSequence = UNASSIGNED;
    private int duplicateIndex = 0;
    private String newName = "";

    public PhotoRecord(Path sourcePath, GeoTag geoTag) {
        this(sourcePath, geoTag.getLatitude(), geoTag.getLongitude(), geoTag.getCaptureTime().orElse(null));
    }

    public PhotoRecord(Path sourcePath, double latitude, double longitude, LocalDateTime captureTime) {
        this.sourcePath = sourcePath;
        this.originalName = sourcePath.getFileName().toString();
        this.latitude = latitude;
        this.longitude = longitude;
        this.captureTime = captureTime;
    }

    public Path getSourcePath() {
        return sourcePath;
    }

    public void setSourcePath(Path sourcePath) {
        this.sourcePath = sourcePath;
    }

    public String getOriginalName() {
        return originalName;
    }

    public Optional<LocalDateTime> getCaptureTime() {
        return Optional.ofNullable(captureTime);
    }

    public boolean hasCaptureTime() {
        return captureTime != null;
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public String getPlaceSlug() {
        return placeSlug;
    }

    public void setPlaceSlug(String placeSlug) {
        this.placeSlug = placeSlug;
    }

    public int getLocationGroupId() {
        return locationGroupId;
    }

    public void setLocationGroupId(int locationGroupId) {
        this.locationGroupId = locationGroupId;
    }

    public int getLocationSequence() {
        return locationSequence;
    }

    public void setLocationSequence(int locationSequence) {
        this.locationSequence = locationSequence;
    }

    public int getDuplicateIndex() {
        return duplicateIndex;
    }

    public void setDuplicateIndex(int duplicateIndex) {
        this.duplicateIndex = duplicateIndex;
    }

    public String getNewName() {
        return newName;
    }

    public void setNewName(String newName) {
        this.newName = newName;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s (%.6f, %.6f) group=%d seq=%d dup=%d -> %s",
                originalName, latitude, longitude, locationGroupId, locationSequence, duplicateIndex,
                newName.isEmpty() ? "?" : newName);
    }
}
