package com.photonamer.service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.lang.GeoLocation;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.exif.GpsDirectory;
import com.photonamer.model.GeoTag;
import com.photonamer.util.GeoUtils;

@Component
public class ExifGeoTagReader implements GeoTagReader {

    private static final Logger log = LoggerFactory.getLogger(ExifGeoTagReader.class);

    private static final DateTimeFormatter EXIF_DATE_TIME = DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss");

    @Override
    public Optional<GeoTag> read(Path photo) {
        Metadata metadata;
        try {
            metadata = ImageMetadataReader.readMetadata(photo.toFile());
        } catch (ImageProcessingException | IOException | RuntimeException e) {
            log.debug("Failed to read metadata from {}: {}", photo.getFileName(), e.getMessage());
            return Optional.empty();
        }

        GpsDirectory gps = metadata.getFirstDirectoryOfType(GpsDirectory.class);
        GeoLocation location = gps != null ? gps.getGeoLocation() : null;
        if (location == null) {
            log.debug("No GPS coordinates in {}", photo.getFileName());
            return Optional.empty();
        }
        double lat = location.getLatitude();
        double lng = location.getLongitude();
        if (Double.isNaN(lat) || Double.isNaN(lng) || !GeoUtils.isValidCoordinate(lat, lng)) {
            log.debug("Ignoring out-of-range coordinates ({}, {}) in {}", lat, lng, photo.getFileName());
            return Optional.empty();
        }

        return Optional.of(new GeoTag(lat, lng, readCaptureTime(metadata, photo)));
    }

    private LocalDateTime readCaptureTime(Metadata metadata, Path photo) {
        ExifSubIFDDirectory exif = metadata.getFirstDirectoryOfType(ExifSubIFDDirectory.class);
        if (exif == null) {
            return null;
        }
        String value = exif.getString(ExifSubIFDDirectory.TAG_DATETIME_ORIGINAL);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value.trim(), EXIF_DATE_TIME);
        } catch (DateTimeParseException e) {
            log.debug("Unparsable DateTimeOriginal '{}' in {}", value, photo.getFileName());
            return null;
        }
    }
}
