package com.photonamer.service;

import java.nio.file.Path;
import java.util.Optional;

import com.photonamer.model.GeoTag;

/**
 * Reads coordinates and capture time from a photo. Implementations fail soft:
 * unreadable or untagged files yield an empty result, never an exception.
 */
public interface GeoTagReader {

    Optional<GeoTag> read(Path photo);
}
