package com.photonamer.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.photonamer.model.GeoTag;
import com.photonamer.model.PhotoRecord;
import com.photonamer.util.FileNames;

/**
 * Scans a directory for photos and builds the ordered record list the rest of
 * the pipeline depends on.
 */
@Service
public class RecordBuilder {

    public static class RecordScan {
        private final List<PhotoRecord> records;
        private final int photosScanned;
        private final int skippedWithoutGeo;

        public RecordScan(List<PhotoRecord> records, int photosScanned, int skippedWithoutGeo) {
            this.records = records;
            this.photosScanned = photosScanned;
            this.skippedWithoutGeo = skippedWithoutGeo;
        }

        public List<PhotoRecord> getRecords() { return records; }
        public int getPhotosScanned() { return photosScanned; }
        public int getSkippedWithoutGeo() { return skippedWithoutGeo; }
    }

    static final Set<String> PHOTO_EXTENSIONS = Set.of(".jpg", ".jpeg");

    /**
     * Capture order: timestamped photos first by time then name, untimed photos
     * after them by name.
     */
    static final Comparator<PhotoRecord> CAPTURE_ORDER = Comparator
            .comparing((PhotoRecord r) -> r.getCaptureTime().orElse(LocalDateTime.MAX))
            .thenComparing(PhotoRecord::getOriginalName);

    private static final Logger log = LoggerFactory.getLogger(RecordBuilder.class);

    private final GeoTagReader geoTagReader;

    public RecordBuilder(GeoTagReader geoTagReader) {
        this.geoTagReader = geoTagReader;
    }

    public RecordScan buildRecords(Path inputDir) throws IOException {
        List<Path> photos = listPhotos(inputDir);
        List<PhotoRecord> records = new ArrayList<>();
        int missingGeo = 0;

        for (Path photo : photos) {
            Optional<GeoTag> geoTag = geoTagReader.read(photo);
            if (geoTag.isEmpty()) {
                missingGeo++;
                continue;
            }
            records.add(new PhotoRecord(photo, geoTag.get()));
        }

        records.sort(CAPTURE_ORDER);
        log.info("Scanned {} photos in {}: {} geotagged, {} without GPS",
                photos.size(), inputDir, records.size(), missingGeo);
        return new RecordScan(records, photos.size(), missingGeo);
    }

    private List<Path> listPhotos(Path inputDir) throws IOException {
        try (Stream<Path> entries = Files.list(inputDir)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(p -> PHOTO_EXTENSIONS.contains(FileNames.extension(p)))
                    .sorted(Comparator.comparing((Path p) -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        }
    }
}
