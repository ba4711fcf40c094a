package com.photonamer.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.photonamer.exception.PhotoRenameException;
import com.photonamer.model.LocationGroup;
import com.photonamer.model.PhotoRecord;
import com.photonamer.model.RenameRequest;
import com.photonamer.service.RecordBuilder.RecordScan;

/**
 * Runs the full pipeline: scan, cluster, geocode, plan names, rename, report.
 */
@Service
public class PhotoRenameService {

    public static class RenameResult {
        private final List<PhotoRecord> records;
        private final int photosScanned;
        private final int skippedWithoutGeo;
        private final int groupsFormed;
        private final int groupsGeocoded;
        private final boolean geocodingEnabled;
        private final boolean dryRun;
        private final boolean inPlace;
        private final Path reportPath;

        public RenameResult(List<PhotoRecord> records, int photosScanned, int skippedWithoutGeo,
                            int groupsFormed, int groupsGeocoded, boolean geocodingEnabled,
                            boolean dryRun, boolean inPlace, Path reportPath) {
            this.records = records;
            this.photosScanned = photosScanned;
            this.skippedWithoutGeo = skippedWithoutGeo;
            this.groupsFormed = groupsFormed;
            this.groupsGeocoded = groupsGeocoded;
            this.geocodingEnabled = geocodingEnabled;
            this.dryRun = dryRun;
            this.inPlace = inPlace;
            this.reportPath = reportPath;
        }

        public List<PhotoRecord> getRecords() { return records; }
        public int getPhotosScanned() { return photosScanned; }
        public int getSkippedWithoutGeo() { return skippedWithoutGeo; }
        public int getPhotosConsidered() { return records.size(); }
        public int getGroupsFormed() { return groupsFormed; }
        public int getGroupsGeocoded() { return groupsGeocoded; }
        public boolean isGeocodingEnabled() { return geocodingEnabled; }
        public boolean isDryRun() { return dryRun; }
        public boolean isInPlace() { return inPlace; }
        public Path getReportPath() { return reportPath; }
    }

    private static final Logger log = LoggerFactory.getLogger(PhotoRenameService.class);

    private final RecordBuilder recordBuilder;
    private final LocationClusterer locationClusterer;
    private final PlaceResolver placeResolver;
    private final NamePlanner namePlanner;
    private final AtomicRenamer atomicRenamer;
    private final ReportWriter reportWriter;

    public PhotoRenameService(RecordBuilder recordBuilder, LocationClusterer locationClusterer,
                              PlaceResolver placeResolver, NamePlanner namePlanner,
                              AtomicRenamer atomicRenamer, ReportWriter reportWriter) {
        this.recordBuilder = recordBuilder;
        this.locationClusterer = locationClusterer;
        this.placeResolver = placeResolver;
        this.namePlanner = namePlanner;
        this.atomicRenamer = atomicRenamer;
        this.reportWriter = reportWriter;
    }

    public RenameResult rename(RenameRequest request) throws IOException {
        Path inputDir = request.getInputDir();
        if (inputDir == null || !Files.isDirectory(inputDir)) {
            throw new PhotoRenameException("Input directory does not exist: " + inputDir);
        }
        Path outputDir = request.getEffectiveOutputDir();

        RecordScan scan = recordBuilder.buildRecords(inputDir);
        List<PhotoRecord> records = scan.getRecords();
        if (records.isEmpty()) {
            throw new PhotoRenameException("No JPG/JPEG files with GPS EXIF metadata found in " + inputDir);
        }

        List<LocationGroup> groups = locationClusterer.assignLocationGroups(records, request.getSameSpotMeters());

        int geocoded = 0;
        if (request.isGeocode()) {
            geocoded = placeResolver.resolvePlaces(groups, request.getGeocodeDelayMs());
        } else {
            placeResolver.assignUnknownPlaces(groups);
        }
        placeResolver.applyForcedPlace(records, request.getPlaceName(), request.getPlaceNameFirstN());

        namePlanner.planNames(records, outputDir, request.getPrefix(), request.getDigits());

        boolean inPlace = atomicRenamer.isInPlace(records, outputDir);
        if (request.isDryRun()) {
            log.info("Dry run: planned {} names, no files moved", records.size());
        } else {
            inPlace = atomicRenamer.renameAll(records, outputDir);
        }

        if (request.getCsvOut() != null) {
            reportWriter.writeCsv(records, request.getCsvOut());
        }

        return new RenameResult(records, scan.getPhotosScanned(), scan.getSkippedWithoutGeo(), groups.size(),
                geocoded, request.isGeocode(), request.isDryRun(), inPlace, request.getCsvOut());
    }
}
