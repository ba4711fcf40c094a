package com.photonamer.model;

import java.nio.file.Path;

/**
 * Options for one rename run. A null output directory means rename in place.
 */
public class RenameRequest {
    private Path inputDir;
    private Path outputDir;
    private String prefix = "Photo";
    private int digits = 2;
    private double sameSpotMeters = 12.0;
    private String placeName;
    private int placeNameFirstN = 0;
    private Path csvOut;
    private boolean geocode = true;
    private long geocodeDelayMs = 1000;
    private boolean dryRun = false;

    public Path getInputDir() {
        return inputDir;
    }

    public void setInputDir(Path inputDir) {
        this.inputDir = inputDir;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(Path outputDir) {
        this.outputDir = outputDir;
    }

    public Path getEffectiveOutputDir() {
        return outputDir != null ? outputDir : inputDir;
    }

    public String getPrefix() {
        return prefix;
    }

    public void setPrefix(String prefix) {
        this.prefix = prefix;
    }

    public int getDigits() {
        return digits;
    }

    public void setDigits(int digits) {
        this.digits = digits;
    }

    public double getSameSpotMeters() {
        return sameSpotMeters;
    }

    public void setSameSpotMeters(double sameSpotMeters) {
        this.sameSpotMeters = sameSpotMeters;
    }

    public String getPlaceName() {
        return placeName;
    }

    public void setPlaceName(String placeName) {
        this.placeName = placeName;
    }

    public int getPlaceNameFirstN() {
        return placeNameFirstN;
    }

    public void setPlaceNameFirstN(int placeNameFirstN) {
        this.placeNameFirstN = placeNameFirstN;
    }

    public Path getCsvOut() {
        return csvOut;
    }

    public void setCsvOut(Path csvOut) {
        this.csvOut = csvOut;
    }

    public boolean isGeocode() {
        return geocode;
    }

    public void setGeocode(boolean geocode) {
        this.geocode = geocode;
    }

    public long getGeocodeDelayMs() {
        return geocodeDelayMs;
    }

    public void setGeocodeDelayMs(long geocodeDelayMs) {
        this.geocodeDelayMs = geocodeDelayMs;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public void setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
    }
}
