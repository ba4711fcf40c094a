package com.photonamer;

import java.nio.file.Path;
import java.util.List;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import com.photonamer.config.AppProperties;
import com.photonamer.exception.PhotoRenameException;
import com.photonamer.model.RenameRequest;
import com.photonamer.service.PhotoRenameService;
import com.photonamer.service.PhotoRenameService.RenameResult;

/**
 * Command-line entry point that renames a folder of geotagged photos and writes
 * the CSV index.
 *
 * Run with: java -jar photo-namer.jar --rename --input-dir=Leppävaara_photos --prefix=Leppävaara
 *
 * Options (defaults come from photonamer.* in application.yml):
 * --output-dir, --place-name, --place-name-first-n, --digits, --same-spot-m,
 * --csv-out, --geocode-delay-ms, --no-geocode, --dry-run
 */
@Component
public class RenamePhotosRunner implements ApplicationRunner {

    private final PhotoRenameService photoRenameService;
    private final AppProperties appProperties;

    public RenamePhotosRunner(PhotoRenameService photoRenameService, AppProperties appProperties) {
        this.photoRenameService = photoRenameService;
        this.appProperties = appProperties;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        // Only act when explicitly asked to
        if (!args.containsOption("rename")) {
            return;
        }

        RenameRequest request = buildRequest(args);

        System.out.println();
        System.out.println("╔══════════════════════════════════════════════════════════════════╗");
        System.out.println("║           📷 GEOTAGGED PHOTO RENAMER                             ║");
        System.out.println("╚══════════════════════════════════════════════════════════════════╝");
        System.out.println("   • Input:  " + request.getInputDir());
        System.out.println("   • Output: " + request.getEffectiveOutputDir());
        System.out.println("   • Prefix: " + request.getPrefix() + " (same spot <= " + request.getSameSpotMeters() + " m)");
        System.out.println();

        RenameResult result = photoRenameService.rename(request);
        printSummary(result);
    }

    RenameRequest buildRequest(ApplicationArguments args) {
        AppProperties.Rename defaults = appProperties.getRename();
        AppProperties.Geocode geocode = appProperties.getGeocode();

        String inputDir = option(args, "input-dir");
        if (inputDir == null) {
            throw new PhotoRenameException("--input-dir is required");
        }

        RenameRequest request = new RenameRequest();
        request.setInputDir(Path.of(inputDir));
        String outputDir = option(args, "output-dir");
        request.setOutputDir(outputDir != null ? Path.of(outputDir) : null);
        request.setPrefix(optionOrDefault(args, "prefix", defaults.getPrefix()));
        request.setDigits(parseInt(args, "digits", defaults.getDigits()));
        request.setSameSpotMeters(parseDouble(args, "same-spot-m", defaults.getSameSpotMeters()));
        request.setPlaceName(option(args, "place-name"));
        request.setPlaceNameFirstN(parseInt(args, "place-name-first-n", 0));
        String csvOut = optionOrDefault(args, "csv-out", defaults.getCsvOut());
        request.setCsvOut(csvOut != null && !csvOut.isBlank() ? Path.of(csvOut) : null);
        request.setGeocode(geocode.isEnabled() && !args.containsOption("no-geocode"));
        request.setGeocodeDelayMs(parseLong(args, "geocode-delay-ms", geocode.getDelayMs()));
        request.setDryRun(args.containsOption("dry-run"));
        return request;
    }

    private void printSummary(RenameResult result) {
        System.out.println();
        System.out.println("📊 Summary:");
        System.out.println("   • Processed photos: " + result.getPhotosConsidered());
        System.out.println("   • Skipped (missing GPS): " + result.getSkippedWithoutGeo());
        System.out.println("   • Locations: " + result.getGroupsFormed());
        if (result.getReportPath() != null) {
            System.out.println("   • CSV written: " + result.getReportPath());
        }
        if (result.isGeocodingEnabled()) {
            System.out.println("   • Geocoded groups: " + result.getGroupsGeocoded() + "/" + result.getGroupsFormed());
        }
        String mode = result.isDryRun() ? "DRY RUN (no renaming)" : "RENAMED" + (result.isInPlace() ? " (in place)" : "");
        System.out.println("   • Mode: " + mode);
        System.out.println();
    }

    private String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        // last one wins, like most CLIs
        return values.get(values.size() - 1);
    }

    private String optionOrDefault(ApplicationArguments args, String name, String defaultValue) {
        String value = option(args, name);
        return value != null ? value : defaultValue;
    }

    private int parseInt(ApplicationArguments args, String name, int defaultValue) {
        String value = option(args, name);
        try {
            return value != null ? Integer.parseInt(value.trim()) : defaultValue;
        } catch (NumberFormatException e) {
            throw new PhotoRenameException("--" + name + " expects an integer, got '" + value + "'", e);
        }
    }

    private long parseLong(ApplicationArguments args, String name, long defaultValue) {
        String value = option(args, name);
        try {
            return value != null ? Long.parseLong(value.trim()) : defaultValue;
        } catch (NumberFormatException e) {
            throw new PhotoRenameException("--" + name + " expects an integer, got '" + value + "'", e);
        }
    }

    private double parseDouble(ApplicationArguments args, String name, double defaultValue) {
        String value = option(args, name);
        try {
            return value != null ? Double.parseDouble(value.trim()) : defaultValue;
        } catch (NumberFormatException e) {
            throw new PhotoRenameException("--" + name + " expects a number, got '" + value + "'", e);
        }
    }
}
