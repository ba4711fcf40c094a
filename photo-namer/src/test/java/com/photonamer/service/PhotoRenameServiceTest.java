package com.photonamer.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.photonamer.exception.PhotoRenameException;
import com.photonamer.model.GeoTag;
import com.photonamer.model.GeocodeResult;
import com.photonamer.model.PhotoRecord;
import com.photonamer.model.RenameRequest;
import com.photonamer.service.PhotoRenameService.RenameResult;

import static com.photonamer.service.ContentKeyedGeoTagReader.writePhoto;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PhotoRenameServiceTest {

    private static final LocalDateTime MORNING = LocalDateTime.of(2024, 6, 1, 10, 0);

    private static final GeoTag SENATE_SQUARE = new GeoTag(60.1699, 24.9384);
    private static final GeoTag KALLIO = new GeoTag(60.1800, 24.9500);

    @TempDir
    Path root;

    private Path input;
    private ContentKeyedGeoTagReader geoTagReader;
    private ReverseGeocoder geocoder;
    private PhotoRenameService service;

    @BeforeEach
    void setUp() throws IOException {
        input = Files.createDirectories(root.resolve("photos"));
        geoTagReader = new ContentKeyedGeoTagReader();
        geocoder = mock(ReverseGeocoder.class);
        when(geocoder.reverseGeocode(eq(60.1699), anyDouble()))
                .thenReturn(new GeocodeResult("Senaatintori, Helsinki, Finland", "senaatintori"));
        when(geocoder.reverseGeocode(eq(60.18), anyDouble()))
                .thenReturn(new GeocodeResult("Fleminginkatu, Kallio, Helsinki", "fleminginkatu"));

        service = new PhotoRenameService(new RecordBuilder(geoTagReader), new LocationClusterer(),
                new PlaceResolver(geocoder), new NamePlanner(), new AtomicRenamer(), new ReportWriter());
    }

    private RenameRequest request() {
        RenameRequest request = new RenameRequest();
        request.setInputDir(input);
        request.setPrefix("Prefix");
        request.setDigits(2);
        request.setSameSpotMeters(LocationClusterer.DEFAULT_SAME_SPOT_METERS);
        request.setGeocode(true);
        request.setGeocodeDelayMs(0);
        return request;
    }

    private static String content(Path dir, String name) throws IOException {
        return Files.readString(dir.resolve(name)).trim();
    }

    private static List<String> listNames(Path dir) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }

    @Test
    void renamesNearbyPhotosIntoOneLocationOrderedByCaptureTime() throws IOException {
        // IMG_A sorts first by name but was taken after IMG_B
        geoTagReader
                .tag("a", new GeoTag(60.1699, 24.9385, MORNING.plusMinutes(5)))
                .tag("b", new GeoTag(60.1699, 24.9384, MORNING))
                .tag("c", new GeoTag(60.1800, 24.9500, MORNING.plusMinutes(10)));
        writePhoto(input, "IMG_A.jpg", "a");
        writePhoto(input, "IMG_B.jpg", "b");
        writePhoto(input, "IMG_C.jpg", "c");

        RenameResult result = service.rename(request());

        assertThat(listNames(input))
                .containsExactly("Prefix_01-1_senaatintori.jpg", "Prefix_01_senaatintori.jpg", "Prefix_02_fleminginkatu.jpg");
        assertThat(content(input, "Prefix_01_senaatintori.jpg")).isEqualTo("b");
        assertThat(content(input, "Prefix_01-1_senaatintori.jpg")).isEqualTo("a");
        assertThat(content(input, "Prefix_02_fleminginkatu.jpg")).isEqualTo("c");

        assertThat(result.getGroupsFormed()).isEqualTo(2);
        assertThat(result.getGroupsGeocoded()).isEqualTo(2);
        assertThat(result.getPhotosConsidered()).isEqualTo(3);
        assertThat(result.isInPlace()).isTrue();
        assertThat(result.isDryRun()).isFalse();
    }

    @Test
    void fallsBackToUnknownPlaceWhenGeocodingFails() throws IOException {
        when(geocoder.reverseGeocode(eq(60.18), anyDouble())).thenThrow(new IllegalStateException("HTTP 503"));
        geoTagReader.tag("b", SENATE_SQUARE).tag("c", KALLIO);
        writePhoto(input, "IMG_B.jpg", "b");
        writePhoto(input, "IMG_C.jpg", "c");

        RenameResult result = service.rename(request());

        assertThat(listNames(input)).containsExactly("Prefix_01_senaatintori.jpg", "Prefix_02_unknown_place.jpg");
        assertThat(result.getGroupsGeocoded()).isEqualTo(1);
    }

    @Test
    void skipsGeocoderWhenDisabled() throws IOException {
        geoTagReader.tag("b", SENATE_SQUARE);
        writePhoto(input, "IMG_B.jpg", "b");
        RenameRequest request = request();
        request.setGeocode(false);

        RenameResult result = service.rename(request);

        assertThat(listNames(input)).containsExactly("Prefix_01_unknown_place.jpg");
        assertThat(result.isGeocodingEnabled()).isFalse();
        verify(geocoder, never()).reverseGeocode(anyDouble(), anyDouble());
    }

    @Test
    void dryRunPlansNamesWithoutTouchingFiles() throws IOException {
        geoTagReader.tag("b", SENATE_SQUARE);
        writePhoto(input, "IMG_B.jpg", "b");
        Path output = root.resolve("renamed");
        RenameRequest request = request();
        request.setOutputDir(output);
        request.setDryRun(true);
        request.setCsvOut(root.resolve("index.csv"));

        RenameResult result = service.rename(request);

        assertThat(listNames(input)).containsExactly("IMG_B.jpg");
        assertThat(output).doesNotExist();
        assertThat(result.getRecords()).extracting(PhotoRecord::getNewName)
                .containsExactly("Prefix_01_senaatintori.jpg");
        assertThat(result.isDryRun()).isTrue();
        assertThat(root.resolve("index.csv")).exists();
    }

    @Test
    void movesIntoSeparateOutputDirectoryAndWritesReport() throws IOException {
        geoTagReader.tag("b", SENATE_SQUARE).tag("c", KALLIO);
        writePhoto(input, "IMG_B.jpg", "b");
        writePhoto(input, "IMG_C.jpg", "c");
        Path output = root.resolve("renamed");
        Path csv = root.resolve("Data/photo_index.csv");
        RenameRequest request = request();
        request.setOutputDir(output);
        request.setCsvOut(csv);

        RenameResult result = service.rename(request);

        assertThat(listNames(output)).containsExactly("Prefix_01_senaatintori.jpg", "Prefix_02_fleminginkatu.jpg");
        assertThat(listNames(input)).isEmpty();
        assertThat(result.isInPlace()).isFalse();
        assertThat(result.getReportPath()).isEqualTo(csv);
        assertThat(Files.readAllLines(csv)).hasSize(3);
        assertThat(Files.readString(csv)).contains(output.resolve("Prefix_01_senaatintori.jpg").toAbsolutePath().toString());
    }

    @Test
    void rerunOnRenamedFolderKeepsNames() throws IOException {
        // untimed photos, so only the previous names can carry the order
        geoTagReader.tag("a", SENATE_SQUARE).tag("b", KALLIO).tag("c", SENATE_SQUARE);
        writePhoto(input, "a.jpg", "a");
        writePhoto(input, "b.jpg", "b");
        writePhoto(input, "c.jpg", "c");

        service.rename(request());
        List<String> firstRun = listNames(input);
        service.rename(request());

        assertThat(firstRun)
                .containsExactly("Prefix_01-1_senaatintori.jpg", "Prefix_01_senaatintori.jpg", "Prefix_02_fleminginkatu.jpg");
        assertThat(listNames(input)).isEqualTo(firstRun);
        assertThat(content(input, "Prefix_01_senaatintori.jpg")).isEqualTo("a");
        assertThat(content(input, "Prefix_01-1_senaatintori.jpg")).isEqualTo("c");
        assertThat(content(input, "Prefix_02_fleminginkatu.jpg")).isEqualTo("b");
    }

    @Test
    void neverOverwritesUntaggedPhotoHoldingPlannedName() throws IOException {
        geoTagReader.tag("b", SENATE_SQUARE);
        writePhoto(input, "IMG_B.jpg", "b");
        writePhoto(input, "Prefix_01_senaatintori.jpg", "untagged");

        RenameResult result = service.rename(request());

        assertThat(listNames(input)).containsExactly("Prefix_01_senaatintori.jpg", "Prefix_01_senaatintori_dup1.jpg");
        assertThat(content(input, "Prefix_01_senaatintori.jpg")).isEqualTo("untagged");
        assertThat(result.getPhotosScanned()).isEqualTo(2);
        assertThat(result.getSkippedWithoutGeo()).isEqualTo(1);
    }

    @Test
    void forcesPlaceNameOnFirstPhotos() throws IOException {
        geoTagReader
                .tag("b", new GeoTag(60.1699, 24.9384, MORNING))
                .tag("c", new GeoTag(60.1800, 24.9500, MORNING.plusHours(1)));
        writePhoto(input, "IMG_B.jpg", "b");
        writePhoto(input, "IMG_C.jpg", "c");
        RenameRequest request = request();
        request.setPlaceName("Leppävaara Station");
        request.setPlaceNameFirstN(1);

        service.rename(request);

        assertThat(listNames(input)).containsExactly("Prefix_01_leppävaara_station.jpg", "Prefix_02_fleminginkatu.jpg");
    }

    @Test
    void rejectsFolderWithoutGeotaggedPhotos() {
        writePhoto(input, "IMG_1.jpg", "no gps");

        assertThatThrownBy(() -> service.rename(request()))
                .isInstanceOf(PhotoRenameException.class)
                .hasMessageContaining("GPS");
        assertThat(input.resolve("IMG_1.jpg")).exists();
    }

    @Test
    void rejectsMissingInputDirectory() {
        RenameRequest request = request();
        request.setInputDir(root.resolve("nope"));

        assertThatThrownBy(() -> service.rename(request)).isInstanceOf(PhotoRenameException.class);
    }
}
