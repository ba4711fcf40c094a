package com.photonamer.service;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.photonamer.model.PhotoRecord;

/**
 * Writes the photo index CSV: one row per record, in record order.
 */
@Service
public class ReportWriter {

    private static final DateTimeFormatter CAPTURE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private final CsvMapper csvMapper;

    public ReportWriter() {
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING);
    }

    @JsonPropertyOrder({"original_name", "new_name", "latitude", "longitude", "address", "place_slug",
            "location_group_id", "location_sequence", "duplicate_index", "capture_datetime", "photo_path"})
    public static class PhotoIndexRow {
        @JsonProperty("original_name")
        private final String originalName;
        @JsonProperty("new_name")
        private final String newName;
        @JsonProperty("latitude")
        private final String latitude;
        @JsonProperty("longitude")
        private final String longitude;
        @JsonProperty("address")
        private final String address;
        @JsonProperty("place_slug")
        private final String placeSlug;
        @JsonProperty("location_group_id")
        private final int locationGroupId;
        @JsonProperty("location_sequence")
        private final int locationSequence;
        @JsonProperty("duplicate_index")
        private final int duplicateIndex;
        @JsonProperty("capture_datetime")
        private final String captureDateTime;
        @JsonProperty("photo_path")
        private final String photoPath;

        public PhotoIndexRow(PhotoRecord record) {
            this.originalName = record.getOriginalName();
            this.newName = record.getNewName();
            this.latitude = String.format(Locale.ROOT, "%.8f", record.getLatitude());
            this.longitude = String.format(Locale.ROOT, "%.8f", record.getLongitude());
            this.address = record.getAddress();
            this.placeSlug = record.getPlaceSlug();
            this.locationGroupId = record.getLocationGroupId();
            this.locationSequence = record.getLocationSequence();
            this.duplicateIndex = record.getDuplicateIndex();
            this.captureDateTime = record.getCaptureTime().map(CAPTURE_FORMAT::format).orElse("");
            this.photoPath = record.getSourcePath().toAbsolutePath().normalize().toString();
        }
    }

    public void writeCsv(List<PhotoRecord> records, Path csvPath) throws IOException {
        Path parent = csvPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        List<PhotoIndexRow> rows = records.stream().map(PhotoIndexRow::new).collect(Collectors.toList());
        CsvSchema schema = csvMapper.schemaFor(PhotoIndexRow.class).withHeader();
        try (Writer writer = Files.newBufferedWriter(csvPath, StandardCharsets.UTF_8);
             SequenceWriter sequenceWriter = csvMapper.writer(schema).writeValues(writer)) {
            sequenceWriter.writeAll(rows);
        }
        log.info("Wrote {} rows to {}", rows.size(), csvPath);
    }
}
