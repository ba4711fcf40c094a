package com.photonamer.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.photonamer.model.PhotoRecord;
import com.photonamer.util.FileNames;

/**
 * Moves every record's file to {@code outputDir/newName} without deleting or
 * overwriting anything. Moves never replace an existing target, so an
 * unexpected file at a planned name fails the run instead of being lost.
 *
 * <p>When renaming in place, all files first move to unique temporary names
 * and only then to their final names. A planned name can therefore never hit
 * a source file that has not moved yet, whatever cycles the plan contains.
 */
@Service
public class AtomicRenamer {

    static final String TEMP_PREFIX = ".tmp_ren_";

    private static final Logger log = LoggerFactory.getLogger(AtomicRenamer.class);

    /**
     * @return true when the two-phase in-place rename was used
     */
    public boolean renameAll(List<PhotoRecord> records, Path outputDir) throws IOException {
        if (isInPlace(records, outputDir)) {
            renameInPlace(records, outputDir);
            return true;
        }
        renameAcross(records, outputDir);
        return false;
    }

    /**
     * In place when every source file already lives in the output directory.
     */
    public boolean isInPlace(List<PhotoRecord> records, Path outputDir) throws IOException {
        if (records.isEmpty() || !Files.isDirectory(outputDir)) {
            return false;
        }
        for (PhotoRecord record : records) {
            Path parent = record.getSourcePath().toAbsolutePath().getParent();
            if (parent == null || !Files.isSameFile(parent, outputDir)) {
                return false;
            }
        }
        return true;
    }

    private void renameAcross(List<PhotoRecord> records, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        for (PhotoRecord record : records) {
            move(record, outputDir.resolve(record.getNewName()));
        }
        log.info("Moved {} photos into {}", records.size(), outputDir);
    }

    private void renameInPlace(List<PhotoRecord> records, Path outputDir) throws IOException {
        for (PhotoRecord record : records) {
            String tempName = TEMP_PREFIX + UUID.randomUUID().toString().replace("-", "")
                    + FileNames.extension(record.getSourcePath());
            move(record, ensureUniquePath(outputDir.resolve(tempName)));
        }
        for (PhotoRecord record : records) {
            move(record, outputDir.resolve(record.getNewName()));
        }
        log.info("Renamed {} photos in place in {}", records.size(), outputDir);
    }

    private void move(PhotoRecord record, Path target) throws IOException {
        Files.move(record.getSourcePath(), target);
        record.setSourcePath(target);
    }

    static Path ensureUniquePath(Path target) {
        if (!Files.exists(target)) {
            return target;
        }
        String fileName = target.getFileName().toString();
        String stem = FileNames.stem(fileName);
        String extension = fileName.substring(stem.length());
        int i = 1;
        while (true) {
            Path candidate = target.resolveSibling(stem + NamePlanner.DUP_MARKER + i + extension);
            if (!Files.exists(candidate)) {
                return candidate;
            }
            i++;
        }
    }
}
