package com.photonamer.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.photonamer.model.PhotoRecord;
import com.photonamer.util.FileNames;

/**
 * Plans the final file name of every record.
 *
 * <p>Names follow {@code <prefix>_<seq>[-<dup>]_<place><ext>}. A name that is
 * already claimed by an earlier record of the batch, or taken by a foreign file
 * in the destination, gets {@code _dup1}, {@code _dup2}, ... appended to its stem.
 */
@Service
public class NamePlanner {

    static final String DUP_MARKER = "_dup";

    private static final Logger log = LoggerFactory.getLogger(NamePlanner.class);

    public void planNames(List<PhotoRecord> records, Path outputDir, String prefix, int digits) throws IOException {
        if (digits < 1) {
            throw new IllegalArgumentException("Sequence digits must be at least 1, got " + digits);
        }

        Set<String> reserved = reservedNames(records, outputDir);
        Set<String> claimed = new HashSet<>();
        for (PhotoRecord record : records) {
            String candidate = buildFileName(prefix, record, digits);
            String name = resolveCollision(candidate, record, outputDir, reserved, claimed);
            if (!name.equals(candidate)) {
                log.debug("{}: {} is taken, using {}", record.getOriginalName(), candidate, name);
            }
            record.setNewName(name);
            claimed.add(name);
        }
    }

    public String buildFileName(String prefix, PhotoRecord record, int digits) {
        StringBuilder name = new StringBuilder(prefix)
                .append('_')
                .append(String.format(Locale.ROOT, "%0" + digits + "d", record.getLocationSequence()));
        if (record.getDuplicateIndex() > 0) {
            name.append('-').append(record.getDuplicateIndex());
        }
        return name.append('_')
                .append(record.getPlaceSlug())
                .append(FileNames.extension(record.getSourcePath()))
                .toString();
    }

    /**
     * Names of files already in the destination that do not belong to this
     * batch. A source photo living in the destination is not a collision for
     * the batch, since it is about to be moved.
     */
    Set<String> reservedNames(List<PhotoRecord> records, Path outputDir) throws IOException {
        if (!Files.isDirectory(outputDir)) {
            return new HashSet<>();
        }
        Set<String> existing;
        try (Stream<Path> entries = Files.list(outputDir)) {
            existing = entries
                    .filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .collect(Collectors.toCollection(HashSet::new));
        }
        for (PhotoRecord record : records) {
            Path parent = record.getSourcePath().toAbsolutePath().getParent();
            if (parent != null && Files.isDirectory(parent) && Files.isSameFile(parent, outputDir)) {
                existing.remove(record.getSourcePath().getFileName().toString());
            }
        }
        return existing;
    }

    private String resolveCollision(String candidate, PhotoRecord record, Path outputDir,
                                    Set<String> reserved, Set<String> claimed) throws IOException {
        if (isFree(candidate, record, outputDir, reserved, claimed)) {
            return candidate;
        }
        String stem = FileNames.stem(candidate);
        String extension = candidate.substring(stem.length());
        int i = 1;
        while (true) {
            String next = stem + DUP_MARKER + i + extension;
            if (isFree(next, record, outputDir, reserved, claimed)) {
                return next;
            }
            i++;
        }
    }

    private boolean isFree(String name, PhotoRecord record, Path outputDir,
                           Set<String> reserved, Set<String> claimed) throws IOException {
        if (claimed.contains(name)) {
            return false;
        }
        return !reserved.contains(name) || isOwnSource(outputDir.resolve(name), record);
    }

    private boolean isOwnSource(Path target, PhotoRecord record) throws IOException {
        Path source = record.getSourcePath();
        if (target.toAbsolutePath().normalize().equals(source.toAbsolutePath().normalize())) {
            return true;
        }
        return Files.exists(target) && Files.exists(source) && Files.isSameFile(target, source);
    }
}
