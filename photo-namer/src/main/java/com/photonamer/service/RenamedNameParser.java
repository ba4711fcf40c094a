package com.photonamer.service;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.photonamer.util.FileNames;

/**
 * Recognizes names produced by an earlier run, {@code <prefix>_<seq>[-<dup>]_<place>.<ext>},
 * so a re-run can keep the order those names encode.
 */
public final class RenamedNameParser {

    private static final Pattern RENAMED_PATTERN = Pattern.compile(".*_(\\d+)(?:-(\\d+))?_(.+)");

    public static class SequenceAndDuplicate {
        private final int sequence;
        private final int duplicate;

        public SequenceAndDuplicate(int sequence, int duplicate) {
            this.sequence = sequence;
            this.duplicate = duplicate;
        }

        public int getSequence() {
            return sequence;
        }

        public int getDuplicate() {
            return duplicate;
        }
    }

    private RenamedNameParser() {
    }

    public static Optional<SequenceAndDuplicate> parse(String fileName) {
        Matcher matcher = RENAMED_PATTERN.matcher(FileNames.stem(fileName));
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            int sequence = Integer.parseInt(matcher.group(1));
            int duplicate = matcher.group(2) != null ? Integer.parseInt(matcher.group(2)) : 0;
            return Optional.of(new SequenceAndDuplicate(sequence, duplicate));
        } catch (NumberFormatException e) {
            // digit runs too long for an int cannot come from this tool
            return Optional.empty();
        }
    }
}
