package com.photonamer.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.photonamer.model.LocationGroup;
import com.photonamer.model.PhotoRecord;
import com.photonamer.service.RenamedNameParser.SequenceAndDuplicate;
import com.photonamer.util.GeoUtils;

/**
 * Greedy single-pass grouping of records into locations.
 *
 * <p>Each record joins the first group, in creation order, whose reference point
 * lies within the threshold; otherwise it opens a new group at its own
 * coordinate. Only the distance to the reference point is bounded, so two
 * members of one group can be up to twice the threshold apart. Group order,
 * and with it every sequence number, follows input order.
 */
@Service
public class LocationClusterer {

    public static final double DEFAULT_SAME_SPOT_METERS = 12.0;

    private static final int TIER_TIMESTAMPED = 0;
    private static final int TIER_PREVIOUSLY_RENAMED = 1;
    private static final int TIER_OTHER = 2;

    private static final Logger log = LoggerFactory.getLogger(LocationClusterer.class);

    /**
     * Assigns group, sequence and duplicate index to every record. Records must
     * arrive in capture order as produced by {@link RecordBuilder}.
     *
     * @return groups in creation order
     */
    public List<LocationGroup> assignLocationGroups(List<PhotoRecord> records, double sameSpotMeters) {
        if (Double.isNaN(sameSpotMeters) || sameSpotMeters <= 0) {
            throw new IllegalArgumentException("Same-spot threshold must be positive, got " + sameSpotMeters);
        }

        List<LocationGroup> groups = new ArrayList<>();
        for (PhotoRecord record : records) {
            LocationGroup group = findFirstWithin(groups, record, sameSpotMeters);
            if (group == null) {
                group = new LocationGroup(groups.size(), record);
                groups.add(group);
            } else {
                group.addMember(record);
            }
            record.setLocationGroupId(group.getGroupId());
            record.setLocationSequence(group.getSequence());
        }

        for (LocationGroup group : groups) {
            assignDuplicateIndexes(group);
        }

        log.info("Clustered {} photos into {} locations (same spot <= {} m)",
                records.size(), groups.size(), sameSpotMeters);
        return groups;
    }

    private LocationGroup findFirstWithin(List<LocationGroup> groups, PhotoRecord record, double sameSpotMeters) {
        for (LocationGroup group : groups) {
            double distance = GeoUtils.haversineMeters(record.getLatitude(), record.getLongitude(),
                    group.getReferenceLatitude(), group.getReferenceLongitude());
            if (distance <= sameSpotMeters) {
                return group;
            }
        }
        return null;
    }

    private void assignDuplicateIndexes(LocationGroup group) {
        int sequence = group.getSequence();
        List<PhotoRecord> ordered = new ArrayList<>(group.getMembers());
        ordered.sort(withinGroupOrder(sequence));
        for (int i = 0; i < ordered.size(); i++) {
            ordered.get(i).setDuplicateIndex(i);
        }
        group.setOrderedMembers(ordered);
    }

    /**
     * Timestamped photos first; then photos whose name already carries this
     * group's sequence from an earlier run, by the duplicate number in that
     * name; then the rest by name.
     */
    static Comparator<PhotoRecord> withinGroupOrder(int sequence) {
        return Comparator
                .comparingInt((PhotoRecord r) -> tier(r, sequence))
                .thenComparing((a, b) -> {
                    if (a.hasCaptureTime() && b.hasCaptureTime()) {
                        return a.getCaptureTime().get().compareTo(b.getCaptureTime().get());
                    }
                    return 0;
                })
                .thenComparingInt(r -> previousDuplicate(r, sequence))
                .thenComparing(PhotoRecord::getOriginalName);
    }

    private static int tier(PhotoRecord record, int sequence) {
        if (record.hasCaptureTime()) {
            return TIER_TIMESTAMPED;
        }
        return previousName(record, sequence).isPresent() ? TIER_PREVIOUSLY_RENAMED : TIER_OTHER;
    }

    private static int previousDuplicate(PhotoRecord record, int sequence) {
        if (record.hasCaptureTime()) {
            return 0;
        }
        return previousName(record, sequence).map(SequenceAndDuplicate::getDuplicate).orElse(0);
    }

    private static Optional<SequenceAndDuplicate> previousName(PhotoRecord record, int sequence) {
        return RenamedNameParser.parse(record.getOriginalName())
                .filter(parsed -> parsed.getSequence() == sequence);
    }
}
