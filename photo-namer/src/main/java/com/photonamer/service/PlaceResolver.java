package com.photonamer.service;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.photonamer.model.GeocodeResult;
import com.photonamer.model.LocationGroup;
import com.photonamer.model.PhotoRecord;
import com.photonamer.util.PlaceSlugs;

/**
 * Attaches an address and place slug to every record, one geocoding lookup per
 * location group.
 */
@Service
public class PlaceResolver {

    private static final Logger log = LoggerFactory.getLogger(PlaceResolver.class);

    private final ReverseGeocoder reverseGeocoder;

    public PlaceResolver(ReverseGeocoder reverseGeocoder) {
        this.reverseGeocoder = reverseGeocoder;
    }

    /**
     * Geocodes each group at its reference record, in group order, pausing
     * {@code delayMs} after every lookup.
     *
     * @return number of groups that resolved to a known place
     */
    public int resolvePlaces(List<LocationGroup> groups, long delayMs) {
        int resolved = 0;
        for (LocationGroup group : groups) {
            PhotoRecord reference = group.getReferenceRecord();
            GeocodeResult result = lookup(reference);
            if (result.isResolved()) {
                resolved++;
            }
            log.info("Location {} -> {}", group, result);
            applyToGroup(group, result);
            rateLimitDelay(delayMs);
        }
        return resolved;
    }

    /**
     * Gives every record the fallback place without calling the geocoder.
     */
    public void assignUnknownPlaces(List<LocationGroup> groups) {
        for (LocationGroup group : groups) {
            applyToGroup(group, GeocodeResult.unknown());
        }
    }

    /**
     * Replaces the place slug with one derived from {@code placeName}: for all
     * records, or for the first {@code firstN} in capture order when
     * {@code firstN > 0}. Addresses are kept.
     *
     * @return number of records whose slug was forced
     */
    public int applyForcedPlace(List<PhotoRecord> records, String placeName, int firstN) {
        if (placeName == null || placeName.isBlank()) {
            return 0;
        }
        String forcedSlug = PlaceSlugs.slugify(placeName);
        int count = firstN > 0 ? Math.min(firstN, records.size()) : records.size();
        for (PhotoRecord record : records.subList(0, count)) {
            record.setPlaceSlug(forcedSlug);
        }
        log.info("Forced place '{}' on {} of {} photos", forcedSlug, count, records.size());
        return count;
    }

    private GeocodeResult lookup(PhotoRecord reference) {
        try {
            GeocodeResult result = reverseGeocoder.reverseGeocode(reference.getLatitude(), reference.getLongitude());
            return result != null ? result : GeocodeResult.unknown();
        } catch (RuntimeException e) {
            log.warn("Geocoder failed for {}: {}", reference.getOriginalName(), e.getMessage());
            return GeocodeResult.unknown();
        }
    }

    private void applyToGroup(LocationGroup group, GeocodeResult result) {
        for (PhotoRecord record : group.getMembers()) {
            record.setAddress(result.getAddress());
            record.setPlaceSlug(result.getPlaceSlug());
        }
    }

    private void rateLimitDelay(long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
