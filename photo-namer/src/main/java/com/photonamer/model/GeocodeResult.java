package com.photonamer.model;

import com.photonamer.util.PlaceSlugs;

public class GeocodeResult {
    private static final GeocodeResult UNKNOWN = new GeocodeResult("", PlaceSlugs.UNKNOWN_PLACE);

    private final String address;
    private final String placeSlug;

    public GeocodeResult(String address, String placeSlug) {
        this.address = address != null ? address : "";
        this.placeSlug = placeSlug != null ? placeSlug : PlaceSlugs.UNKNOWN_PLACE;
    }

    public static GeocodeResult unknown() {
        return UNKNOWN;
    }

    public String getAddress() {
        return address;
    }

    public String getPlaceSlug() {
        return placeSlug;
    }

    public boolean isResolved() {
        return !PlaceSlugs.isUnknown(placeSlug);
    }

    @Override
    public String toString() {
        return placeSlug + (address.isEmpty() ? "" : " (" + address + ")");
    }
}
