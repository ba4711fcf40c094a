package com.photonamer.service;

import com.photonamer.model.GeocodeResult;

public interface ReverseGeocoder {

    /**
     * Looks up an address and place slug for a coordinate. Never throws; any
     * failure yields {@link GeocodeResult#unknown()}.
     */
    GeocodeResult reverseGeocode(double latitude, double longitude);
}
