package com.photonamer.service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class NominatimResponse {

    // most specific first
    private static final List<String> PLACE_KEYS = List.of(
            "park", "road", "pedestrian", "suburb", "neighbourhood", "city_district", "city");

    @JsonProperty("display_name")
    private String displayName;

    private String name;

    private String error;

    private Map<String, String> address = new HashMap<>();

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public Map<String, String> getAddress() {
        return address;
    }

    public void setAddress(Map<String, String> address) {
        this.address = address;
    }

    public String getPlaceCandidate() {
        if (address != null) {
            for (String key : PLACE_KEYS) {
                String value = address.get(key);
                if (value != null && !value.isBlank()) {
                    return value;
                }
            }
        }
        return name != null && !name.isBlank() ? name : null;
    }
}
