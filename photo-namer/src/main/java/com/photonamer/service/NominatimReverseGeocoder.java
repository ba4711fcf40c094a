package com.photonamer.service;

import java.net.URI;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import com.photonamer.config.AppProperties;
import com.photonamer.model.GeocodeResult;
import com.photonamer.util.PlaceSlugs;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * Reverse geocoding against the OpenStreetMap Nominatim API.
 */
@Component
public class NominatimReverseGeocoder implements ReverseGeocoder {

    static final String DEFAULT_USER_AGENT = "photo-namer/0.1 (contact: local-script)";

    private static final Logger log = LoggerFactory.getLogger(NominatimReverseGeocoder.class);

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String userAgent;

    private final Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();

    public NominatimReverseGeocoder(RestTemplate restTemplate, AppProperties appProperties) {
        this.restTemplate = restTemplate;
        this.baseUrl = appProperties.getGeocode().getBaseUrl();
        String resolved = resolveValue(appProperties.getGeocode().getUserAgent(), "NOMINATIM_USER_AGENT");
        this.userAgent = resolved != null ? resolved : DEFAULT_USER_AGENT;
    }

    @Override
    public GeocodeResult reverseGeocode(double latitude, double longitude) {
        try {
            URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                    .path("/reverse")
                    .queryParam("lat", latitude)
                    .queryParam("lon", longitude)
                    .queryParam("format", "jsonv2")
                    .queryParam("addressdetails", 1)
                    .build()
                    .toUri();

            HttpHeaders headers = new HttpHeaders();
            headers.set(HttpHeaders.USER_AGENT, userAgent);
            headers.setAccept(List.of(MediaType.APPLICATION_JSON));

            ResponseEntity<NominatimResponse> response = restTemplate.exchange(
                    uri, HttpMethod.GET, new HttpEntity<>(headers), NominatimResponse.class);
            NominatimResponse body = response.getBody();
            if (body == null || StringUtils.hasText(body.getError())) {
                log.warn("Nominatim returned no place for ({}, {}): {}", latitude, longitude,
                        body != null ? body.getError() : "empty body");
                return GeocodeResult.unknown();
            }

            String address = body.getDisplayName() != null ? body.getDisplayName() : "";
            return new GeocodeResult(address, PlaceSlugs.slugify(body.getPlaceCandidate()));
        } catch (Exception e) {
            log.warn("Reverse geocoding failed for ({}, {}): {}", latitude, longitude, e.getMessage());
            return GeocodeResult.unknown();
        }
    }

    String getUserAgent() {
        return userAgent;
    }

    private String resolveValue(String propertyValue, String key) {
        if (StringUtils.hasText(propertyValue)) {
            return propertyValue;
        }
        String systemValue = System.getenv(key);
        if (StringUtils.hasText(systemValue)) {
            return systemValue;
        }
        String dotenvValue = dotenv.get(key);
        return StringUtils.hasText(dotenvValue) ? dotenvValue : null;
    }
}
