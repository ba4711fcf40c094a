package com.photonamer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "photonamer")
public class AppProperties {

    private final Rename rename = new Rename();
    private final Geocode geocode = new Geocode();

    public Rename getRename() {
        return rename;
    }

    public Geocode getGeocode() {
        return geocode;
    }

    public static class Rename {
        private String prefix = "Photo";
        private int digits = 2;
        private double sameSpotMeters = 12.0;
        private String csvOut = "Data/photo_index.csv";

        public String getPrefix() {
            return prefix;
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }

        public int getDigits() {
            return digits;
        }

        public void setDigits(int digits) {
            this.digits = digits;
        }

        public double getSameSpotMeters() {
            return sameSpotMeters;
        }

        public void setSameSpotMeters(double sameSpotMeters) {
            this.sameSpotMeters = sameSpotMeters;
        }

        public String getCsvOut() {
            return csvOut;
        }

        public void setCsvOut(String csvOut) {
            this.csvOut = csvOut;
        }
    }

    public static class Geocode {
        private boolean enabled = true;
        private String baseUrl = "https://nominatim.openstreetmap.org";
        private String userAgent = "";
        private int timeoutSeconds = 20;
        private long delayMs = 1000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public long getDelayMs() {
            return delayMs;
        }

        public void setDelayMs(long delayMs) {
            this.delayMs = delayMs;
        }
    }
}
