package com.procrawl.listingsync.config;

import com.procrawl.listingsync.ingest.model.NumericFormat;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "listing-sync")
public class ListingSyncProperties {
    private static final List<String> DEFAULT_TRACKING_PARAMETERS = List.of(
        "utm_source",
        "utm_medium",
        "utm_campaign",
        "utm_term",
        "utm_content",
        "gclid",
        "fbclid"
    );

    private int normalizeConcurrency = 4;
    private int syncConcurrency = 4;
    private int lockStripes = 64;
    private int defaultListLimit = 50;
    private List<String> trackingParameters = new ArrayList<>(DEFAULT_TRACKING_PARAMETERS);
    private List<String> priceFields = new ArrayList<>(List.of("rent_price_brl", "condo_fee_brl"));
    private Map<String, Site> sites = new LinkedHashMap<>();
    private Cli cli = new Cli();

    public int getNormalizeConcurrency() {
        return Math.max(1, normalizeConcurrency);
    }

    public void setNormalizeConcurrency(int normalizeConcurrency) {
        this.normalizeConcurrency = Math.max(1, normalizeConcurrency);
    }

    public int getSyncConcurrency() {
        return Math.max(1, syncConcurrency);
    }

    public void setSyncConcurrency(int syncConcurrency) {
        this.syncConcurrency = Math.max(1, syncConcurrency);
    }

    public int getLockStripes() {
        return Math.max(1, lockStripes);
    }

    public void setLockStripes(int lockStripes) {
        this.lockStripes = Math.max(1, lockStripes);
    }

    public int getDefaultListLimit() {
        return Math.max(1, defaultListLimit);
    }

    public void setDefaultListLimit(int defaultListLimit) {
        this.defaultListLimit = Math.max(1, defaultListLimit);
    }

    public List<String> getTrackingParameters() {
        return trackingParameters;
    }

    public void setTrackingParameters(List<String> trackingParameters) {
        this.trackingParameters = trackingParameters == null ? new ArrayList<>() : trackingParameters;
    }

    public List<String> getPriceFields() {
        return priceFields;
    }

    public void setPriceFields(List<String> priceFields) {
        this.priceFields = priceFields == null ? new ArrayList<>() : priceFields;
    }

    public Map<String, Site> getSites() {
        return sites;
    }

    public void setSites(Map<String, Site> sites) {
        this.sites = sites == null ? new LinkedHashMap<>() : sites;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static class Site {
        private String origin;
        private String baseUrl;
        private boolean enabled = true;
        private List<String> trackingParameters = new ArrayList<>();
        private Fields fields = new Fields();

        public String getOrigin() {
            return origin;
        }

        public void setOrigin(String origin) {
            this.origin = origin;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<String> getTrackingParameters() {
            return trackingParameters;
        }

        public void setTrackingParameters(List<String> trackingParameters) {
            this.trackingParameters = trackingParameters == null ? new ArrayList<>() : trackingParameters;
        }

        public Fields getFields() {
            return fields;
        }

        public void setFields(Fields fields) {
            this.fields = fields == null ? new Fields() : fields;
        }
    }

    public static class Fields {
        private String primaryUrl = "property_url";
        private List<String> secondaryUrls = new ArrayList<>(List.of("image_urls", "additional_images"));
        private Map<String, NumericFormat> numeric = new LinkedHashMap<>();
        private List<String> html = new ArrayList<>();
        private List<String> required = new ArrayList<>();

        public String getPrimaryUrl() {
            return primaryUrl;
        }

        public void setPrimaryUrl(String primaryUrl) {
            this.primaryUrl = primaryUrl;
        }

        public List<String> getSecondaryUrls() {
            return secondaryUrls;
        }

        public void setSecondaryUrls(List<String> secondaryUrls) {
            this.secondaryUrls = secondaryUrls == null ? new ArrayList<>() : secondaryUrls;
        }

        public Map<String, NumericFormat> getNumeric() {
            return numeric;
        }

        public void setNumeric(Map<String, NumericFormat> numeric) {
            this.numeric = numeric == null ? new LinkedHashMap<>() : numeric;
        }

        public List<String> getHtml() {
            return html;
        }

        public void setHtml(List<String> html) {
            this.html = html == null ? new ArrayList<>() : html;
        }

        public List<String> getRequired() {
            return required;
        }

        public void setRequired(List<String> required) {
            this.required = required == null ? new ArrayList<>() : required;
        }
    }

    public static class Cli {
        private boolean run;
        private String file;
        private String site;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file;
        }

        public String getSite() {
            return site;
        }

        public void setSite(String site) {
            this.site = site;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
