package com.procrawl.listingsync.ingest.model;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Static per-site configuration. The base URL used for relative links is derived once, here,
 * so a malformed override fails when the configuration is built rather than mid-crawl.
 */
public final class SiteConfig {
    private final String name;
    private final String siteOrigin;
    private final String baseUrlOverride;
    private final String baseUrl;
    private final boolean enabled;
    private final FieldMapping fieldMapping;
    private final Set<String> trackingParameters;

    private SiteConfig(
        String name,
        String siteOrigin,
        String baseUrlOverride,
        boolean enabled,
        FieldMapping fieldMapping,
        Set<String> trackingParameters
    ) {
        this.name = name;
        this.siteOrigin = siteOrigin;
        this.baseUrlOverride = baseUrlOverride;
        this.baseUrl = baseUrlOverride == null ? siteOrigin : baseUrlOverride;
        this.enabled = enabled;
        this.fieldMapping = fieldMapping;
        this.trackingParameters = trackingParameters;
    }

    public static SiteConfig of(String name, String siteOrigin) {
        return builder(name, siteOrigin).build();
    }

    public static Builder builder(String name, String siteOrigin) {
        return new Builder(name, siteOrigin);
    }

    public String name() {
        return name;
    }

    public String siteOrigin() {
        return siteOrigin;
    }

    public String baseUrlOverride() {
        return baseUrlOverride;
    }

    /**
     * Base for relative-reference resolution: the override when configured, else the origin.
     */
    public String baseUrl() {
        return baseUrl;
    }

    public boolean enabled() {
        return enabled;
    }

    public FieldMapping fieldMapping() {
        return fieldMapping;
    }

    /** Lower-cased query parameter names dropped when deriving identity keys. */
    public Set<String> trackingParameters() {
        return trackingParameters;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SiteConfig other)) {
            return false;
        }
        return enabled == other.enabled
            && name.equals(other.name)
            && siteOrigin.equals(other.siteOrigin)
            && Objects.equals(baseUrlOverride, other.baseUrlOverride)
            && fieldMapping.equals(other.fieldMapping)
            && trackingParameters.equals(other.trackingParameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, siteOrigin, baseUrlOverride, enabled, fieldMapping, trackingParameters);
    }

    @Override
    public String toString() {
        return "SiteConfig{name=" + name + ", baseUrl=" + baseUrl + ", enabled=" + enabled + "}";
    }

    public static final class Builder {
        private final String name;
        private final String siteOrigin;
        private String baseUrlOverride;
        private boolean enabled = true;
        private FieldMapping fieldMapping = FieldMapping.defaults();
        private final Set<String> trackingParameters = new LinkedHashSet<>();

        private Builder(String name, String siteOrigin) {
            this.name = name;
            this.siteOrigin = siteOrigin;
        }

        public Builder baseUrlOverride(String baseUrlOverride) {
            this.baseUrlOverride = baseUrlOverride;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder fieldMapping(FieldMapping fieldMapping) {
            this.fieldMapping = fieldMapping;
            return this;
        }

        public Builder trackingParameters(Collection<String> parameters) {
            if (parameters != null) {
                for (String parameter : parameters) {
                    if (parameter != null && !parameter.isBlank()) {
                        trackingParameters.add(parameter.trim().toLowerCase(Locale.ROOT));
                    }
                }
            }
            return this;
        }

        public SiteConfig build() {
            if (name == null || name.isBlank()) {
                throw new InvalidSiteConfigException("Site name is required");
            }
            String site = name.trim();
            String origin = toOrigin(site, siteOrigin);
            String override = null;
            if (baseUrlOverride != null && !baseUrlOverride.isBlank()) {
                override = baseUrlOverride.trim();
                requireAbsoluteHttpUrl(site, "base URL override", override);
            }
            return new SiteConfig(
                site,
                origin,
                override,
                enabled,
                fieldMapping == null ? FieldMapping.defaults() : fieldMapping,
                Collections.unmodifiableSet(new LinkedHashSet<>(trackingParameters))
            );
        }

        private static String toOrigin(String site, String candidate) {
            if (candidate == null || candidate.isBlank()) {
                throw new InvalidSiteConfigException("Site '" + site + "' has no origin");
            }
            URI uri = requireAbsoluteHttpUrl(site, "origin", candidate.trim());
            StringBuilder origin = new StringBuilder()
                .append(uri.getScheme().toLowerCase(Locale.ROOT))
                .append("://")
                .append(uri.getHost().toLowerCase(Locale.ROOT));
            if (uri.getPort() != -1) {
                origin.append(':').append(uri.getPort());
            }
            return origin.toString();
        }

        private static URI requireAbsoluteHttpUrl(String site, String label, String value) {
            URI uri;
            try {
                uri = new URI(value);
            } catch (URISyntaxException e) {
                throw new InvalidSiteConfigException(
                    "Site '" + site + "' has a malformed " + label + ": " + value
                );
            }
            String scheme = uri.getScheme();
            if (scheme == null || (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme))) {
                throw new InvalidSiteConfigException(
                    "Site '" + site + "' " + label + " must be an absolute http(s) URL: " + value
                );
            }
            if (uri.getHost() == null || uri.getHost().isBlank()) {
                throw new InvalidSiteConfigException(
                    "Site '" + site + "' " + label + " has no host: " + value
                );
            }
            return uri;
        }
    }
}
