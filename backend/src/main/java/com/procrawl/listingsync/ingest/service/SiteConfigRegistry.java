package com.procrawl.listingsync.ingest.service;

import com.procrawl.listingsync.config.ListingSyncProperties;
import com.procrawl.listingsync.ingest.model.FieldMapping;
import com.procrawl.listingsync.ingest.model.SiteConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Builds every configured {@link SiteConfig} at startup. A broken site definition stops the
 * application from starting.
 */
@Component
public class SiteConfigRegistry {
    private static final Logger log = LoggerFactory.getLogger(SiteConfigRegistry.class);

    private final Map<String, SiteConfig> sites;

    public SiteConfigRegistry(ListingSyncProperties properties) {
        Map<String, SiteConfig> built = new LinkedHashMap<>();
        for (Map.Entry<String, ListingSyncProperties.Site> entry : properties.getSites().entrySet()) {
            SiteConfig config = toSiteConfig(entry.getKey(), entry.getValue(), properties);
            built.put(config.name().toLowerCase(Locale.ROOT), config);
            log.info(
                "Loaded site {} (baseUrl={}, enabled={}, primaryUrlField={})",
                config.name(),
                config.baseUrl(),
                config.enabled(),
                config.fieldMapping().primaryUrlField()
            );
        }
        this.sites = Collections.unmodifiableMap(built);
    }

    public Optional<SiteConfig> find(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(sites.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Returns the named site, failing when it is unknown or switched off.
     */
    public SiteConfig require(String name) {
        SiteConfig config = find(name)
            .orElseThrow(() -> new UnknownSiteException("Unknown site: " + name));
        if (!config.enabled()) {
            throw new SiteDisabledException("Site is disabled: " + config.name());
        }
        return config;
    }

    public Collection<SiteConfig> all() {
        return sites.values();
    }

    static SiteConfig toSiteConfig(String name, ListingSyncProperties.Site site, ListingSyncProperties properties) {
        ListingSyncProperties.Fields fields = site.getFields();
        FieldMapping mapping = new FieldMapping(
            fields.getPrimaryUrl(),
            new LinkedHashSet<>(fields.getSecondaryUrls()),
            fields.getNumeric(),
            new LinkedHashSet<>(fields.getHtml()),
            new LinkedHashSet<>(fields.getRequired())
        );
        return SiteConfig.builder(name, site.getOrigin())
            .baseUrlOverride(site.getBaseUrl())
            .enabled(site.isEnabled())
            .fieldMapping(mapping)
            .trackingParameters(properties.getTrackingParameters())
            .trackingParameters(site.getTrackingParameters())
            .build();
    }
}
