package com.procrawl.listingsync.ingest.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Declares which raw fields carry URLs, numbers or markup. Fields not named here pass through.
 */
public record FieldMapping(
    String primaryUrlField,
    Set<String> secondaryUrlFields,
    Map<String, NumericFormat> numericFields,
    Set<String> htmlFields,
    Set<String> requiredFields
) {
    public static final String DEFAULT_PRIMARY_URL_FIELD = "property_url";

    public FieldMapping {
        if (primaryUrlField == null || primaryUrlField.isBlank()) {
            primaryUrlField = DEFAULT_PRIMARY_URL_FIELD;
        }
        primaryUrlField = primaryUrlField.trim();
        secondaryUrlFields = freeze(secondaryUrlFields);
        htmlFields = freeze(htmlFields);
        requiredFields = freeze(requiredFields);
        numericFields = numericFields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(numericFields));
        if (secondaryUrlFields.contains(primaryUrlField)) {
            throw new InvalidSiteConfigException(
                "Field '" + primaryUrlField + "' cannot be both the primary and a secondary URL field"
            );
        }
    }

    public static FieldMapping defaults() {
        return new FieldMapping(
            DEFAULT_PRIMARY_URL_FIELD,
            Set.of("image_urls", "additional_images"),
            Map.of(),
            Set.of(),
            Set.of()
        );
    }

    public boolean isSecondaryUrlField(String name) {
        return secondaryUrlFields.contains(name);
    }

    public NumericFormat numericFormat(String name) {
        return numericFields.get(name);
    }

    private static Set<String> freeze(Set<String> values) {
        if (values == null) {
            return Set.of();
        }
        Set<String> out = new LinkedHashSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                out.add(value.trim());
            }
        }
        return Collections.unmodifiableSet(out);
    }
}
