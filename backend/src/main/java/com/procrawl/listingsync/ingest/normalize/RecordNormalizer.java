package com.procrawl.listingsync.ingest.normalize;

import com.procrawl.listingsync.ingest.model.CanonicalListing;
import com.procrawl.listingsync.ingest.model.FieldMapping;
import com.procrawl.listingsync.ingest.model.NumericFormat;
import com.procrawl.listingsync.ingest.model.RawListing;
import com.procrawl.listingsync.ingest.model.RejectionReason;
import com.procrawl.listingsync.ingest.model.SiteConfig;
import com.procrawl.listingsync.ingest.url.IdentityKeys;
import com.procrawl.listingsync.ingest.url.UrlCanonicalizer;
import com.procrawl.listingsync.ingest.url.UrlResolution;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Maps one extracted record onto its canonical form. Holds no state, so a single instance is
 * shared by all normalization workers.
 */
@Component
public class RecordNormalizer {

    public NormalizationResult normalize(RawListing raw, SiteConfig config) {
        FieldMapping mapping = config.fieldMapping();
        String base = config.baseUrl();
        String primaryField = mapping.primaryUrlField();

        Object primaryValue = raw.get(primaryField);
        if (primaryValue != null && !(primaryValue instanceof String)) {
            return NormalizationResult.rejected(
                RejectionReason.INVALID_PRIMARY_URL,
                primaryField + ": expected a single URL string, got " + primaryValue.getClass().getSimpleName()
            );
        }
        UrlResolution primary = UrlCanonicalizer.canonicalize((String) primaryValue, base);
        if (!primary.isResolved()) {
            return NormalizationResult.rejected(
                RejectionReason.INVALID_PRIMARY_URL,
                primaryField + ": " + primary.reason() + " (" + primary.detail() + ")"
            );
        }
        for (String required : mapping.requiredFields()) {
            if (isBlank(raw.get(required))) {
                return NormalizationResult.rejected(RejectionReason.MISSING_REQUIRED_FIELD, required);
            }
        }

        Map<String, Object> fields = new TreeMap<>();
        for (Map.Entry<String, Object> entry : raw.fields().entrySet()) {
            String name = entry.getKey();
            if (name == null || name.isBlank() || name.equals(primaryField)) {
                continue;
            }
            Object value = normalizeValue(name, entry.getValue(), mapping, base);
            if (value != null) {
                fields.put(name, value);
            }
        }
        fields.put(primaryField, primary.url());

        String identityKey = IdentityKeys.derive(primary.url(), config.trackingParameters());
        return NormalizationResult.accepted(new CanonicalListing(
            config.name(),
            identityKey,
            primary.url(),
            fields,
            ContentHasher.hash(fields)
        ));
    }

    private Object normalizeValue(String name, Object value, FieldMapping mapping, String base) {
        if (value == null) {
            return null;
        }
        if (mapping.isSecondaryUrlField(name)) {
            return canonicalizeUrls(value, base);
        }
        NumericFormat format = mapping.numericFormat(name);
        if (format != null) {
            return FieldParsers.parseNumber(value, format);
        }
        if (mapping.htmlFields().contains(name)) {
            return FieldParsers.htmlToText(value.toString());
        }
        if (value instanceof String text) {
            String trimmed = text.trim();
            return trimmed.isEmpty() ? null : trimmed;
        }
        if (value instanceof Collection<?> values) {
            List<Object> kept = new ArrayList<>();
            for (Object item : values) {
                Object normalized = item instanceof String text ? blankToNull(text) : item;
                if (normalized != null) {
                    kept.add(normalized);
                }
            }
            return kept.isEmpty() ? null : kept;
        }
        if (value instanceof Map<?, ?> nested) {
            return nested.isEmpty() ? null : new LinkedHashMap<>(nested);
        }
        return value;
    }

    // A broken photo link drops that link only; the listing stays valid.
    private Object canonicalizeUrls(Object value, String base) {
        if (value instanceof Collection<?> values) {
            Set<String> urls = new LinkedHashSet<>();
            for (Object item : values) {
                if (item == null) {
                    continue;
                }
                UrlResolution resolution = UrlCanonicalizer.canonicalize(item.toString(), base);
                if (resolution.isResolved()) {
                    urls.add(resolution.url());
                }
            }
            return urls.isEmpty() ? null : List.copyOf(urls);
        }
        if (value instanceof String text) {
            UrlResolution resolution = UrlCanonicalizer.canonicalize(text, base);
            return resolution.isResolved() ? resolution.url() : null;
        }
        return null;
    }

    private static boolean isBlank(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Collection<?> values) {
            return values.isEmpty();
        }
        return value.toString().isBlank();
    }

    private static String blankToNull(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
