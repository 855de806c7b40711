package com.procrawl.listingsync.ingest.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One record as produced by the extractor. Any field may be missing, blank or malformed.
 */
public record RawListing(Map<String, Object> fields) {

    public RawListing {
        fields = fields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static RawListing of(Map<String, Object> fields) {
        return new RawListing(fields);
    }

    @JsonValue
    @Override
    public Map<String, Object> fields() {
        return fields;
    }

    public Object get(String name) {
        return name == null ? null : fields.get(name);
    }

    public String text(String name) {
        Object value = get(name);
        return value == null ? null : value.toString();
    }
}
