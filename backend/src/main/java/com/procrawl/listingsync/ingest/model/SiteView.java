package com.procrawl.listingsync.ingest.model;

import java.util.List;

public record SiteView(
    String name,
    String origin,
    String baseUrl,
    boolean enabled,
    String primaryUrlField,
    List<String> secondaryUrlFields
) {
}
