package com.procrawl.listingsync.ingest.model;

/**
 * How a numeric listing field is written on the source site.
 */
public enum NumericFormat {
    /** {@code R$ 3.100,00}: dot groups thousands, comma separates decimals. */
    BRAZILIAN_CURRENCY,
    INTEGER,
    DECIMAL
}
