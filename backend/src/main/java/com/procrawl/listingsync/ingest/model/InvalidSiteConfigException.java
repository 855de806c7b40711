package com.procrawl.listingsync.ingest.model;

public class InvalidSiteConfigException extends IllegalArgumentException {
    public InvalidSiteConfigException(String message) {
        super(message);
    }
}
