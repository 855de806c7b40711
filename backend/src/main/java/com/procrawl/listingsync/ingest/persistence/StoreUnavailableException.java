package com.procrawl.listingsync.ingest.persistence;

public class StoreUnavailableException extends RuntimeException {
    private final String identityKey;

    public StoreUnavailableException(String message, String identityKey, Throwable cause) {
        super(message, cause);
        this.identityKey = identityKey;
    }

    public String getIdentityKey() {
        return identityKey;
    }
}
