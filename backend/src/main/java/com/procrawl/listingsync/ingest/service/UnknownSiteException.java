package com.procrawl.listingsync.ingest.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class UnknownSiteException extends RuntimeException {
    public UnknownSiteException(String message) {
        super(message);
    }
}
