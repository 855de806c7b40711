package com.procrawl.listingsync.ingest.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class SiteDisabledException extends RuntimeException {
    public SiteDisabledException(String message) {
        super(message);
    }
}
