package com.procrawl.listingsync.ingest.api;

import com.procrawl.listingsync.ingest.service.SiteDisabledException;
import com.procrawl.listingsync.ingest.service.SyncIncompleteException;
import com.procrawl.listingsync.ingest.service.UnknownSiteException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class SyncExceptionHandler {

  @ExceptionHandler(UnknownSiteException.class)
  public ResponseEntity<Map<String, String>> handleUnknownSite(UnknownSiteException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "unknown_site", "message", ex.getMessage()));
  }

  @ExceptionHandler(SiteDisabledException.class)
  public ResponseEntity<Map<String, String>> handleDisabledSite(SiteDisabledException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "site_disabled", "message", ex.getMessage()));
  }

  @ExceptionHandler(SyncIncompleteException.class)
  public ResponseEntity<Map<String, Object>> handleIncompleteSync(SyncIncompleteException ex) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", "store_unavailable");
    body.put("message", ex.getMessage());
    body.put("pendingKeys", ex.getPendingKeys());
    body.put("partialReport", ex.getPartialReport());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
  }
}
