package com.sitemapcrawler.crawl.model;

import java.net.URI;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    byte[] bodyBytes,
    String contentType,
    String contentEncoding,
    String lastModified,
    String date,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }

    public String lastModifiedOrDate() {
        return lastModified != null ? lastModified : date;
    }
}
