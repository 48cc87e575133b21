package com.sitemapcrawler.crawl.fetch;

/**
 * Notified with the HTTP status of every response that was received.
 */
@FunctionalInterface
public interface ResponseListener {

    void onResponse(String url, int statusCode);
}
