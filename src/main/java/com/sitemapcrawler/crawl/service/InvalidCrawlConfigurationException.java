package com.sitemapcrawler.crawl.service;

/**
 * Raised before any network activity when a site configuration cannot be crawled.
 */
public class InvalidCrawlConfigurationException extends IllegalArgumentException {
    public InvalidCrawlConfigurationException(String message) {
        super(message);
    }

    public InvalidCrawlConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
