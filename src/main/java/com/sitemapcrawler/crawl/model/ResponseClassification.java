package com.sitemapcrawler.crawl.model;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of fetching and classifying one frontier URL.
 */
public interface ResponseClassification {

    String url();

    /**
     * A parseable page on the target domain. {@code finalUrl} is the post-redirect location.
     */
    record HtmlPage(String url, String finalUrl, byte[] body, Instant lastModified) implements ResponseClassification {
    }

    record SitemapIndex(String url, List<String> sitemapUrls) implements ResponseClassification {
        public SitemapIndex {
            sitemapUrls = List.copyOf(sitemapUrls);
        }
    }

    record SitemapLeaf(String url, List<String> pageUrls, boolean redirectedToTargetDomain)
        implements ResponseClassification {
        public SitemapLeaf {
            pageUrls = List.copyOf(pageUrls);
        }
    }

    /**
     * Not downloaded because the path names a binary resource; still listed in the sitemap.
     */
    record Unfetched(String url, String reason) implements ResponseClassification {
    }

    record FetchError(String url, int statusCode, String errorCode) implements ResponseClassification {
    }

    /**
     * Fetched but out of scope (foreign host after redirect, non-2xx final status).
     */
    record Dropped(String url, String reason) implements ResponseClassification {
    }
}
