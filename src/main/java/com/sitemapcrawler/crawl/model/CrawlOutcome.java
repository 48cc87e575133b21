package com.sitemapcrawler.crawl.model;

public record CrawlOutcome(
    CrawlReport report,
    SitemapWriteResult writeResult
) {
}
