package com.sitemapcrawler.crawl.model;

public enum CrawlPhase {
    SEEDING,
    CRAWLING,
    DRAINING,
    WRITING,
    DONE
}
