package com.sitemapcrawler.crawl.model;

import java.util.List;
import java.util.Map;

public record CrawlReport(
    String domain,
    long discoveredCount,
    long crawledCount,
    long blockedByRobotsCount,
    long excludedCount,
    int entryCount,
    Map<Integer, Integer> responseCodes,
    Map<Integer, List<String>> markedUrls
) {
    public CrawlReport {
        responseCodes = Map.copyOf(responseCodes);
        markedUrls = Map.copyOf(markedUrls);
    }
}
