package com.sitemapcrawler.crawl.model;

import java.time.Instant;
import java.util.List;

public record SitemapEntry(
    String location,
    Instant lastModified,
    List<String> images
) {
    public SitemapEntry {
        images = images == null ? List.of() : List.copyOf(images);
    }

    public static SitemapEntry of(String location) {
        return new SitemapEntry(location, null, List.of());
    }
}
