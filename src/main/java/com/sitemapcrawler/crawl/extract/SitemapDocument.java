package com.sitemapcrawler.crawl.extract;

import java.util.List;

public record SitemapDocument(Kind kind, List<String> locations) {

    public enum Kind {
        INDEX,
        URLSET,
        NOT_A_SITEMAP
    }

    public static SitemapDocument notASitemap() {
        return new SitemapDocument(Kind.NOT_A_SITEMAP, List.of());
    }
}
