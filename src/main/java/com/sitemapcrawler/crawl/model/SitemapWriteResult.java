package com.sitemapcrawler.crawl.model;

import java.nio.file.Path;
import java.util.List;

public interface SitemapWriteResult {

    default boolean isWritten() {
        return this instanceof Written;
    }

    /**
     * @param files files written, index first; empty when the sitemap went to standard output
     */
    record Written(List<Path> files, int urlCount) implements SitemapWriteResult {
        public Written {
            files = List.copyOf(files);
        }
    }

    /**
     * The new URL count moved too far from the previous output; nothing was written.
     */
    record DriftExceeded(
        String domain,
        int oldCount,
        int newCount,
        Integer threshold,
        Double thresholdPercent
    ) implements SitemapWriteResult {
        public int diff() {
            return Math.abs(newCount - oldCount);
        }

        public double diffPercent() {
            if (oldCount == 0) {
                return newCount == 0 ? 0.0 : 100.0;
            }
            return diff() * 100.0 / oldCount;
        }
    }

    record EmptySitemap(String domain) implements SitemapWriteResult {
    }
}
