package com.sitemapcrawler.crawl.frontier;

/**
 * Verdict on a discovered link.
 */
public enum Admission {
    QUEUED,
    DUPLICATE,
    BLOCKED_BY_ROBOTS,
    EXCLUDED_BY_POLICY,
    REJECTED;

    public boolean isExclusion() {
        return this == BLOCKED_BY_ROBOTS || this == EXCLUDED_BY_POLICY;
    }
}
