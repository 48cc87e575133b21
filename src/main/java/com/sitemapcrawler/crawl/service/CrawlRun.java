package com.sitemapcrawler.crawl.service;

import com.sitemapcrawler.crawl.frontier.Frontier;
import com.sitemapcrawler.crawl.model.CrawlContext;
import com.sitemapcrawler.crawl.model.CrawlPhase;
import com.sitemapcrawler.crawl.model.CrawlReport;
import com.sitemapcrawler.crawl.model.SitemapEntry;
import com.sitemapcrawler.crawl.robots.RobotsPolicy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Mutable state of one crawl. Owned by a single orchestrator call and shared only with the
 * workers of that call.
 */
public class CrawlRun {
    private final CrawlContext context;
    private final RobotsPolicy robots;
    private final Frontier frontier = new Frontier();
    private final Queue<SitemapEntry> entries = new ConcurrentLinkedQueue<>();
    private final Set<String> entryLocations = ConcurrentHashMap.newKeySet();
    private final AtomicLong crawlCounter = new AtomicLong();
    private final Map<Integer, AtomicInteger> responseCodes = new ConcurrentHashMap<>();
    private final Map<Integer, List<String>> markedUrls = new ConcurrentHashMap<>();
    private final Map<String, Integer> sitemapDepths = new ConcurrentHashMap<>();
    private volatile CrawlPhase phase = CrawlPhase.SEEDING;

    public CrawlRun(CrawlContext context, RobotsPolicy robots) {
        this.context = context;
        this.robots = robots;
    }

    public CrawlContext context() {
        return context;
    }

    public RobotsPolicy robots() {
        return robots;
    }

    public Frontier frontier() {
        return frontier;
    }

    public CrawlPhase phase() {
        return phase;
    }

    void moveTo(CrawlPhase next) {
        this.phase = next;
    }

    /**
     * Appends an output entry; a second entry for the same location is ignored.
     */
    public boolean addEntry(SitemapEntry entry) {
        if (!entryLocations.add(entry.location())) {
            return false;
        }
        entries.add(entry);
        return true;
    }

    public List<SitemapEntry> entries() {
        return new ArrayList<>(entries);
    }

    long nextCrawlNumber() {
        return crawlCounter.getAndIncrement();
    }

    public void recordStatus(String url, int statusCode) {
        responseCodes.computeIfAbsent(statusCode, ignored -> new AtomicInteger()).incrementAndGet();
        if (context.report() && statusCode >= 400) {
            markedUrls.computeIfAbsent(statusCode, ignored -> Collections.synchronizedList(new ArrayList<>())).add(url);
        }
    }

    /**
     * Nesting level of a sitemap file; seeds and pages are level 0.
     */
    int sitemapDepth(String url) {
        return sitemapDepths.getOrDefault(url, 0);
    }

    void recordSitemapDepth(String url, int depth) {
        sitemapDepths.merge(url, depth, Math::min);
    }

    public CrawlReport toReport() {
        Map<Integer, Integer> codes = new TreeMap<>();
        responseCodes.forEach((code, count) -> codes.put(code, count.get()));
        Map<Integer, List<String>> marked = new TreeMap<>();
        markedUrls.forEach((code, urls) -> {
            synchronized (urls) {
                marked.put(code, List.copyOf(urls));
            }
        });
        return new CrawlReport(
            context.domain(),
            frontier.discoveredCount(),
            crawlCounter.get(),
            frontier.blockedByRobotsCount(),
            frontier.excludedByPolicyCount(),
            entries.size(),
            codes,
            marked
        );
    }
}
