package com.sitemapcrawler.crawl.frontier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * URL bookkeeping for one crawl run: links waiting to be fetched, links already taken by a
 * worker, and links excluded by robots or policy. Every mutation holds the same lock, so the
 * three sets stay pairwise disjoint whenever another thread observes them. A URL taken by a
 * worker never goes back to the queue and an excluded URL is never reconsidered.
 */
public class Frontier {
    private final Object lock = new Object();
    private final Set<String> toCrawl = new LinkedHashSet<>();
    private final Set<String> crawled = new HashSet<>();
    private final Set<String> excluded = new HashSet<>();

    // the domain root is the first discovered URL
    private final AtomicLong discovered = new AtomicLong(1);
    private final AtomicLong blockedByRobots = new AtomicLong();
    private final AtomicLong excludedByPolicy = new AtomicLong();

    public boolean seed(String url) {
        return enqueue(url);
    }

    /**
     * Queues the URL unless it is already known in any state. No screening happens here; callers
     * use it for start URLs and for sitemap files named by an index.
     */
    public boolean enqueue(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        synchronized (lock) {
            if (isKnown(url)) {
                return false;
            }
            toCrawl.add(url);
            return true;
        }
    }

    /**
     * Screens and queues a link in one step. The screen runs only for URLs seen for the first
     * time and its verdict is applied before any other thread can look at the same URL.
     */
    public Admission admit(String url, Supplier<Admission> screen) {
        if (url == null || url.isBlank()) {
            return Admission.REJECTED;
        }
        synchronized (lock) {
            if (isKnown(url)) {
                return Admission.DUPLICATE;
            }
            Admission verdict = screen.get();
            if (verdict == Admission.REJECTED) {
                return verdict;
            }
            discovered.incrementAndGet();
            if (verdict == Admission.QUEUED) {
                toCrawl.add(url);
            } else if (verdict.isExclusion()) {
                recordExclusion(url, verdict);
            }
            return verdict;
        }
    }

    /**
     * Takes a URL that a sitemap declared as final. It leaves the queue, if it was waiting there,
     * and counts as crawled.
     *
     * @return false when the URL was already crawled or excluded
     */
    public boolean claimForOutput(String url) {
        synchronized (lock) {
            if (crawled.contains(url) || excluded.contains(url)) {
                return false;
            }
            toCrawl.remove(url);
            crawled.add(url);
            discovered.incrementAndGet();
            return true;
        }
    }

    /**
     * Records an exclusion. Idempotent; URLs already queued or crawled keep their state.
     *
     * @return true when the URL was newly excluded
     */
    public boolean markExcluded(String url, Admission reason) {
        synchronized (lock) {
            if (toCrawl.contains(url) || crawled.contains(url) || excluded.contains(url)) {
                return false;
            }
            recordExclusion(url, reason);
            return true;
        }
    }

    /**
     * Takes one queued URL and marks it crawled.
     *
     * @return the URL, or {@code null} when the queue is empty
     */
    public String poll() {
        synchronized (lock) {
            Iterator<String> iterator = toCrawl.iterator();
            if (!iterator.hasNext()) {
                return null;
            }
            String url = iterator.next();
            iterator.remove();
            crawled.add(url);
            return url;
        }
    }

    /**
     * Snapshot of everything queued, cleared from the queue and marked crawled in one step.
     * Links queued after this call belong to the next round.
     */
    public List<String> drainRound() {
        synchronized (lock) {
            List<String> batch = new ArrayList<>(toCrawl);
            toCrawl.clear();
            crawled.addAll(batch);
            return batch;
        }
    }

    public boolean isEmpty() {
        synchronized (lock) {
            return toCrawl.isEmpty();
        }
    }

    public boolean isQueued(String url) {
        synchronized (lock) {
            return toCrawl.contains(url);
        }
    }

    public boolean isCrawledOrCrawling(String url) {
        synchronized (lock) {
            return crawled.contains(url);
        }
    }

    public boolean isExcluded(String url) {
        synchronized (lock) {
            return excluded.contains(url);
        }
    }

    public boolean isDisjoint() {
        synchronized (lock) {
            return Collections.disjoint(toCrawl, crawled)
                && Collections.disjoint(toCrawl, excluded)
                && Collections.disjoint(crawled, excluded);
        }
    }

    public int crawledCount() {
        synchronized (lock) {
            return crawled.size();
        }
    }

    public long discoveredCount() {
        return discovered.get();
    }

    public long blockedByRobotsCount() {
        return blockedByRobots.get();
    }

    public long excludedByPolicyCount() {
        return excludedByPolicy.get();
    }

    private boolean isKnown(String url) {
        return toCrawl.contains(url) || crawled.contains(url) || excluded.contains(url);
    }

    private void recordExclusion(String url, Admission reason) {
        if (!excluded.add(url)) {
            return;
        }
        if (reason == Admission.BLOCKED_BY_ROBOTS) {
            blockedByRobots.incrementAndGet();
        } else {
            excludedByPolicy.incrementAndGet();
        }
    }
}
