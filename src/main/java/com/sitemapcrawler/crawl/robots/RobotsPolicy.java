package com.sitemapcrawler.crawl.robots;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Robots decision for one crawl run. Any failure while answering falls back to "allowed".
 */
public class RobotsPolicy {
    private static final Logger log = LoggerFactory.getLogger(RobotsPolicy.class);

    private final boolean enabled;
    private final RobotsRules rules;
    private final String userAgent;

    RobotsPolicy(boolean enabled, RobotsRules rules, String userAgent) {
        this.enabled = enabled;
        this.rules = rules;
        this.userAgent = userAgent;
    }

    public static RobotsPolicy disabled() {
        return new RobotsPolicy(false, RobotsRules.allowAll(), "*");
    }

    public static RobotsPolicy failOpen(String userAgent) {
        return new RobotsPolicy(true, RobotsRules.allowAll(), userAgent);
    }

    public static RobotsPolicy of(RobotsRules rules, String userAgent) {
        return new RobotsPolicy(true, rules, userAgent);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isAllowed(String url) {
        if (!enabled) {
            return true;
        }
        try {
            URI uri = new URI(url);
            String path = uri.getRawPath() == null || uri.getRawPath().isBlank() ? "/" : uri.getRawPath();
            if (uri.getRawQuery() != null && !uri.getRawQuery().isBlank()) {
                path = path + "?" + uri.getRawQuery();
            }
            boolean allowed = rules.isAllowed(userAgent, path);
            if (!allowed) {
                log.debug("Crawling of {} disabled by robots.txt", url);
            }
            return allowed;
        } catch (URISyntaxException | RuntimeException e) {
            log.debug("Error evaluating robots.txt for {}: {}", url, e.getMessage());
            return true;
        }
    }
}
