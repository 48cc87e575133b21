package com.sitemapcrawler.crawl;

import com.sitemapcrawler.config.CrawlerProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrawlerPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("sitemap-crawler/0.1"));
    }

    @Test
    void timeoutsAndLimitsAreClamped() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setRequestTimeoutSeconds(0);
        properties.setPerHostDelayMs(-10);
        properties.setRequestMaxRetries(-1);
        properties.setMaxBodyBytes(0);
        properties.setMaxSitemapDepth(-3);
        assertEquals(1, properties.getRequestTimeoutSeconds());
        assertEquals(0, properties.getPerHostDelayMs());
        assertEquals(0, properties.getRequestMaxRetries());
        assertEquals(1, properties.getMaxBodyBytes());
        assertEquals(0, properties.getMaxSitemapDepth());
    }

    @Test
    void siteRobotsUserAgentDefaultsToWildcard() {
        CrawlerProperties.Site site = new CrawlerProperties.Site();
        site.setUserAgent(" ");
        assertEquals("*", site.getUserAgent());
        assertTrue(site.isRejectEmpty());
        assertTrue(site.isSortAlphabetically());
    }
}
