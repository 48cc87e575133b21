package com.sitemapcrawler.crawl.model;

import com.sitemapcrawler.config.CrawlerProperties;
import com.sitemapcrawler.crawl.service.InvalidCrawlConfigurationException;
import com.sitemapcrawler.crawl.util.UrlNormalizer;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable settings of one crawl run.
 *
 * @param targetHost lower-cased {@code host[:port]} of the domain; links must match it (or an alias)
 * @param output     sitemap file, or {@code null} to print the sitemap to standard output
 */
public record CrawlContext(
    String domain,
    String scheme,
    String targetHost,
    List<String> sitemapUrls,
    boolean sitemapOnly,
    int numWorkers,
    boolean parseRobots,
    String robotsUserAgent,
    Path output,
    boolean asIndex,
    boolean sortAlphabetically,
    List<String> exclude,
    List<String> skipExtensions,
    List<Pattern> dropPatterns,
    boolean images,
    boolean auth,
    boolean report,
    Integer maxUrlDiff,
    Double maxUrlDiffPercent,
    boolean rejectEmpty,
    Set<String> domainAliases,
    List<String> notParseableExtensions,
    int maxSitemapDepth
) {
    public CrawlContext {
        sitemapUrls = List.copyOf(sitemapUrls);
        exclude = List.copyOf(exclude);
        skipExtensions = List.copyOf(skipExtensions);
        dropPatterns = List.copyOf(dropPatterns);
        domainAliases = Set.copyOf(domainAliases);
        notParseableExtensions = List.copyOf(notParseableExtensions);
    }

    public static CrawlContext from(CrawlerProperties.Site site, CrawlerProperties properties) {
        String domain = site.getDomain() == null ? "" : site.getDomain().trim();
        if (domain.isEmpty()) {
            throw new InvalidCrawlConfigurationException("A domain is required to crawl");
        }
        String scheme = UrlNormalizer.schemeOf(domain);
        String host = UrlNormalizer.authorityOf(domain);
        if (scheme == null || (!scheme.equals("http") && !scheme.equals("https")) || host.isEmpty()) {
            throw new InvalidCrawlConfigurationException("Invalid domain: " + domain);
        }
        if (site.getNumWorkers() <= 0) {
            throw new InvalidCrawlConfigurationException("Number of workers must be positive, got " + site.getNumWorkers());
        }
        String output = site.getOutput();
        if (site.isAsIndex() && (output == null || output.isBlank())) {
            throw new InvalidCrawlConfigurationException(
                "When specifying an index file as an output option, you must include an output file name");
        }
        if (site.getMaxUrlDiff() != null && site.getMaxUrlDiff() < 0) {
            throw new InvalidCrawlConfigurationException("max-url-diff must not be negative");
        }
        if (site.getMaxUrlDiffPercent() != null && site.getMaxUrlDiffPercent() < 0) {
            throw new InvalidCrawlConfigurationException("max-url-diff-percent must not be negative");
        }

        List<Pattern> dropPatterns = new ArrayList<>();
        for (String drop : site.getDrop()) {
            try {
                dropPatterns.add(Pattern.compile(drop));
            } catch (PatternSyntaxException e) {
                throw new InvalidCrawlConfigurationException("Invalid drop pattern: " + drop, e);
            }
        }
        Set<String> aliases = new LinkedHashSet<>();
        for (String alias : site.getDomainAliases()) {
            String aliasHost = alias.contains("://") ? UrlNormalizer.authorityOf(alias) : alias.trim().toLowerCase(Locale.ROOT);
            if (!aliasHost.isEmpty() && !aliasHost.equals(host)) {
                aliases.add(aliasHost);
            }
        }
        List<String> skipExtensions = site.getSkipExt().stream()
            .map(ext -> ext.startsWith(".") ? ext.substring(1) : ext)
            .toList();

        return new CrawlContext(
            domain,
            scheme,
            host,
            site.getSitemapUrls().stream().filter(url -> url != null && !url.isBlank()).map(String::trim).toList(),
            site.isSitemapOnly(),
            site.getNumWorkers(),
            site.isParseRobots(),
            site.getUserAgent(),
            output == null || output.isBlank() ? null : Path.of(output.trim()),
            site.isAsIndex(),
            site.isSortAlphabetically(),
            site.getExclude(),
            skipExtensions,
            dropPatterns,
            site.isImages(),
            site.isAuth(),
            site.isReport(),
            site.getMaxUrlDiff(),
            site.getMaxUrlDiffPercent(),
            site.isRejectEmpty(),
            aliases,
            properties.getNotParseableExtensions(),
            properties.getMaxSitemapDepth()
        );
    }

    /**
     * @return {@code scheme://host[:port]} without a trailing slash
     */
    public String baseUrl() {
        return scheme + "://" + targetHost;
    }

    public boolean isTargetHost(String authority) {
        return targetHost.equals(authority);
    }

    public boolean isAliasHost(String authority) {
        return domainAliases.contains(authority);
    }

    /**
     * @return true when the URL contains none of the configured exclusion substrings
     */
    public boolean passesExclusions(String url) {
        for (String excluded : exclude) {
            if (url.contains(excluded)) {
                return false;
            }
        }
        return true;
    }
}
