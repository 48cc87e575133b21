package com.sitemapcrawler.crawl.extract;

import com.sitemapcrawler.crawl.frontier.Admission;
import com.sitemapcrawler.crawl.model.CrawlContext;
import com.sitemapcrawler.crawl.robots.RobotsPolicy;
import com.sitemapcrawler.crawl.util.ResourceTypes;
import com.sitemapcrawler.crawl.util.UrlNormalizer;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Turns raw {@code href} and {@code src} values into absolute same-domain URLs and decides which
 * of them may enter the frontier.
 */
@Component
public class LinkScreener {
    private static final Logger log = LoggerFactory.getLogger(LinkScreener.class);

    /**
     * Makes a link absolute against the page it was found on.
     *
     * @param pageUrl post-redirect URL of the page
     * @return the canonical link, or {@code null} for links that never name a page
     */
    public String normalizeLink(String pageUrl, String rawLink, CrawlContext context) {
        if (rawLink == null) {
            return null;
        }
        String link = Parser.unescapeEntities(rawLink.trim(), true);
        if (link.isEmpty()) {
            return null;
        }
        String pageScheme = UrlNormalizer.schemeOf(pageUrl);
        String pageAuthority = UrlNormalizer.authorityOf(pageUrl);
        String lower = link.toLowerCase(Locale.ROOT);

        String absolute;
        if (link.startsWith("//")) {
            absolute = pageScheme + ":" + link;
        } else if (link.startsWith("/")) {
            absolute = pageScheme + "://" + pageAuthority + link;
        } else if (link.startsWith("#")) {
            absolute = pageScheme + "://" + pageAuthority + UrlNormalizer.pathOf(pageUrl) + link;
        } else if (lower.startsWith("mailto") || lower.startsWith("tel")) {
            return null;
        } else if (!lower.startsWith("http")) {
            absolute = UrlNormalizer.resolveRelative(pageUrl, link);
        } else {
            absolute = link;
        }

        String cleaned = UrlNormalizer.stripFragment(UrlNormalizer.normalize(absolute));
        cleaned = UrlNormalizer.applyDropPatterns(cleaned, context.dropPatterns());
        return toTargetHost(cleaned, context);
    }

    /**
     * Candidate rules followed by the robots, extension and substring policies. Only
     * {@link Admission#QUEUED} links are crawled; the two exclusion verdicts are remembered by
     * the frontier and {@link Admission#REJECTED} links are forgotten.
     */
    public Admission screen(String url, CrawlContext context, RobotsPolicy robots) {
        if (!isCandidate(url, context)) {
            return Admission.REJECTED;
        }
        if (!robots.isAllowed(url)) {
            return Admission.BLOCKED_BY_ROBOTS;
        }
        String extension = UrlNormalizer.extensionOf(UrlNormalizer.pathOf(url));
        if (!extension.isEmpty() && context.skipExtensions().contains(extension)) {
            log.debug("Skipping {} extension={}", url, extension);
            return Admission.EXCLUDED_BY_POLICY;
        }
        if (!context.passesExclusions(url)) {
            log.debug("Skipping {} matched an exclusion", url);
            return Admission.EXCLUDED_BY_POLICY;
        }
        return Admission.QUEUED;
    }

    public boolean isCandidate(String url, CrawlContext context) {
        if (url == null || url.isEmpty()) {
            return false;
        }
        if (!context.isTargetHost(UrlNormalizer.authorityOf(url))) {
            return false;
        }
        String path = UrlNormalizer.pathOf(url);
        if ((path.isEmpty() || path.equals("/")) && UrlNormalizer.queryOf(url).isEmpty()) {
            return false;
        }
        if (url.contains("javascript")) {
            return false;
        }
        if (ResourceTypes.isImage(path)) {
            return false;
        }
        return !path.startsWith("data:");
    }

    /**
     * Completes an image source to an absolute URL and applies the same scope checks as links.
     *
     * @return the image URL to list, or {@code null} when it is skipped
     */
    public String resolveImage(String pageUrl, String rawSource, CrawlContext context, RobotsPolicy robots) {
        if (rawSource == null) {
            return null;
        }
        String source = Parser.unescapeEntities(rawSource.trim(), true);
        if (source.isEmpty() || source.startsWith("data:")) {
            return null;
        }
        String image;
        if (source.startsWith("//")) {
            image = UrlNormalizer.schemeOf(pageUrl) + ":" + source;
        } else if (!source.toLowerCase(Locale.ROOT).startsWith("http")) {
            String path = source.startsWith("/") ? source : "/" + source;
            image = context.baseUrl() + path.replace("./", "/");
        } else {
            image = source;
        }
        if (!context.passesExclusions(image)) {
            return null;
        }
        image = toTargetHost(image, context);
        if (image == null || !context.isTargetHost(UrlNormalizer.authorityOf(image))) {
            return null;
        }
        if (!robots.isAllowed(image)) {
            return null;
        }
        log.debug("Found image {}", image);
        return image;
    }

    /**
     * Moves links on an alias host onto the canonical scheme and host.
     */
    public String toTargetHost(String url, CrawlContext context) {
        if (url == null) {
            return null;
        }
        String authority = UrlNormalizer.authorityOf(url);
        if (context.isAliasHost(authority)) {
            return UrlNormalizer.rebase(url, context.scheme(), context.targetHost());
        }
        return url;
    }
}
