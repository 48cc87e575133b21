package com.sitemapcrawler.crawl.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient URL canonicalization used for frontier deduplication.
 * Every method tolerates malformed input and returns a best-effort result instead of throwing.
 */
public final class UrlNormalizer {
    private static final Logger log = LoggerFactory.getLogger(UrlNormalizer.class);
    private static final Pattern SCHEME = Pattern.compile("^([a-zA-Z][a-zA-Z0-9+.-]*):");
    private static final Pattern LEADING_SLASHES = Pattern.compile("^/+");

    private UrlNormalizer() {
    }

    /**
     * Resolves {@code .} and {@code ..} path segments left to right. A {@code ..} with nothing left
     * to pop is dropped. Query and fragment are carried over untouched.
     */
    public static String normalize(String rawUrl) {
        if (rawUrl == null || rawUrl.isBlank()) {
            return rawUrl;
        }
        UrlParts parts = UrlParts.split(rawUrl.trim());
        String path = resolvePath(parts.path());
        if (parts.authority() == null && path.startsWith("//")) {
            // would be read back as an authority
            path = LEADING_SLASHES.matcher(path).replaceFirst("/");
        }
        return parts.withPath(path).join();
    }

    public static String resolveRelative(String baseUrl, String link) {
        if (link == null) {
            return baseUrl;
        }
        String trimmed = link.trim();
        if (baseUrl == null || baseUrl.isBlank()) {
            return trimmed;
        }
        UrlParts base = UrlParts.split(baseUrl.trim());
        if (trimmed.startsWith("?")) {
            return base.withQuery(null).withFragment(null).join() + trimmed;
        }
        if (base.authority() != null && base.path().isEmpty()) {
            base = base.withPath("/");
        }
        try {
            return new URI(base.join()).resolve(new URI(trimmed)).toString();
        } catch (URISyntaxException | IllegalArgumentException e) {
            log.debug("Falling back to textual resolution for {} against {}: {}", trimmed, baseUrl, e.getMessage());
            return resolveTextually(base, trimmed);
        }
    }

    public static String applyDropPatterns(String url, List<Pattern> patterns) {
        if (url == null || patterns == null) {
            return url;
        }
        String result = url;
        for (Pattern pattern : patterns) {
            result = pattern.matcher(result).replaceAll("");
        }
        return result;
    }

    public static String stripFragment(String url) {
        if (url == null) {
            return null;
        }
        int hash = url.indexOf('#');
        return hash >= 0 ? url.substring(0, hash) : url;
    }

    /**
     * @return lower-cased {@code host[:port]} without user info, or an empty string when there is none
     */
    public static String authorityOf(String url) {
        if (url == null) {
            return "";
        }
        String authority = UrlParts.split(url.trim()).authority();
        if (authority == null) {
            return "";
        }
        int at = authority.lastIndexOf('@');
        if (at >= 0) {
            authority = authority.substring(at + 1);
        }
        return authority.toLowerCase(Locale.ROOT);
    }

    public static String schemeOf(String url) {
        return url == null ? null : UrlParts.split(url.trim()).scheme();
    }

    public static String pathOf(String url) {
        return url == null ? "" : UrlParts.split(url.trim()).path();
    }

    public static String queryOf(String url) {
        if (url == null) {
            return "";
        }
        String query = UrlParts.split(url.trim()).query();
        return query == null ? "" : query;
    }

    /**
     * Moves a URL onto another scheme and host, keeping path, query and fragment.
     */
    public static String rebase(String url, String scheme, String authority) {
        UrlParts parts = UrlParts.split(url.trim());
        return new UrlParts(scheme, authority, parts.path(), parts.query(), parts.fragment()).join();
    }

    /**
     * @return the extension of the last path segment without the dot, or an empty string
     */
    public static String extensionOf(String path) {
        if (path == null || path.isEmpty()) {
            return "";
        }
        String name = path.substring(path.lastIndexOf('/') + 1);
        int start = 0;
        while (start < name.length() && name.charAt(start) == '.') {
            start++;
        }
        int dot = name.lastIndexOf('.');
        if (dot <= start) {
            return "";
        }
        return name.substring(dot + 1);
    }

    static String resolvePath(String path) {
        if (path == null || path.isEmpty()) {
            return "";
        }
        String[] raw = path.split("/", -1);
        List<String> resolved = new ArrayList<>();
        for (int i = 0; i < raw.length; i++) {
            String segment = i < raw.length - 1 ? raw[i] + "/" : raw[i];
            if (segment.equals("../") || segment.equals("..")) {
                if (!resolved.isEmpty()) {
                    resolved.remove(resolved.size() - 1);
                }
            } else if (!segment.equals("./") && !segment.equals(".")) {
                resolved.add(segment);
            }
        }
        return String.join("", resolved);
    }

    private static String resolveTextually(UrlParts base, String link) {
        UrlParts target = UrlParts.split(link);
        if (target.scheme() != null) {
            return link;
        }
        if (target.authority() != null) {
            return base.scheme() == null ? link : base.scheme() + ":" + link;
        }
        String directory = base.path().substring(0, base.path().lastIndexOf('/') + 1);
        String path = target.path().startsWith("/") ? target.path() : directory + target.path();
        return new UrlParts(base.scheme(), base.authority(), path, target.query(), target.fragment()).join();
    }

    record UrlParts(String scheme, String authority, String path, String query, String fragment) {

        static UrlParts split(String url) {
            String rest = url;
            String fragment = null;
            int hash = rest.indexOf('#');
            if (hash >= 0) {
                fragment = rest.substring(hash + 1);
                rest = rest.substring(0, hash);
            }
            String query = null;
            int question = rest.indexOf('?');
            if (question >= 0) {
                query = rest.substring(question + 1);
                rest = rest.substring(0, question);
            }
            String scheme = null;
            Matcher matcher = SCHEME.matcher(rest);
            if (matcher.find()) {
                scheme = matcher.group(1).toLowerCase(Locale.ROOT);
                rest = rest.substring(matcher.end());
            }
            String authority = null;
            if (rest.startsWith("//")) {
                int slash = rest.indexOf('/', 2);
                authority = slash < 0 ? rest.substring(2) : rest.substring(2, slash);
                rest = slash < 0 ? "" : rest.substring(slash);
            }
            return new UrlParts(scheme, authority, rest, query, fragment);
        }

        UrlParts withPath(String newPath) {
            return new UrlParts(scheme, authority, newPath, query, fragment);
        }

        UrlParts withQuery(String newQuery) {
            return new UrlParts(scheme, authority, path, newQuery, fragment);
        }

        UrlParts withFragment(String newFragment) {
            return new UrlParts(scheme, authority, path, query, newFragment);
        }

        String join() {
            StringBuilder sb = new StringBuilder();
            if (scheme != null) {
                sb.append(scheme).append(':');
            }
            if (authority != null) {
                sb.append("//").append(authority.toLowerCase(Locale.ROOT));
                if (!path.isEmpty() && !path.startsWith("/")) {
                    sb.append('/');
                }
            }
            sb.append(path);
            if (query != null && !query.isEmpty()) {
                sb.append('?').append(query);
            }
            if (fragment != null && !fragment.isEmpty()) {
                sb.append('#').append(fragment);
            }
            return sb.toString();
        }
    }
}
