package com.sitemapcrawler.crawl.sitemap;

import com.sitemapcrawler.crawl.model.SitemapEntry;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Serialization of sitemap and sitemap index documents.
 */
public final class SitemapXml {
    public static final String SITEMAP_NAMESPACE = "http://www.sitemaps.org/schemas/sitemap/0.9";
    public static final String IMAGE_NAMESPACE = "http://www.google.com/schemas/sitemap-image/1.1";

    static final String URLSET_HEADER = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
        + "<urlset xmlns=\"" + SITEMAP_NAMESPACE + "\" xmlns:image=\"" + IMAGE_NAMESPACE + "\">";
    static final String URLSET_FOOTER = "</urlset>";
    static final String INDEX_HEADER = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
        + "<sitemapindex xmlns=\"" + SITEMAP_NAMESPACE + "\">";
    static final String INDEX_FOOTER = "</sitemapindex>";

    private static final DateTimeFormatter LASTMOD =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'+00:00'").withZone(ZoneOffset.UTC);

    private SitemapXml() {
    }

    /**
     * Escapes a location for a {@code <loc>} element. Spaces become {@code %20} before the markup
     * characters are replaced, so an existing {@code &amp;} is escaped again.
     */
    public static String escape(String text) {
        return text.replace(" ", "%20")
            .replace("&", "&amp;")
            .replace("\"", "&quot;")
            .replace("<", "&lt;")
            .replace(">", "&gt;");
    }

    public static String urlElement(SitemapEntry entry) {
        StringBuilder sb = new StringBuilder("<url><loc>").append(escape(entry.location())).append("</loc>");
        if (entry.lastModified() != null) {
            sb.append("<lastmod>").append(LASTMOD.format(entry.lastModified())).append("</lastmod>");
        }
        for (String image : entry.images()) {
            sb.append("<image:image><image:loc>").append(escape(image)).append("</image:loc></image:image>");
        }
        return sb.append("</url>").toString();
    }

    public static String indexElement(String sitemapUrl) {
        return "<sitemap><loc>" + sitemapUrl + "</loc></sitemap>";
    }
}
