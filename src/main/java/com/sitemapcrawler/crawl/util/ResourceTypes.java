package com.sitemapcrawler.crawl.util;

import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;

import java.util.Collection;

public final class ResourceTypes {
    private static final Tika TIKA = new Tika();

    private ResourceTypes() {
    }

    /**
     * Infers the media type from the file name alone; nothing is downloaded.
     */
    public static boolean isImage(String path) {
        if (path == null || path.isBlank()) {
            return false;
        }
        String name = path.substring(path.lastIndexOf('/') + 1);
        if (name.isEmpty() || UrlNormalizer.extensionOf(name).isEmpty()) {
            return false;
        }
        MediaType mediaType = MediaType.parse(TIKA.detect(name));
        return mediaType != null && "image".equals(mediaType.getType());
    }

    public static boolean hasNotParseableExtension(String path, Collection<String> extensions) {
        if (path == null || extensions == null) {
            return false;
        }
        for (String extension : extensions) {
            if (!extension.isEmpty() && path.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }
}
