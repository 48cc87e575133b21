package com.sitemapcrawler.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonFormat;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT = "sitemap-crawler/0.1 (+https://github.com/sitemap-crawler)";
    private static final List<String> DEFAULT_NOT_PARSEABLE_EXTENSIONS = List.of(
        ".epub", ".mobi", ".xlsx", ".docx", ".doc", ".opf", ".7z", ".ibooks", ".cbr", ".avi", ".mkv", ".mp4",
        ".jpg", ".jpeg", ".png", ".gif", ".iso", ".rar", ".tar", ".tgz", ".zip", ".dmg", ".exe", ".pdf"
    );

    private String userAgent;
    private int requestTimeoutSeconds = 20;
    private int requestMaxRetries = 0;
    private int requestRetryBaseDelayMs = 250;
    private int requestRetryMaxDelayMs = 2000;
    private int perHostDelayMs = 0;
    private int maxBodyBytes = 10_000_000;
    private int maxSitemapDepth = 5;
    private List<String> notParseableExtensions = new ArrayList<>(DEFAULT_NOT_PARSEABLE_EXTENSIONS);
    private Auth auth = new Auth();
    private Cli cli = new Cli();
    private List<Site> sites = new ArrayList<>();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public int getRequestRetryBaseDelayMs() {
        return Math.max(0, requestRetryBaseDelayMs);
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = Math.max(0, requestRetryBaseDelayMs);
    }

    public int getRequestRetryMaxDelayMs() {
        return Math.max(0, requestRetryMaxDelayMs);
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = Math.max(0, requestRetryMaxDelayMs);
    }

    public int getPerHostDelayMs() {
        return Math.max(0, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(0, perHostDelayMs);
    }

    public int getMaxBodyBytes() {
        return Math.max(1, maxBodyBytes);
    }

    public void setMaxBodyBytes(int maxBodyBytes) {
        this.maxBodyBytes = Math.max(1, maxBodyBytes);
    }

    public int getMaxSitemapDepth() {
        return Math.max(0, maxSitemapDepth);
    }

    public void setMaxSitemapDepth(int maxSitemapDepth) {
        this.maxSitemapDepth = Math.max(0, maxSitemapDepth);
    }

    public List<String> getNotParseableExtensions() {
        return notParseableExtensions;
    }

    public void setNotParseableExtensions(List<String> notParseableExtensions) {
        this.notParseableExtensions = notParseableExtensions == null ? new ArrayList<>() : notParseableExtensions;
    }

    public Auth getAuth() {
        return auth;
    }

    public void setAuth(Auth auth) {
        this.auth = auth;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public List<Site> getSites() {
        return sites;
    }

    public void setSites(List<Site> sites) {
        this.sites = sites == null ? new ArrayList<>() : sites;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Auth {
        private String username = "";
        private String password = "";

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username == null ? "" : username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password == null ? "" : password;
        }
    }

    public static class Cli {
        private boolean run;
        private String configFile;
        private String failuresFile = "sitemap_failures.txt";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getConfigFile() {
            return configFile;
        }

        public void setConfigFile(String configFile) {
            this.configFile = configFile;
        }

        public String getFailuresFile() {
            return failuresFile;
        }

        public void setFailuresFile(String failuresFile) {
            this.failuresFile = failuresFile;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }

    /**
     * One crawl target. Bound from {@code crawler.sites[n]} or read from a JSON batch file,
     * where the snake_case keys of the batch format are accepted as aliases.
     */
    public static class Site {
        private String domain = "";
        @JsonAlias("sitemap_url")
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
        private List<String> sitemapUrls = new ArrayList<>();
        private boolean sitemapOnly;
        private int numWorkers = 1;
        @JsonAlias("parserobots")
        private boolean parseRobots;
        private String userAgent = "*";
        private String output;
        private boolean asIndex;
        private boolean sortAlphabetically = true;
        private List<String> exclude = new ArrayList<>();
        @JsonAlias("skipext")
        private List<String> skipExt = new ArrayList<>();
        private List<String> drop = new ArrayList<>();
        private boolean images;
        private boolean auth;
        private boolean report;
        private Integer maxUrlDiff;
        private Double maxUrlDiffPercent;
        private boolean rejectEmpty = true;
        private List<String> domainAliases = new ArrayList<>();

        public String getDomain() {
            return domain;
        }

        public void setDomain(String domain) {
            this.domain = domain == null ? "" : domain;
        }

        public List<String> getSitemapUrls() {
            return sitemapUrls;
        }

        public void setSitemapUrls(List<String> sitemapUrls) {
            this.sitemapUrls = sitemapUrls == null ? new ArrayList<>() : sitemapUrls;
        }

        public boolean isSitemapOnly() {
            return sitemapOnly;
        }

        public void setSitemapOnly(boolean sitemapOnly) {
            this.sitemapOnly = sitemapOnly;
        }

        public int getNumWorkers() {
            return numWorkers;
        }

        public void setNumWorkers(int numWorkers) {
            this.numWorkers = numWorkers;
        }

        public boolean isParseRobots() {
            return parseRobots;
        }

        public void setParseRobots(boolean parseRobots) {
            this.parseRobots = parseRobots;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent == null || userAgent.isBlank() ? "*" : userAgent.trim();
        }

        public String getOutput() {
            return output;
        }

        public void setOutput(String output) {
            this.output = output;
        }

        public boolean isAsIndex() {
            return asIndex;
        }

        public void setAsIndex(boolean asIndex) {
            this.asIndex = asIndex;
        }

        public boolean isSortAlphabetically() {
            return sortAlphabetically;
        }

        public void setSortAlphabetically(boolean sortAlphabetically) {
            this.sortAlphabetically = sortAlphabetically;
        }

        public List<String> getExclude() {
            return exclude;
        }

        public void setExclude(List<String> exclude) {
            this.exclude = exclude == null ? new ArrayList<>() : exclude;
        }

        public List<String> getSkipExt() {
            return skipExt;
        }

        public void setSkipExt(List<String> skipExt) {
            this.skipExt = skipExt == null ? new ArrayList<>() : skipExt;
        }

        public List<String> getDrop() {
            return drop;
        }

        public void setDrop(List<String> drop) {
            this.drop = drop == null ? new ArrayList<>() : drop;
        }

        public boolean isImages() {
            return images;
        }

        public void setImages(boolean images) {
            this.images = images;
        }

        public boolean isAuth() {
            return auth;
        }

        public void setAuth(boolean auth) {
            this.auth = auth;
        }

        public boolean isReport() {
            return report;
        }

        public void setReport(boolean report) {
            this.report = report;
        }

        public Integer getMaxUrlDiff() {
            return maxUrlDiff;
        }

        public void setMaxUrlDiff(Integer maxUrlDiff) {
            this.maxUrlDiff = maxUrlDiff;
        }

        public Double getMaxUrlDiffPercent() {
            return maxUrlDiffPercent;
        }

        public void setMaxUrlDiffPercent(Double maxUrlDiffPercent) {
            this.maxUrlDiffPercent = maxUrlDiffPercent;
        }

        public boolean isRejectEmpty() {
            return rejectEmpty;
        }

        public void setRejectEmpty(boolean rejectEmpty) {
            this.rejectEmpty = rejectEmpty;
        }

        public List<String> getDomainAliases() {
            return domainAliases;
        }

        public void setDomainAliases(List<String> domainAliases) {
            this.domainAliases = domainAliases == null ? new ArrayList<>() : domainAliases;
        }
    }
}
