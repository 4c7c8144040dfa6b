package com.marketwatch.tracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
    private static final List<String> DEFAULT_USER_AGENTS = List.of(
        DEFAULT_USER_AGENT,
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/119.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:109.0) Gecko/20100101 Firefox/121.0",
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:109.0) Gecko/20100101 Firefox/120.0",
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36 Edg/120.0.0.0",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.1 Safari/605.1.15"
    );
    private static final String DEFAULT_ACCEPT_LANGUAGE = "ja-JP,ja;q=0.9,en-US;q=0.8,en;q=0.7";

    private String userAgent;
    private List<String> userAgents = new ArrayList<>(DEFAULT_USER_AGENTS);
    private String acceptLanguage;
    private int perHostDelayMs = 1000;
    private int globalConcurrency = 5;
    private int searchConcurrency = 3;
    private int requestTimeoutSeconds = 20;
    private int blockedBackoffSeconds = 30;
    private int adapterTimeoutSeconds = 120;
    private int adapterMaxRetries = 2;
    private int adapterRetryBaseDelayMs = 500;
    private int adapterRetryMaxDelayMs = 5000;
    private int pageLimit = 3;
    private int feedRetentionDays = 30;
    private Scheduler scheduler = new Scheduler();
    private Browser browser = new Browser();
    private Notifications notifications = new Notifications();
    private Map<String, Site> sites = new LinkedHashMap<>();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public List<String> getUserAgents() {
        return userAgents;
    }

    public void setUserAgents(List<String> userAgents) {
        List<String> cleaned = new ArrayList<>();
        if (userAgents != null) {
            for (String candidate : userAgents) {
                if (candidate != null && !candidate.isBlank()) {
                    cleaned.add(candidate.trim());
                }
            }
        }
        this.userAgents = cleaned;
    }

    /**
     * A pinned {@code user-agent} wins; otherwise one is drawn at random from the pool for every call.
     */
    public String nextUserAgent() {
        if (userAgent != null && !userAgent.isBlank()) {
            return userAgent.trim();
        }
        List<String> pool = userAgents;
        if (pool == null || pool.isEmpty()) {
            return DEFAULT_USER_AGENT;
        }
        return pool.get(ThreadLocalRandom.current().nextInt(pool.size()));
    }

    public String getAcceptLanguage() {
        if (acceptLanguage == null || acceptLanguage.isBlank()) {
            return DEFAULT_ACCEPT_LANGUAGE;
        }
        return acceptLanguage.trim();
    }

    public void setAcceptLanguage(String acceptLanguage) {
        this.acceptLanguage = acceptLanguage;
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getSearchConcurrency() {
        return Math.max(1, searchConcurrency);
    }

    public void setSearchConcurrency(int searchConcurrency) {
        this.searchConcurrency = Math.max(1, searchConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getBlockedBackoffSeconds() {
        return Math.max(0, blockedBackoffSeconds);
    }

    public void setBlockedBackoffSeconds(int blockedBackoffSeconds) {
        this.blockedBackoffSeconds = blockedBackoffSeconds;
    }

    public int getAdapterTimeoutSeconds() {
        return Math.max(1, adapterTimeoutSeconds);
    }

    public void setAdapterTimeoutSeconds(int adapterTimeoutSeconds) {
        this.adapterTimeoutSeconds = adapterTimeoutSeconds;
    }

    public int getAdapterMaxRetries() {
        return Math.max(0, Math.min(adapterMaxRetries, 5));
    }

    public void setAdapterMaxRetries(int adapterMaxRetries) {
        this.adapterMaxRetries = adapterMaxRetries;
    }

    public int getAdapterRetryBaseDelayMs() {
        return Math.max(0, adapterRetryBaseDelayMs);
    }

    public void setAdapterRetryBaseDelayMs(int adapterRetryBaseDelayMs) {
        this.adapterRetryBaseDelayMs = adapterRetryBaseDelayMs;
    }

    public int getAdapterRetryMaxDelayMs() {
        return Math.max(0, adapterRetryMaxDelayMs);
    }

    public void setAdapterRetryMaxDelayMs(int adapterRetryMaxDelayMs) {
        this.adapterRetryMaxDelayMs = adapterRetryMaxDelayMs;
    }

    public int getPageLimit() {
        return Math.max(1, pageLimit);
    }

    public void setPageLimit(int pageLimit) {
        this.pageLimit = Math.max(1, pageLimit);
    }

    /** Zero disables the feed purge. */
    public int getFeedRetentionDays() {
        return Math.max(0, feedRetentionDays);
    }

    public void setFeedRetentionDays(int feedRetentionDays) {
        this.feedRetentionDays = feedRetentionDays;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Browser getBrowser() {
        return browser;
    }

    public void setBrowser(Browser browser) {
        this.browser = browser;
    }

    public Notifications getNotifications() {
        return notifications;
    }

    public void setNotifications(Notifications notifications) {
        this.notifications = notifications;
    }

    public Map<String, Site> getSites() {
        return sites;
    }

    public void setSites(Map<String, Site> sites) {
        this.sites = sites == null ? new LinkedHashMap<>() : sites;
    }

    public Site siteFor(String siteKey, boolean browserDriven) {
        if (siteKey != null) {
            Site configured = sites.get(siteKey.toLowerCase(Locale.ROOT));
            if (configured == null) {
                configured = sites.get(siteKey.toLowerCase(Locale.ROOT).replace('_', '-'));
            }
            if (configured != null) {
                return configured;
            }
        }
        return browserDriven ? Site.browserDefaults() : Site.staticDefaults();
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Scheduler {
        private boolean enabled = true;
        private boolean runOnStartup = true;
        private int intervalMinutes = 30;
        private int shutdownGraceSeconds = 10;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isRunOnStartup() {
            return runOnStartup;
        }

        public void setRunOnStartup(boolean runOnStartup) {
            this.runOnStartup = runOnStartup;
        }

        public int getIntervalMinutes() {
            return Math.max(1, intervalMinutes);
        }

        public void setIntervalMinutes(int intervalMinutes) {
            this.intervalMinutes = Math.max(1, intervalMinutes);
        }

        public int getShutdownGraceSeconds() {
            return Math.max(1, shutdownGraceSeconds);
        }

        public void setShutdownGraceSeconds(int shutdownGraceSeconds) {
            this.shutdownGraceSeconds = shutdownGraceSeconds;
        }
    }

    public static class Site {
        private boolean enabled = true;
        private double requestsPerSecond = 0.5;
        private int burst = 1;
        private int maxConcurrent = 2;
        private int failureThreshold = 5;
        private int failureWindowMinutes = 10;
        private int cooldownMinutes = 15;

        public static Site staticDefaults() {
            return new Site();
        }

        public static Site browserDefaults() {
            Site site = new Site();
            site.setRequestsPerSecond(0.2);
            site.setMaxConcurrent(1);
            site.setCooldownMinutes(30);
            return site;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public double getRequestsPerSecond() {
            return requestsPerSecond > 0 ? requestsPerSecond : 0.5;
        }

        public void setRequestsPerSecond(double requestsPerSecond) {
            this.requestsPerSecond = requestsPerSecond;
        }

        public int getBurst() {
            return Math.max(1, burst);
        }

        public void setBurst(int burst) {
            this.burst = Math.max(1, burst);
        }

        public int getMaxConcurrent() {
            return Math.max(1, maxConcurrent);
        }

        public void setMaxConcurrent(int maxConcurrent) {
            this.maxConcurrent = Math.max(1, maxConcurrent);
        }

        public int getFailureThreshold() {
            return Math.max(1, failureThreshold);
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = Math.max(1, failureThreshold);
        }

        public int getFailureWindowMinutes() {
            return Math.max(1, failureWindowMinutes);
        }

        public void setFailureWindowMinutes(int failureWindowMinutes) {
            this.failureWindowMinutes = Math.max(1, failureWindowMinutes);
        }

        public int getCooldownMinutes() {
            return Math.max(1, cooldownMinutes);
        }

        public void setCooldownMinutes(int cooldownMinutes) {
            this.cooldownMinutes = Math.max(1, cooldownMinutes);
        }
    }

    public static class Browser {
        private boolean headless = true;
        private int pageLoadTimeoutSeconds = 30;
        private int thinkTimeMinMs = 300;
        private int thinkTimeMaxMs = 1200;
        private int scrollStepPx = 300;
        private int maxScrollSteps = 40;

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }

        public int getPageLoadTimeoutSeconds() {
            return Math.max(1, pageLoadTimeoutSeconds);
        }

        public void setPageLoadTimeoutSeconds(int pageLoadTimeoutSeconds) {
            this.pageLoadTimeoutSeconds = pageLoadTimeoutSeconds;
        }

        public int getThinkTimeMinMs() {
            return Math.max(0, thinkTimeMinMs);
        }

        public void setThinkTimeMinMs(int thinkTimeMinMs) {
            this.thinkTimeMinMs = thinkTimeMinMs;
        }

        public int getThinkTimeMaxMs() {
            return Math.max(getThinkTimeMinMs(), thinkTimeMaxMs);
        }

        public void setThinkTimeMaxMs(int thinkTimeMaxMs) {
            this.thinkTimeMaxMs = thinkTimeMaxMs;
        }

        public int getScrollStepPx() {
            return Math.max(50, scrollStepPx);
        }

        public void setScrollStepPx(int scrollStepPx) {
            this.scrollStepPx = scrollStepPx;
        }

        public int getMaxScrollSteps() {
            return Math.max(1, maxScrollSteps);
        }

        public void setMaxScrollSteps(int maxScrollSteps) {
            this.maxScrollSteps = maxScrollSteps;
        }
    }

    public static class Notifications {
        private boolean emitEmptyEvents = false;
        private Desktop desktop = new Desktop();
        private Webhook webhook = new Webhook();

        public boolean isEmitEmptyEvents() {
            return emitEmptyEvents;
        }

        public void setEmitEmptyEvents(boolean emitEmptyEvents) {
            this.emitEmptyEvents = emitEmptyEvents;
        }

        public Desktop getDesktop() {
            return desktop;
        }

        public void setDesktop(Desktop desktop) {
            this.desktop = desktop;
        }

        public Webhook getWebhook() {
            return webhook;
        }

        public void setWebhook(Webhook webhook) {
            this.webhook = webhook;
        }
    }

    public static class Desktop {
        private boolean enabled = false;
        private int previewLimit = 3;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getPreviewLimit() {
            return Math.max(0, previewLimit);
        }

        public void setPreviewLimit(int previewLimit) {
            this.previewLimit = previewLimit;
        }
    }

    public static class Webhook {
        private boolean enabled = false;
        private String url;
        private int sampleLimit = 5;

        public boolean isEnabled() {
            return enabled && url != null && !url.isBlank();
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public int getSampleLimit() {
            return Math.max(0, Math.min(sampleLimit, 10));
        }

        public void setSampleLimit(int sampleLimit) {
            this.sampleLimit = sampleLimit;
        }
    }
}
