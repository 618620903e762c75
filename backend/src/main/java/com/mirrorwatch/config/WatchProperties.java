package com.mirrorwatch.config;

import com.mirrorwatch.watch.delivery.ChannelType;
import com.mirrorwatch.watch.model.TrackedAccount;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "watch")
public class WatchProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private String userAgent;
    private List<Account> accounts = new ArrayList<>();
    private String accountList = "";
    private List<ChannelEntry> channels = new ArrayList<>();
    private Scheduler scheduler = new Scheduler();
    private Mirror mirror = new Mirror();
    private Dedup dedup = new Dedup();
    private Delivery delivery = new Delivery();
    private Analysis analysis = new Analysis();
    private Renderer renderer = new Renderer();
    private Archive archive = new Archive();
    private State state = new State();
    private Http http = new Http();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public List<Account> getAccounts() {
        return accounts;
    }

    public void setAccounts(List<Account> accounts) {
        this.accounts = accounts == null ? new ArrayList<>() : accounts;
    }

    public String getAccountList() {
        return accountList;
    }

    public void setAccountList(String accountList) {
        this.accountList = accountList == null ? "" : accountList;
    }

    /**
     * Accounts from the structured list followed by the compact {@code alias:handle,...} form.
     * A handle listed twice is tracked once, under its first alias.
     */
    public List<TrackedAccount> trackedAccounts() {
        Map<String, TrackedAccount> byHandle = new LinkedHashMap<>();
        for (Account account : accounts) {
            if (account == null || account.getHandle() == null || account.getHandle().isBlank()) {
                continue;
            }
            TrackedAccount tracked = TrackedAccount.of(account.getAlias(), account.getHandle());
            byHandle.putIfAbsent(tracked.handle(), tracked);
        }
        for (TrackedAccount tracked : TrackedAccount.parseList(accountList)) {
            byHandle.putIfAbsent(tracked.handle(), tracked);
        }
        return List.copyOf(byHandle.values());
    }

    public List<ChannelEntry> getChannels() {
        return channels;
    }

    public void setChannels(List<ChannelEntry> channels) {
        this.channels = channels == null ? new ArrayList<>() : channels;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Mirror getMirror() {
        return mirror;
    }

    public void setMirror(Mirror mirror) {
        this.mirror = mirror;
    }

    public Dedup getDedup() {
        return dedup;
    }

    public void setDedup(Dedup dedup) {
        this.dedup = dedup;
    }

    public Delivery getDelivery() {
        return delivery;
    }

    public void setDelivery(Delivery delivery) {
        this.delivery = delivery;
    }

    public Analysis getAnalysis() {
        return analysis;
    }

    public void setAnalysis(Analysis analysis) {
        this.analysis = analysis;
    }

    public Renderer getRenderer() {
        return renderer;
    }

    public void setRenderer(Renderer renderer) {
        this.renderer = renderer;
    }

    public Archive getArchive() {
        return archive;
    }

    public void setArchive(Archive archive) {
        this.archive = archive;
    }

    public State getState() {
        return state;
    }

    public void setState(State state) {
        this.state = state;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Account {
        private String alias;
        private String handle;

        public String getAlias() {
            return alias;
        }

        public void setAlias(String alias) {
            this.alias = alias;
        }

        public String getHandle() {
            return handle;
        }

        public void setHandle(String handle) {
            this.handle = handle;
        }
    }

    public static class ChannelEntry {
        private String name;
        private ChannelType type;
        private String key;
        private String url;
        private String tags;
        private boolean enabled = true;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public ChannelType getType() {
            return type;
        }

        public void setType(ChannelType type) {
            this.type = type;
        }

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getTags() {
            return tags;
        }

        public void setTags(String tags) {
            this.tags = tags;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private int pollIntervalSeconds = 300;
        private int accountConcurrency = 2;
        private int maxItemsPerCheck = 3;
        private int maxItemAgeDays = 3;
        private boolean retryWithAlternateEndpoint = true;
        private String timezone = "UTC";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getPollIntervalSeconds() {
            return Math.max(1, pollIntervalSeconds);
        }

        public void setPollIntervalSeconds(int pollIntervalSeconds) {
            this.pollIntervalSeconds = Math.max(1, pollIntervalSeconds);
        }

        public int getAccountConcurrency() {
            return Math.max(1, accountConcurrency);
        }

        public void setAccountConcurrency(int accountConcurrency) {
            this.accountConcurrency = Math.max(1, accountConcurrency);
        }

        public int getMaxItemsPerCheck() {
            return Math.max(1, maxItemsPerCheck);
        }

        public void setMaxItemsPerCheck(int maxItemsPerCheck) {
            this.maxItemsPerCheck = Math.max(1, maxItemsPerCheck);
        }

        public int getMaxItemAgeDays() {
            return maxItemAgeDays;
        }

        public void setMaxItemAgeDays(int maxItemAgeDays) {
            this.maxItemAgeDays = maxItemAgeDays;
        }

        public boolean isRetryWithAlternateEndpoint() {
            return retryWithAlternateEndpoint;
        }

        public void setRetryWithAlternateEndpoint(boolean retryWithAlternateEndpoint) {
            this.retryWithAlternateEndpoint = retryWithAlternateEndpoint;
        }

        public String getTimezone() {
            return timezone == null || timezone.isBlank() ? "UTC" : timezone.trim();
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }
    }

    public static class Mirror {
        private List<String> endpoints = new ArrayList<>();
        private int failureThreshold = 3;
        private int backoffBaseSeconds = 60;
        private int backoffMaxSeconds = 3600;
        private String directoryUrl = "";
        private int directoryRefreshHours = 24;

        public List<String> getEndpoints() {
            return endpoints;
        }

        public void setEndpoints(List<String> endpoints) {
            this.endpoints = endpoints == null ? new ArrayList<>() : endpoints;
        }

        public int getFailureThreshold() {
            return Math.max(1, failureThreshold);
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = Math.max(1, failureThreshold);
        }

        public int getBackoffBaseSeconds() {
            return Math.max(1, backoffBaseSeconds);
        }

        public void setBackoffBaseSeconds(int backoffBaseSeconds) {
            this.backoffBaseSeconds = Math.max(1, backoffBaseSeconds);
        }

        public int getBackoffMaxSeconds() {
            return Math.max(getBackoffBaseSeconds(), backoffMaxSeconds);
        }

        public void setBackoffMaxSeconds(int backoffMaxSeconds) {
            this.backoffMaxSeconds = backoffMaxSeconds;
        }

        public String getDirectoryUrl() {
            return directoryUrl;
        }

        public void setDirectoryUrl(String directoryUrl) {
            this.directoryUrl = directoryUrl == null ? "" : directoryUrl.trim();
        }

        public int getDirectoryRefreshHours() {
            return Math.max(1, directoryRefreshHours);
        }

        public void setDirectoryRefreshHours(int directoryRefreshHours) {
            this.directoryRefreshHours = Math.max(1, directoryRefreshHours);
        }
    }

    public static class Dedup {
        private int maxCacheSize = 1000;
        private boolean similarityEnabled = true;
        private int similarityWindowMinutes = 30;
        private double similarityThreshold = 0.85;

        public int getMaxCacheSize() {
            return Math.max(1, maxCacheSize);
        }

        public void setMaxCacheSize(int maxCacheSize) {
            this.maxCacheSize = Math.max(1, maxCacheSize);
        }

        public boolean isSimilarityEnabled() {
            return similarityEnabled;
        }

        public void setSimilarityEnabled(boolean similarityEnabled) {
            this.similarityEnabled = similarityEnabled;
        }

        public int getSimilarityWindowMinutes() {
            return Math.max(1, similarityWindowMinutes);
        }

        public void setSimilarityWindowMinutes(int similarityWindowMinutes) {
            this.similarityWindowMinutes = Math.max(1, similarityWindowMinutes);
        }

        public double getSimilarityThreshold() {
            return Math.min(1.0, Math.max(0.0, similarityThreshold));
        }

        public void setSimilarityThreshold(double similarityThreshold) {
            this.similarityThreshold = Math.min(1.0, Math.max(0.0, similarityThreshold));
        }
    }

    public static class Delivery {
        private boolean drainEnabled = true;
        private int maxAttempts = 3;
        private long backoffBaseMs = 5000;
        private long backoffMaxMs = 300_000;
        private long drainIntervalMs = 1000;
        private int sendTimeoutSeconds = 30;
        private int workerCount = 2;
        private int deadLetterHistory = 50;

        public boolean isDrainEnabled() {
            return drainEnabled;
        }

        public void setDrainEnabled(boolean drainEnabled) {
            this.drainEnabled = drainEnabled;
        }

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public long getBackoffBaseMs() {
            return Math.max(1L, backoffBaseMs);
        }

        public void setBackoffBaseMs(long backoffBaseMs) {
            this.backoffBaseMs = Math.max(1L, backoffBaseMs);
        }

        public long getBackoffMaxMs() {
            return Math.max(getBackoffBaseMs(), backoffMaxMs);
        }

        public void setBackoffMaxMs(long backoffMaxMs) {
            this.backoffMaxMs = backoffMaxMs;
        }

        public long getDrainIntervalMs() {
            return Math.max(50L, drainIntervalMs);
        }

        public void setDrainIntervalMs(long drainIntervalMs) {
            this.drainIntervalMs = Math.max(50L, drainIntervalMs);
        }

        public int getSendTimeoutSeconds() {
            return Math.max(1, sendTimeoutSeconds);
        }

        public void setSendTimeoutSeconds(int sendTimeoutSeconds) {
            this.sendTimeoutSeconds = Math.max(1, sendTimeoutSeconds);
        }

        public int getWorkerCount() {
            return Math.max(1, workerCount);
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = Math.max(1, workerCount);
        }

        public int getDeadLetterHistory() {
            return Math.max(1, deadLetterHistory);
        }

        public void setDeadLetterHistory(int deadLetterHistory) {
            this.deadLetterHistory = Math.max(1, deadLetterHistory);
        }
    }

    public static class Analysis {
        private boolean enabled = false;
        private String url = "https://api.deepseek.com/chat/completions";
        private String apiKey;
        private String model = "deepseek-chat";
        private String systemPrompt = "";
        private String userPrompt = "{text}";
        private double temperature = 0.7;
        private int maxTokens = 2000;
        private Sections sections = new Sections();

        public boolean isEnabled() {
            return enabled;
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

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getSystemPrompt() {
            return systemPrompt == null ? "" : systemPrompt;
        }

        public void setSystemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
        }

        public String getUserPrompt() {
            return userPrompt == null || userPrompt.isBlank() ? "{text}" : userPrompt;
        }

        public void setUserPrompt(String userPrompt) {
            this.userPrompt = userPrompt;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return Math.max(1, maxTokens);
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = Math.max(1, maxTokens);
        }

        public Sections getSections() {
            return sections;
        }

        public void setSections(Sections sections) {
            this.sections = sections;
        }
    }

    public static class Sections {
        private String translation = "Translation";
        private String summary = "Summary";
        private String tags = "Tags";
        private String category = "Category";

        public String getTranslation() {
            return translation;
        }

        public void setTranslation(String translation) {
            this.translation = translation;
        }

        public String getSummary() {
            return summary;
        }

        public void setSummary(String summary) {
            this.summary = summary;
        }

        public String getTags() {
            return tags;
        }

        public void setTags(String tags) {
            this.tags = tags;
        }

        public String getCategory() {
            return category;
        }

        public void setCategory(String category) {
            this.category = category;
        }
    }

    public static class Renderer {
        private String mode = "direct";
        private String baseUrl = "";
        private String screenshotBaseUrl = "";

        public String getMode() {
            return mode == null || mode.isBlank() ? "direct" : mode.trim();
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl == null ? "" : baseUrl.trim();
        }

        public String getScreenshotBaseUrl() {
            return screenshotBaseUrl;
        }

        public void setScreenshotBaseUrl(String screenshotBaseUrl) {
            this.screenshotBaseUrl = screenshotBaseUrl == null ? "" : screenshotBaseUrl.trim();
        }
    }

    public static class Archive {
        private boolean enabled = true;
        private String dir = "archives";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }
    }

    public static class State {
        private boolean enabled = true;
        private String dir = "data/state";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }
    }

    public static class Http {
        private int requestTimeoutSeconds = 20;
        private int perHostDelayMs = 500;
        private int globalConcurrency = 8;
        private int requestMaxRetries = 0;
        private int requestRetryBaseDelayMs = 500;
        private int requestRetryMaxDelayMs = 5000;

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
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

        public int getRequestMaxRetries() {
            return Math.max(0, requestMaxRetries);
        }

        public void setRequestMaxRetries(int requestMaxRetries) {
            this.requestMaxRetries = Math.max(0, requestMaxRetries);
        }

        public int getRequestRetryBaseDelayMs() {
            return requestRetryBaseDelayMs;
        }

        public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
            this.requestRetryBaseDelayMs = requestRetryBaseDelayMs;
        }

        public int getRequestRetryMaxDelayMs() {
            return requestRetryMaxDelayMs;
        }

        public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
            this.requestRetryMaxDelayMs = requestRetryMaxDelayMs;
        }
    }
}
