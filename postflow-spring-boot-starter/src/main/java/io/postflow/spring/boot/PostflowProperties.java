package io.postflow.spring.boot;

import io.postflow.Platform;
import io.postflow.PostflowConfig;
import io.postflow.platforms.FacebookPublisher;
import io.postflow.platforms.LinkedInPublisher;
import io.postflow.platforms.MetaTokenRefresher;
import io.postflow.platforms.TwitterPublisher;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the postflow dispatcher.
 *
 * @see PostflowAutoConfiguration
 */
@ConfigurationProperties(prefix = "postflow")
public class PostflowProperties {

    /**
     * Start polling once the application is ready.
     */
    private boolean autoStart = true;

    /**
     * Create the postflow tables on startup if they do not exist.
     */
    private boolean initializeSchema = false;

    private final Dispatcher dispatcher = new Dispatcher();
    private final Retry retry = new Retry();
    private final Vault vault = new Vault();
    private final Events events = new Events();
    private final Metrics metrics = new Metrics();
    private final Platforms platforms = new Platforms();

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public Retry getRetry() {
        return retry;
    }

    public Vault getVault() {
        return vault;
    }

    public Events getEvents() {
        return events;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public Platforms getPlatforms() {
        return platforms;
    }

    /**
     * Converts the bound values into the immutable engine configuration.
     *
     * @throws IllegalArgumentException if a value is out of range or a concurrency key names no platform
     */
    public PostflowConfig toConfig() {
        PostflowConfig.Builder builder = PostflowConfig.builder()
                .tickInterval(dispatcher.getTickInterval())
                .batchSize(dispatcher.getBatchSize())
                .leaseDuration(dispatcher.getLeaseDuration())
                .callTimeout(dispatcher.getCallTimeout())
                .workerCount(dispatcher.getWorkerCount())
                .maxAttempts(retry.getMaxAttempts())
                .backoffBase(retry.getBackoffBase())
                .backoffMultiplier(retry.getBackoffMultiplier())
                .backoffMax(retry.getBackoffMax())
                .tokenSafetyMargin(vault.getTokenSafetyMargin())
                .eventDeliveryAttempts(events.getDeliveryAttempts())
                .eventQueueCapacity(events.getQueueCapacity())
                .eventRedeliveryDelay(events.getRedeliveryDelay())
                .drainTimeout(dispatcher.getDrainTimeout());
        dispatcher.getPlatformConcurrency()
                .forEach((tag, cap) -> builder.platformConcurrency(Platform.fromTag(tag), cap));
        if (dispatcher.getWorkerId() != null && !dispatcher.getWorkerId().isBlank()) {
            builder.workerId(dispatcher.getWorkerId());
        }
        return builder.build();
    }

    public static class Dispatcher {
        private Duration tickInterval = Duration.ofSeconds(5);
        private int batchSize = 50;
        private Duration leaseDuration = Duration.ofMinutes(5);
        private Duration callTimeout = Duration.ofSeconds(30);
        private int workerCount = 4;
        private Duration drainTimeout = Duration.ofSeconds(5);

        /**
         * Lease owner id; generated when empty. Must be unique per running dispatcher.
         */
        private String workerId;

        /**
         * Per-platform cap on concurrent attempts, keyed by platform tag (e.g. {@code twitter: 2}).
         */
        private Map<String, Integer> platformConcurrency = new LinkedHashMap<>();

        public Duration getTickInterval() {
            return tickInterval;
        }

        public void setTickInterval(Duration tickInterval) {
            this.tickInterval = tickInterval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getLeaseDuration() {
            return leaseDuration;
        }

        public void setLeaseDuration(Duration leaseDuration) {
            this.leaseDuration = leaseDuration;
        }

        public Duration getCallTimeout() {
            return callTimeout;
        }

        public void setCallTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
        }

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public Duration getDrainTimeout() {
            return drainTimeout;
        }

        public void setDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
        }

        public String getWorkerId() {
            return workerId;
        }

        public void setWorkerId(String workerId) {
            this.workerId = workerId;
        }

        public Map<String, Integer> getPlatformConcurrency() {
            return platformConcurrency;
        }

        public void setPlatformConcurrency(Map<String, Integer> platformConcurrency) {
            this.platformConcurrency = platformConcurrency;
        }
    }

    public static class Retry {
        private int maxAttempts = 5;
        private Duration backoffBase = Duration.ofSeconds(30);
        private double backoffMultiplier = 2.0;
        private Duration backoffMax = Duration.ofMinutes(5);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBackoffBase() {
            return backoffBase;
        }

        public void setBackoffBase(Duration backoffBase) {
            this.backoffBase = backoffBase;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public Duration getBackoffMax() {
            return backoffMax;
        }

        public void setBackoffMax(Duration backoffMax) {
            this.backoffMax = backoffMax;
        }
    }

    public static class Vault {
        /**
         * Secret the AES-256 token encryption key is derived from. Required.
         */
        private String secret;

        /**
         * Key derivation salt. Changing it makes stored tokens unreadable.
         */
        private String salt = "postflow";

        private Duration tokenSafetyMargin = Duration.ofMinutes(5);

        public String getSecret() {
            return secret;
        }

        public void setSecret(String secret) {
            this.secret = secret;
        }

        public String getSalt() {
            return salt;
        }

        public void setSalt(String salt) {
            this.salt = salt;
        }

        public Duration getTokenSafetyMargin() {
            return tokenSafetyMargin;
        }

        public void setTokenSafetyMargin(Duration tokenSafetyMargin) {
            this.tokenSafetyMargin = tokenSafetyMargin;
        }
    }

    public static class Events {
        private int deliveryAttempts = 3;
        private int queueCapacity = 1000;
        private Duration redeliveryDelay = Duration.ofMinutes(1);

        public int getDeliveryAttempts() {
            return deliveryAttempts;
        }

        public void setDeliveryAttempts(int deliveryAttempts) {
            this.deliveryAttempts = deliveryAttempts;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        /**
         * How long a terminal event may go unacknowledged before it is emitted again.
         */
        public Duration getRedeliveryDelay() {
            return redeliveryDelay;
        }

        public void setRedeliveryDelay(Duration redeliveryDelay) {
            this.redeliveryDelay = redeliveryDelay;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "postflow";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }

    public static class Platforms {
        private final OAuthPlatform twitter = new OAuthPlatform(TwitterPublisher.DEFAULT_BASE_URL);
        private final LinkedIn linkedin = new LinkedIn();
        private final Toggle facebook = new Toggle();
        private final Toggle instagram = new Toggle();
        private final Meta meta = new Meta();

        public OAuthPlatform getTwitter() {
            return twitter;
        }

        public LinkedIn getLinkedin() {
            return linkedin;
        }

        public Toggle getFacebook() {
            return facebook;
        }

        public Toggle getInstagram() {
            return instagram;
        }

        public Meta getMeta() {
            return meta;
        }
    }

    public static class Toggle {
        private boolean enabled = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class OAuthPlatform extends Toggle {
        private String baseUrl;
        private String clientId;
        private String clientSecret;

        OAuthPlatform(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getClientId() {
            return clientId;
        }

        public void setClientId(String clientId) {
            this.clientId = clientId;
        }

        public String getClientSecret() {
            return clientSecret;
        }

        public void setClientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
        }

        boolean hasClientCredentials() {
            return clientId != null && !clientId.isBlank() && clientSecret != null && !clientSecret.isBlank();
        }
    }

    public static class LinkedIn extends OAuthPlatform {
        private String apiVersion = LinkedInPublisher.DEFAULT_API_VERSION;

        LinkedIn() {
            super(LinkedInPublisher.DEFAULT_BASE_URL);
        }

        public String getApiVersion() {
            return apiVersion;
        }

        public void setApiVersion(String apiVersion) {
            this.apiVersion = apiVersion;
        }
    }

    /**
     * Graph API settings shared by Facebook and Instagram.
     */
    public static class Meta {
        private String graphUrl = FacebookPublisher.DEFAULT_GRAPH_URL;
        private String tokenUri = MetaTokenRefresher.DEFAULT_TOKEN_URI;
        private String appId;
        private String appSecret;

        public String getGraphUrl() {
            return graphUrl;
        }

        public void setGraphUrl(String graphUrl) {
            this.graphUrl = graphUrl;
        }

        public String getTokenUri() {
            return tokenUri;
        }

        public void setTokenUri(String tokenUri) {
            this.tokenUri = tokenUri;
        }

        public String getAppId() {
            return appId;
        }

        public void setAppId(String appId) {
            this.appId = appId;
        }

        public String getAppSecret() {
            return appSecret;
        }

        public void setAppSecret(String appSecret) {
            this.appSecret = appSecret;
        }

        boolean hasAppCredentials() {
            return appId != null && !appId.isBlank() && appSecret != null && !appSecret.isBlank();
        }
    }
}
