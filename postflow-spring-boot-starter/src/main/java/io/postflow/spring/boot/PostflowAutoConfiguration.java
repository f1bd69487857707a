package io.postflow.spring.boot;

import io.postflow.Platform;
import io.postflow.Postflow;
import io.postflow.PostflowConfig;
import io.postflow.jdbc.DataSourceConnectionProvider;
import io.postflow.jdbc.store.AbstractJdbcPublicationStore;
import io.postflow.jdbc.store.JdbcConnectionStore;
import io.postflow.jdbc.store.JdbcPublicationStores;
import io.postflow.jdbc.store.JdbcScheduleStore;
import io.postflow.platform.DefaultPublisherRegistry;
import io.postflow.platform.PublisherRegistry;
import io.postflow.platforms.FacebookPublisher;
import io.postflow.platforms.InstagramPublisher;
import io.postflow.platforms.LinkedInPublisher;
import io.postflow.platforms.MetaTokenRefresher;
import io.postflow.platforms.OAuth2TokenRefresher;
import io.postflow.platforms.PlatformRestClients;
import io.postflow.platforms.PlatformTokenRefreshers;
import io.postflow.platforms.TwitterPublisher;
import io.postflow.spi.ConnectionProvider;
import io.postflow.spi.ConnectionStore;
import io.postflow.spi.MediaStore;
import io.postflow.spi.MetricsExporter;
import io.postflow.spi.NotificationSink;
import io.postflow.spi.PostStore;
import io.postflow.spi.ScheduleStore;
import io.postflow.spi.TokenCipher;
import io.postflow.spi.TokenRefresher;
import io.postflow.vault.AesGcmTokenCipher;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.web.client.RestClient;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Auto-configuration for the postflow dispatcher.
 *
 * <p>Wires a {@link Postflow} composite from a {@link DataSource}, the application's
 * {@link PostStore} and {@link MediaStore} beans, and {@link PostflowProperties}. The
 * publication store dialect is detected from the JDBC URL. Every bean backs off when the
 * application defines its own.
 *
 * @see PostflowProperties
 * @see PostflowMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(Postflow.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(PostflowProperties.class)
public class PostflowAutoConfiguration {
    private static final Logger logger = Logger.getLogger(PostflowAutoConfiguration.class.getName());

    @Bean
    @ConditionalOnMissingBean
    public PostflowConfig postflowConfig(PostflowProperties props) {
        return props.toConfig();
    }

    @Bean
    @ConditionalOnMissingBean
    public AbstractJdbcPublicationStore publicationStore(DataSource dataSource) {
        return JdbcPublicationStores.detect(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(ScheduleStore.class)
    public JdbcScheduleStore scheduleStore() {
        return new JdbcScheduleStore();
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionStore.class)
    public JdbcConnectionStore connectionStore() {
        return new JdbcConnectionStore();
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnProperty(prefix = "postflow", name = "initialize-schema", havingValue = "true")
    @ConditionalOnMissingBean
    public PostflowSchemaInitializer postflowSchemaInitializer(DataSource dataSource,
                                                               AbstractJdbcPublicationStore publicationStore) {
        return new PostflowSchemaInitializer(dataSource, publicationStore.name());
    }

    @Bean
    @ConditionalOnMissingBean(TokenCipher.class)
    public AesGcmTokenCipher tokenCipher(PostflowProperties props) {
        String secret = props.getVault().getSecret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("postflow.vault.secret must be set to encrypt platform tokens");
        }
        return AesGcmTokenCipher.fromSecret(secret, props.getVault().getSalt());
    }

    @Bean
    @ConditionalOnMissingBean(PublisherRegistry.class)
    public DefaultPublisherRegistry publisherRegistry(PostflowProperties props, PostflowConfig config) {
        PostflowProperties.Platforms platforms = props.getPlatforms();
        DefaultPublisherRegistry registry = new DefaultPublisherRegistry();
        Clock clock = Clock.systemUTC();
        if (platforms.getTwitter().isEnabled()) {
            registry.register(TwitterPublisher.create(platforms.getTwitter().getBaseUrl(), config.callTimeout()));
        }
        if (platforms.getLinkedin().isEnabled()) {
            RestClient restClient = PlatformRestClients.create(platforms.getLinkedin().getBaseUrl(),
                    config.callTimeout());
            registry.register(new LinkedInPublisher(restClient, clock, platforms.getLinkedin().getApiVersion()));
        }
        String graphUrl = platforms.getMeta().getGraphUrl();
        if (platforms.getFacebook().isEnabled()) {
            registry.register(FacebookPublisher.create(graphUrl, config.callTimeout()));
        }
        if (platforms.getInstagram().isEnabled()) {
            registry.register(InstagramPublisher.create(graphUrl, config.callTimeout()));
        }
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean(TokenRefresher.class)
    public PlatformTokenRefreshers tokenRefresher(PostflowProperties props, PostflowConfig config) {
        PostflowProperties.Platforms platforms = props.getPlatforms();
        PlatformTokenRefreshers refreshers = new PlatformTokenRefreshers();
        RestClient restClient = PlatformRestClients.builder(config.callTimeout()).build();
        Clock clock = Clock.systemUTC();

        PostflowProperties.OAuthPlatform twitter = platforms.getTwitter();
        if (twitter.isEnabled()) {
            if (twitter.hasClientCredentials()) {
                refreshers.register(Platform.TWITTER, OAuth2TokenRefresher.twitter(restClient,
                        twitter.getClientId(), twitter.getClientSecret(), clock));
            } else {
                warnNoRefresh(Platform.TWITTER, "postflow.platforms.twitter.client-id/client-secret");
            }
        }
        PostflowProperties.LinkedIn linkedin = platforms.getLinkedin();
        if (linkedin.isEnabled()) {
            if (linkedin.hasClientCredentials()) {
                refreshers.register(Platform.LINKEDIN, OAuth2TokenRefresher.linkedIn(restClient,
                        linkedin.getClientId(), linkedin.getClientSecret(), clock));
            } else {
                warnNoRefresh(Platform.LINKEDIN, "postflow.platforms.linkedin.client-id/client-secret");
            }
        }
        PostflowProperties.Meta meta = platforms.getMeta();
        boolean anyMeta = platforms.getFacebook().isEnabled() || platforms.getInstagram().isEnabled();
        if (anyMeta && meta.hasAppCredentials()) {
            MetaTokenRefresher metaRefresher = new MetaTokenRefresher(restClient, meta.getTokenUri(),
                    meta.getAppId(), meta.getAppSecret(), clock);
            if (platforms.getFacebook().isEnabled()) {
                refreshers.register(Platform.FACEBOOK, metaRefresher);
            }
            if (platforms.getInstagram().isEnabled()) {
                refreshers.register(Platform.INSTAGRAM, metaRefresher);
            }
        } else if (anyMeta) {
            warnNoRefresh(Platform.FACEBOOK, "postflow.platforms.meta.app-id/app-secret");
        }
        return refreshers;
    }

    @Bean
    @ConditionalOnMissingBean(NotificationSink.class)
    public LoggingNotificationSink notificationSink() {
        return new LoggingNotificationSink();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnBean({PostStore.class, MediaStore.class})
    public Postflow postflow(PostflowConfig config,
                             ConnectionProvider connectionProvider,
                             ScheduleStore scheduleStore,
                             AbstractJdbcPublicationStore publicationStore,
                             ConnectionStore connectionStore,
                             PublisherRegistry publisherRegistry,
                             TokenCipher tokenCipher,
                             TokenRefresher tokenRefresher,
                             PostStore postStore,
                             MediaStore mediaStore,
                             NotificationSink notificationSink,
                             ObjectProvider<MetricsExporter> metricsProvider) {
        var builder = Postflow.builder()
                .config(config)
                .connectionProvider(connectionProvider)
                .scheduleStore(scheduleStore)
                .publicationStore(publicationStore)
                .connectionStore(connectionStore)
                .publisherRegistry(publisherRegistry)
                .tokenCipher(tokenCipher)
                .tokenRefresher(tokenRefresher)
                .postStore(postStore)
                .mediaStore(mediaStore)
                .notificationSink(notificationSink);
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnBean(Postflow.class)
    @ConditionalOnProperty(prefix = "postflow", name = "auto-start", havingValue = "true", matchIfMissing = true)
    public PostflowStarter postflowStarter(Postflow postflow) {
        return new PostflowStarter(postflow);
    }

    private static void warnNoRefresh(Platform platform, String properties) {
        logger.log(Level.WARNING, "No token refresher for {0}: set {1}; expiring tokens will fail as AUTH",
                new Object[]{platform.tag(), properties});
    }
}
