package io.postflow.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.postflow.micrometer.MicrometerMetricsExporter;
import io.postflow.spi.MetricsExporter;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Exports dispatcher metrics through Micrometer when a {@link MeterRegistry} is present.
 * Disable with {@code postflow.metrics.enabled=false}.
 */
@AutoConfiguration(
        before = PostflowAutoConfiguration.class,
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MeterRegistry.class, MicrometerMetricsExporter.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "postflow.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(PostflowProperties.class)
public class PostflowMicrometerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(MetricsExporter.class)
    public MicrometerMetricsExporter postflowMetricsExporter(MeterRegistry registry, PostflowProperties props) {
        return new MicrometerMetricsExporter(registry, props.getMetrics().getNamePrefix());
    }
}
