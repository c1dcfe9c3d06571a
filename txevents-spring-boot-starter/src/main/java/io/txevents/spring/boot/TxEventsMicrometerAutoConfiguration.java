package io.txevents.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.txevents.micrometer.MicrometerMetricsExporter;
import io.txevents.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath, a
 * {@link MeterRegistry} bean exists and {@code txevents.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link TxEventsAutoConfiguration} so the {@link MetricsExporter}
 * reaches the dispatcher factory and the transaction scopes.
 */
@AutoConfiguration(before = TxEventsAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "txevents.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(TxEventsProperties.class)
public class TxEventsMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, TxEventsProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
