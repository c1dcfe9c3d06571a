package io.txevents.spring.boot;

import io.txevents.dispatch.DispatchInterceptor;
import io.txevents.dispatch.SynchronousEventBus;
import io.txevents.dispatch.TransactionalEventDispatchers;
import io.txevents.jdbc.ConnectionProvider;
import io.txevents.jdbc.DataSourceConnectionProvider;
import io.txevents.jdbc.TransactionAwareJdbc;
import io.txevents.jdbc.tx.JdbcReadOnlyTransactionScope;
import io.txevents.jdbc.tx.JdbcTransactionScope;
import io.txevents.registry.DefaultHandlerRegistry;
import io.txevents.spi.MetricsExporter;
import io.txevents.spring.SpringReadOnlyTransactionScope;
import io.txevents.spring.SpringTransactionScope;
import io.txevents.tx.ExponentialBackoffRetryPolicy;
import io.txevents.tx.ReadOnlyTransactionScope;
import io.txevents.tx.ReadWriteTransactionScope;
import io.txevents.tx.RetryPolicy;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/**
 * Auto-configuration for txevents.
 *
 * <p>Wires the handler registry, the per-transaction dispatcher factory, read-write and
 * read-only scopes and the after-commit bus from a {@link DataSource} and
 * {@link TxEventsProperties}. Scopes are plain JDBC by default; with
 * {@code txevents.transaction.manager=SPRING} they run through the
 * {@link PlatformTransactionManager}.
 *
 * @see TxEventsProperties
 * @see TxEventsMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(TransactionalEventDispatchers.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(TxEventsProperties.class)
public class TxEventsAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public DefaultHandlerRegistry handlerRegistry() {
    return new DefaultHandlerRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  public SynchronousEventBus synchronousEventBus(ObjectProvider<MetricsExporter> metricsProvider) {
    return new SynchronousEventBus(metricsProvider.getIfAvailable());
  }

  @Bean
  @ConditionalOnMissingBean
  public DomainEventHandlerRegistrar domainEventHandlerRegistrar(
      ListableBeanFactory beanFactory,
      DefaultHandlerRegistry handlerRegistry,
      SynchronousEventBus synchronousEventBus) {
    return new DomainEventHandlerRegistrar(beanFactory, handlerRegistry, synchronousEventBus);
  }

  @Bean
  @ConditionalOnMissingBean
  public TransactionalEventDispatchers transactionalEventDispatchers(TxEventsProperties props,
      DefaultHandlerRegistry handlerRegistry,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<DispatchInterceptor> interceptorProvider) {
    var builder = TransactionalEventDispatchers.builder()
        .handlerRegistry(handlerRegistry)
        .maxDepth(props.getDispatcher().getMaxDepth());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    interceptorProvider.orderedStream().forEach(builder::interceptor);
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean(ReadWriteTransactionScope.class)
  public ReadWriteTransactionScope readWriteTransactionScope(TxEventsProperties props,
      DataSource dataSource,
      ConnectionProvider connectionProvider,
      ObjectProvider<PlatformTransactionManager> transactionManagerProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {
    TxEventsProperties.Transaction tx = props.getTransaction();
    RetryPolicy retryPolicy = new ExponentialBackoffRetryPolicy(
        props.getRetry().getBaseDelayMs(), props.getRetry().getMaxDelayMs());
    MetricsExporter metrics = metricsProvider.getIfAvailable();

    return switch (tx.getManager()) {
      case JDBC -> {
        var builder = JdbcTransactionScope.builder()
            .connectionProvider(connectionProvider)
            .maxAttempts(tx.getMaxAttempts())
            .retryPolicy(retryPolicy)
            .metrics(metrics);
        if (tx.getIsolation() != TxEventsProperties.Isolation.DEFAULT) {
          builder.isolationLevel(tx.getIsolation().level());
        }
        yield builder.build();
      }
      case SPRING -> SpringTransactionScope.builder()
          .transactionManager(transactionManager(transactionManagerProvider, dataSource))
          .dataSource(dataSource)
          .isolationLevel(tx.getIsolation().level())
          .maxAttempts(tx.getMaxAttempts())
          .retryPolicy(retryPolicy)
          .metrics(metrics)
          .build();
    };
  }

  @Bean
  @ConditionalOnMissingBean(ReadOnlyTransactionScope.class)
  public ReadOnlyTransactionScope readOnlyTransactionScope(TxEventsProperties props,
      DataSource dataSource,
      ConnectionProvider connectionProvider,
      ObjectProvider<PlatformTransactionManager> transactionManagerProvider) {
    return switch (props.getTransaction().getManager()) {
      case JDBC -> new JdbcReadOnlyTransactionScope(connectionProvider);
      case SPRING -> new SpringReadOnlyTransactionScope(
          transactionManager(transactionManagerProvider, dataSource), dataSource);
    };
  }

  @Bean
  @ConditionalOnMissingBean
  public TransactionAwareJdbc transactionAwareJdbc(ConnectionProvider connectionProvider) {
    return new TransactionAwareJdbc(connectionProvider);
  }

  private static PlatformTransactionManager transactionManager(
      ObjectProvider<PlatformTransactionManager> provider, DataSource dataSource) {
    return provider.getIfAvailable(() -> new DataSourceTransactionManager(dataSource));
  }
}
