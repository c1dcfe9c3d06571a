package io.txevents.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.sql.Connection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TxEventsPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(TxEventsProperties.class);
            assertEquals(10, props.getDispatcher().getMaxDepth());
            assertEquals(TxEventsProperties.Manager.JDBC, props.getTransaction().getManager());
            assertEquals(5, props.getTransaction().getMaxAttempts());
            assertEquals(TxEventsProperties.Isolation.DEFAULT, props.getTransaction().getIsolation());
            assertEquals(50, props.getRetry().getBaseDelayMs());
            assertEquals(1000, props.getRetry().getMaxDelayMs());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("txevents", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "txevents.dispatcher.max-depth=4",
                "txevents.transaction.manager=SPRING",
                "txevents.transaction.max-attempts=3",
                "txevents.transaction.isolation=SERIALIZABLE",
                "txevents.retry.base-delay-ms=10",
                "txevents.retry.max-delay-ms=200",
                "txevents.metrics.enabled=false",
                "txevents.metrics.name-prefix=shop"
        ).run(ctx -> {
            var props = ctx.getBean(TxEventsProperties.class);
            assertEquals(4, props.getDispatcher().getMaxDepth());
            assertEquals(TxEventsProperties.Manager.SPRING, props.getTransaction().getManager());
            assertEquals(3, props.getTransaction().getMaxAttempts());
            assertEquals(Connection.TRANSACTION_SERIALIZABLE, props.getTransaction().getIsolation().level());
            assertEquals(10, props.getRetry().getBaseDelayMs());
            assertEquals(200, props.getRetry().getMaxDelayMs());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("shop", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(TxEventsProperties.class)
    static class PropsConfig {
    }
}
