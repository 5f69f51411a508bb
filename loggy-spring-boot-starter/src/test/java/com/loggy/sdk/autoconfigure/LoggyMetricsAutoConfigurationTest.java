package com.loggy.sdk.autoconfigure;

import com.loggy.sdk.client.Loggy;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class LoggyMetricsAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    LoggyAutoConfiguration.class,
                    LoggyMetricsAutoConfiguration.class))
            .withPropertyValues(
                    "loggy.enabled=true",
                    "loggy.app=orders",
                    "loggy.exit-on-fatal=false",
                    "loggy.print-to-console=false",
                    "loggy.throttle-interval=1h")
            .withUserConfiguration(MeterRegistryConfig.class);

    @Test
    void registersAllMetersWhenMicrometerPresent() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(LoggyMetricsBinder.class);
            MeterRegistry registry = context.getBean(MeterRegistry.class);
            assertThat(registry.find("loggy.events.logged").tag("app", "orders").functionCounter()).isNotNull();
            assertThat(registry.find("loggy.events.flushed").functionCounter()).isNotNull();
            assertThat(registry.find("loggy.batches.flushed").functionCounter()).isNotNull();
            assertThat(registry.find("loggy.delivery.failures").functionCounter()).isNotNull();
            assertThat(registry.find("loggy.buffer.depth").tag("app", "orders").gauge()).isNotNull();
        });
    }

    @Test
    void initialValuesAreZero() {
        contextRunner.run(context -> {
            MeterRegistry registry = context.getBean(MeterRegistry.class);
            assertThat(counter(registry, "loggy.events.logged")).isZero();
            assertThat(counter(registry, "loggy.events.flushed")).isZero();
            assertThat(counter(registry, "loggy.batches.flushed")).isZero();
            assertThat(counter(registry, "loggy.delivery.failures")).isZero();
            assertThat(gauge(registry, "loggy.buffer.depth")).isZero();
        });
    }

    @Test
    void metersTrackBufferedEvents() {
        contextRunner.run(context -> {
            Loggy loggy = context.getBean(Loggy.class);
            loggy.info("first");
            loggy.info("second");

            MeterRegistry registry = context.getBean(MeterRegistry.class);
            assertThat(counter(registry, "loggy.events.logged")).isEqualTo(2.0);
            assertThat(gauge(registry, "loggy.buffer.depth")).isEqualTo(2.0);
        });
    }

    @Test
    void doesNotRegisterWhenMetricsDisabled() {
        contextRunner
                .withPropertyValues("loggy.metrics.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(LoggyMetricsBinder.class));
    }

    @Test
    void doesNotRegisterWhenLoggyDisabled() {
        contextRunner
                .withPropertyValues("loggy.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(Loggy.class);
                    assertThat(context).doesNotHaveBean(LoggyMetricsBinder.class);
                });
    }

    @Test
    void doesNotRegisterWhenNoMeterRegistry() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        LoggyAutoConfiguration.class,
                        LoggyMetricsAutoConfiguration.class))
                .withPropertyValues(
                        "loggy.enabled=true",
                        "loggy.app=orders",
                        "loggy.exit-on-fatal=false",
                        "loggy.print-to-console=false")
                .run(context -> assertThat(context).doesNotHaveBean(LoggyMetricsBinder.class));
    }

    @Test
    void flushedBatchesAreCounted() {
        contextRunner.run(context -> {
            Loggy loggy = context.getBean(Loggy.class);
            loggy.info("first");
            loggy.info("second");
            loggy.flush();

            MeterRegistry registry = context.getBean(MeterRegistry.class);
            assertThat(counter(registry, "loggy.batches.flushed")).isEqualTo(1.0);
            assertThat(counter(registry, "loggy.events.flushed")).isEqualTo(2.0);
            assertThat(gauge(registry, "loggy.buffer.depth")).isZero();
        });
    }

    private static double counter(MeterRegistry registry, String name) {
        FunctionCounter c = registry.find(name).functionCounter();
        assertThat(c).as("counter '%s' should exist", name).isNotNull();
        return c.count();
    }

    private static double gauge(MeterRegistry registry, String name) {
        Gauge g = registry.find(name).gauge();
        assertThat(g).as("gauge '%s' should exist", name).isNotNull();
        return g.value();
    }

    @Configuration(proxyBeanMethods = false)
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }
}
