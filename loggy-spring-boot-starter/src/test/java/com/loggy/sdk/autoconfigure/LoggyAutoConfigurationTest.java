package com.loggy.sdk.autoconfigure;

import com.loggy.sdk.autoconfigure.transport.RestClientTransport;
import com.loggy.sdk.bridge.GlobalEventSource;
import com.loggy.sdk.client.DeliveryFailureCallback;
import com.loggy.sdk.client.Loggy;
import com.loggy.sdk.client.transport.JdkHttpTransport;
import com.loggy.sdk.client.transport.LogRequest;
import com.loggy.sdk.client.transport.LogResponse;
import com.loggy.sdk.client.transport.LogTransport;
import com.loggy.sdk.exception.LoggyException;
import com.loggy.sdk.model.LogEvent;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

import static org.assertj.core.api.Assertions.assertThat;

class LoggyAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(LoggyAutoConfiguration.class))
            .withPropertyValues(
                    "loggy.exit-on-fatal=false",
                    "loggy.print-to-console=false");

    // --- Enablement ---

    @Test
    void doesNotRegisterBeansWhenDisabled() {
        contextRunner
                .withPropertyValues("loggy.app=orders")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(Loggy.class);
                    assertThat(context).doesNotHaveBean(LogTransport.class);
                    assertThat(context).doesNotHaveBean(LoggyShutdown.class);
                });
    }

    @Test
    void registersBeansWhenEnabledAndConfigured() {
        contextRunner
                .withPropertyValues(
                        "loggy.enabled=true",
                        "loggy.app=orders",
                        "loggy.remote=https://logs.example.com/")
                .run(context -> {
                    assertThat(context).hasSingleBean(Loggy.class);
                    assertThat(context).hasSingleBean(LogTransport.class);
                    assertThat(context).hasSingleBean(LoggyShutdown.class);

                    Loggy loggy = context.getBean(Loggy.class);
                    assertThat(loggy.getApp()).isEqualTo("orders");
                    assertThat(loggy.getRemote()).isEqualTo("https://logs.example.com/");
                    assertThat(loggy.isExitOnFatal()).isFalse();
                    assertThat(loggy.isPrintToConsole()).isFalse();
                });
    }

    @Test
    void appliesLoggerSettings() {
        contextRunner
                .withPropertyValues(
                        "loggy.enabled=true",
                        "loggy.app=orders",
                        "loggy.throttle-interval=250ms",
                        "loggy.throttle-limit=25",
                        "loggy.defaults.region=eu",
                        "loggy.defaults.tier=gold")
                .run(context -> {
                    Loggy loggy = context.getBean(Loggy.class);
                    assertThat(loggy.getThrottleInterval()).isEqualTo(250L);
                    assertThat(loggy.getThrottleLimit()).isEqualTo(25);
                    assertThat(loggy.getDefaults())
                            .containsEntry("region", "eu")
                            .containsEntry("tier", "gold");
                });
    }

    // --- App name ---

    @Test
    void fallsBackToSpringApplicationName() {
        contextRunner
                .withPropertyValues(
                        "loggy.enabled=true",
                        "spring.application.name=billing")
                .run(context -> assertThat(context.getBean(Loggy.class).getApp()).isEqualTo("billing"));
    }

    @Test
    void loggyAppWinsOverSpringApplicationName() {
        contextRunner
                .withPropertyValues(
                        "loggy.enabled=true",
                        "loggy.app=orders",
                        "spring.application.name=billing")
                .run(context -> assertThat(context.getBean(Loggy.class).getApp()).isEqualTo("orders"));
    }

    @Test
    void failsWithoutAppName() {
        contextRunner
                .withPropertyValues("loggy.enabled=true")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .rootCause()
                            .isInstanceOf(IllegalStateException.class)
                            .hasMessageContaining("loggy.app");
                });
    }

    // --- Validation ---

    @Test
    void failsOnUnknownTransport() {
        contextRunner
                .withPropertyValues(
                        "loggy.enabled=true",
                        "loggy.app=orders",
                        "loggy.transport=webclient")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .rootCause()
                            .isInstanceOf(BindValidationException.class)
                            .hasMessageContaining("loggy.transport");
                });
    }

    @Test
    void failsOnNonHttpRemote() {
        contextRunner
                .withPropertyValues(
                        "loggy.enabled=true",
                        "loggy.app=orders",
                        "loggy.remote=ftp://logs.example.com/")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .rootCause()
                            .isInstanceOf(BindValidationException.class);
                });
    }

    // --- Transport selection ---

    @Test
    void registersJdkTransportByDefault() {
        contextRunner
                .withPropertyValues("loggy.enabled=true", "loggy.app=orders")
                .run(context -> assertThat(context.getBean(LogTransport.class)).isInstanceOf(JdkHttpTransport.class));
    }

    @Test
    void registersJdkTransportWhenConfigured() {
        contextRunner
                .withPropertyValues("loggy.enabled=true", "loggy.app=orders", "loggy.transport=jdk")
                .run(context -> assertThat(context.getBean(LogTransport.class)).isInstanceOf(JdkHttpTransport.class));
    }

    @Test
    void registersRestClientTransportWhenConfigured() {
        contextRunner
                .withPropertyValues("loggy.enabled=true", "loggy.app=orders", "loggy.transport=restclient")
                .run(context -> {
                    assertThat(context).hasSingleBean(LogTransport.class);
                    assertThat(context.getBean(LogTransport.class)).isInstanceOf(RestClientTransport.class);
                });
    }

    @Test
    void keepsUserTransportAndRoutesFailuresToCallbackBean() {
        contextRunner
                .withPropertyValues("loggy.enabled=true", "loggy.app=orders")
                .withUserConfiguration(FailingTransportConfig.class)
                .run(context -> {
                    assertThat(context.getBeansOfType(LogTransport.class)).hasSize(1);
                    assertThat(context.getBean(LogTransport.class)).isInstanceOf(FailingTransport.class);

                    RecordingFailureCallback callback = context.getBean(RecordingFailureCallback.class);
                    Loggy loggy = context.getBean(Loggy.class);
                    loggy.log("payment declined", true);

                    assertThat(callback.latch.await(5, TimeUnit.SECONDS)).isTrue();
                    assertThat(callback.failures).hasSize(1);
                    assertThat(callback.failures.get(0).getStatusCode()).isEqualTo(503);
                    assertThat(callback.events.get(0).getMessage()).isEqualTo("payment declined");
                    assertThat(loggy.getMetrics().deliveryFailures).isEqualTo(1L);
                });
    }

    // --- Lifecycle ---

    @Test
    void contextCloseFlushesBufferedEvents() {
        AtomicReference<RecordingTransport> transport = new AtomicReference<>();
        contextRunner
                .withPropertyValues("loggy.enabled=true", "loggy.app=orders", "loggy.throttle-interval=1h")
                .withUserConfiguration(RecordingTransportConfig.class)
                .run(context -> {
                    transport.set(context.getBean(RecordingTransport.class));
                    context.getBean(Loggy.class).info("shutting down");
                    assertThat(transport.get().requests).isEmpty();
                });

        assertThat(transport.get().requests).hasSize(1);
        assertThat(transport.get().requests.get(0).getBody()).contains("shutting down");
    }

    // --- User overrides ---

    @Test
    void keepsExistingLoggy() {
        contextRunner
                .withPropertyValues("loggy.enabled=true", "loggy.app=orders")
                .withUserConfiguration(ExistingLoggyConfig.class)
                .run(context -> {
                    assertThat(context).hasSingleBean(Loggy.class);
                    assertThat(context.getBean(Loggy.class).getApp()).isEqualTo("existing");
                    assertThat(context).hasSingleBean(LoggyShutdown.class);
                });
    }

    // --- Global events ---

    @Test
    void registersGlobalEventHandlersWhenEnabled() {
        contextRunner
                .withPropertyValues(
                        "loggy.enabled=true",
                        "loggy.app=orders",
                        "loggy.global-events.enabled=true",
                        "loggy.global-events.warnings=false")
                .withUserConfiguration(GlobalEventSourceConfig.class)
                .run(context -> {
                    RecordingGlobalEventSource source = context.getBean(RecordingGlobalEventSource.class);
                    assertThat(source.registered).containsExactly("exceptions", "rejections", "exits");
                });
    }

    @Test
    void doesNotRegisterGlobalEventHandlersByDefault() {
        contextRunner
                .withPropertyValues("loggy.enabled=true", "loggy.app=orders")
                .withUserConfiguration(GlobalEventSourceConfig.class)
                .run(context -> {
                    RecordingGlobalEventSource source = context.getBean(RecordingGlobalEventSource.class);
                    assertThat(source.registered).isEmpty();
                });
    }

    // --- Test configurations ---

    @Configuration(proxyBeanMethods = false)
    static class ExistingLoggyConfig {
        @Bean(destroyMethod = "close")
        Loggy loggy() {
            return Loggy.builder()
                    .app("existing")
                    .exitOnFatal(false)
                    .printToConsole(false)
                    .build();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class FailingTransportConfig {
        @Bean
        LogTransport failingTransport() {
            return new FailingTransport();
        }

        @Bean
        RecordingFailureCallback recordingFailureCallback() {
            return new RecordingFailureCallback();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class RecordingTransportConfig {
        @Bean
        RecordingTransport recordingTransport() {
            return new RecordingTransport();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class GlobalEventSourceConfig {
        @Bean
        RecordingGlobalEventSource recordingGlobalEventSource() {
            return new RecordingGlobalEventSource();
        }
    }

    static class FailingTransport implements LogTransport {
        @Override
        public CompletableFuture<LogResponse> sendAsync(LogRequest request) {
            return CompletableFuture.completedFuture(new LogResponse(503, "unavailable"));
        }
    }

    static class RecordingTransport implements LogTransport {
        final List<LogRequest> requests = new CopyOnWriteArrayList<>();

        @Override
        public CompletableFuture<LogResponse> sendAsync(LogRequest request) {
            requests.add(request);
            return CompletableFuture.completedFuture(new LogResponse(200, "ok"));
        }
    }

    static class RecordingFailureCallback implements DeliveryFailureCallback {
        final List<LogEvent> events = new CopyOnWriteArrayList<>();
        final List<LoggyException> failures = new CopyOnWriteArrayList<>();
        final CountDownLatch latch = new CountDownLatch(1);

        @Override
        public void onDeliveryFailure(List<LogEvent> failed, LoggyException cause) {
            events.addAll(failed);
            failures.add(cause);
            latch.countDown();
        }
    }

    static class RecordingGlobalEventSource implements GlobalEventSource {
        final List<String> registered = new ArrayList<>();

        @Override
        public void onUncaughtException(Consumer<Throwable> handler) {
            registered.add("exceptions");
        }

        @Override
        public void onUnhandledRejection(Consumer<Object> handler) {
            registered.add("rejections");
        }

        @Override
        public void onWarning(Consumer<Object> handler) {
            registered.add("warnings");
        }

        @Override
        public void onExit(IntConsumer handler) {
            registered.add("exits");
        }
    }
}
