package com.loggy.sdk.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loggy.sdk.autoconfigure.transport.RestClientTransport;
import com.loggy.sdk.bridge.GlobalEventOptions;
import com.loggy.sdk.bridge.GlobalEventSource;
import com.loggy.sdk.client.DeliveryFailureCallback;
import com.loggy.sdk.client.Loggy;
import com.loggy.sdk.client.transport.JdkHttpTransport;
import com.loggy.sdk.client.transport.LogTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.Executor;

@AutoConfiguration
@EnableConfigurationProperties(LoggyProperties.class)
@ConditionalOnClass(Loggy.class)
@ConditionalOnProperty(prefix = "loggy", name = "enabled", havingValue = "true")
public class LoggyAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LoggyAutoConfiguration.class);
    private static final Set<String> DEV_PROFILES = new HashSet<>(Arrays.asList("dev", "local", "test"));

    private static final Duration DEV_CONNECT_TIMEOUT = Duration.ofSeconds(3);
    private static final Duration DEV_REQUEST_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration DEV_RETRY_DELAY = Duration.ofMillis(200);

    private final Environment environment;

    public LoggyAutoConfiguration(Environment environment) {
        this.environment = environment;
    }

    @Bean
    @ConditionalOnClass(RestClient.class)
    @ConditionalOnProperty(prefix = "loggy", name = "transport", havingValue = "restclient")
    @ConditionalOnMissingBean(LogTransport.class)
    public LogTransport loggyRestClientTransport(
            ObjectProvider<RestClient.Builder> restClientBuilderProvider,
            ObjectProvider<Executor> asyncExecutorProvider) {
        RestClient.Builder builder = restClientBuilderProvider.getIfUnique();
        RestClient restClient = builder != null ? builder.build() : RestClient.builder().build();
        return new RestClientTransport(restClient, asyncExecutorProvider.getIfUnique());
    }

    @Bean
    @ConditionalOnProperty(prefix = "loggy", name = "transport", havingValue = "jdk", matchIfMissing = true)
    @ConditionalOnMissingBean(LogTransport.class)
    public LogTransport loggyJdkTransport(LoggyProperties properties, ObjectProvider<HttpClient> httpClientProvider) {
        HttpClient httpClient = httpClientProvider.getIfUnique();
        if (httpClient == null) {
            Duration connectTimeout = resolveDuration(
                    properties.getConnectTimeout(),
                    "loggy.connect-timeout",
                    DEV_CONNECT_TIMEOUT);
            httpClient = HttpClient.newBuilder().connectTimeout(connectTimeout).build();
        }
        return new JdkHttpTransport(httpClient);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public Loggy loggy(
            LoggyProperties properties,
            ObjectProvider<LogTransport> transportProvider,
            ObjectProvider<ObjectMapper> objectMapperProvider,
            ObjectProvider<DeliveryFailureCallback> failureCallbackProvider,
            ObjectProvider<GlobalEventSource> globalEventSourceProvider) {
        String app = resolveApp(properties);
        Duration requestTimeout = resolveDuration(
                properties.getRequestTimeout(),
                "loggy.request-timeout",
                DEV_REQUEST_TIMEOUT);
        Duration retryDelay = resolveDuration(
                properties.getRetryDelay(),
                "loggy.retry-delay",
                DEV_RETRY_DELAY);

        Loggy.Builder builder = Loggy.builder()
                .app(app)
                .remote(properties.getRemote())
                .defaults(properties.getDefaults())
                .exitOnFatal(properties.isExitOnFatal())
                .printToConsole(properties.isPrintToConsole())
                .throttleInterval(properties.getThrottleInterval())
                .throttleLimit(properties.getThrottleLimit())
                .maxRetries(properties.getMaxRetries())
                .retryDelay(retryDelay)
                .connectTimeout(properties.getConnectTimeout())
                .requestTimeout(requestTimeout);

        LogTransport transport = transportProvider.getIfUnique();
        if (transport != null) {
            builder.transport(transport);
        }

        ObjectMapper objectMapper = objectMapperProvider.getIfUnique();
        if (objectMapper != null) {
            builder.objectMapper(objectMapper);
        }

        DeliveryFailureCallback failureCallback = failureCallbackProvider.getIfUnique();
        if (failureCallback != null) {
            builder.onDeliveryFailure(failureCallback);
        }

        GlobalEventSource globalEventSource = globalEventSourceProvider.getIfUnique();
        if (globalEventSource != null) {
            builder.globalEventSource(globalEventSource);
        }

        Loggy loggy = builder.build();

        LoggyProperties.GlobalEvents globalEvents = properties.getGlobalEvents();
        if (globalEvents.isEnabled()) {
            loggy.handleGlobalEvents(GlobalEventOptions.builder()
                    .exceptions(globalEvents.isExceptions())
                    .rejections(globalEvents.isRejections())
                    .warnings(globalEvents.isWarnings())
                    .exits(globalEvents.isExits())
                    .build());
            log.debug("Loggy forwarding global events for app {}", app);
        }
        return loggy;
    }

    @Bean
    @ConditionalOnBean(Loggy.class)
    public LoggyShutdown loggyShutdown(Loggy loggy) {
        return new LoggyShutdown(loggy);
    }

    private String resolveApp(LoggyProperties properties) {
        if (hasText(properties.getApp())) {
            return properties.getApp();
        }
        String applicationName = environment.getProperty("spring.application.name");
        if (hasText(applicationName)) {
            return applicationName.trim();
        }
        throw new IllegalStateException("loggy.app or spring.application.name is required when loggy.enabled=true");
    }

    private Duration resolveDuration(Duration currentValue, String propertyKey, Duration devDefault) {
        if (environment.containsProperty(propertyKey)) {
            return currentValue;
        }
        return isDevProfile() ? devDefault : currentValue;
    }

    private boolean isDevProfile() {
        String[] activeProfiles = environment.getActiveProfiles();
        if (activeProfiles.length == 0) {
            activeProfiles = environment.getDefaultProfiles();
        }
        for (String profile : activeProfiles) {
            if (DEV_PROFILES.contains(profile.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
