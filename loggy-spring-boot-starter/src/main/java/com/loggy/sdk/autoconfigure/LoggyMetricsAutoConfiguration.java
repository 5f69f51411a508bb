package com.loggy.sdk.autoconfigure;

import com.loggy.sdk.client.Loggy;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

@AutoConfiguration(after = LoggyAutoConfiguration.class)
@ConditionalOnClass(MeterRegistry.class)
@ConditionalOnBean({Loggy.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "loggy.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
class LoggyMetricsAutoConfiguration {

    @Bean
    LoggyMetricsBinder loggyMetricsBinder(Loggy loggy, MeterRegistry registry) {
        LoggyMetricsBinder binder = new LoggyMetricsBinder(loggy);
        // Registration is idempotent if an actuator binds MeterBinder beans again.
        binder.bindTo(registry);
        return binder;
    }
}
