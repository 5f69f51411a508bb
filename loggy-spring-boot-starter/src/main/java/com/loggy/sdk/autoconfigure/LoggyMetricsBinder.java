package com.loggy.sdk.autoconfigure;

import com.loggy.sdk.client.Loggy;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;

/**
 * Exposes {@link Loggy#getMetrics()}: the cumulative totals as function
 * counters and the current buffer depth as a gauge, all tagged with the app.
 */
class LoggyMetricsBinder implements MeterBinder {

    private final Loggy loggy;

    LoggyMetricsBinder(Loggy loggy) {
        this.loggy = loggy;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Tags tags = Tags.of("app", loggy.getApp());

        FunctionCounter.builder("loggy.events.logged", loggy, l -> l.getMetrics().eventsLogged)
                .description("Events accepted by the logger")
                .tags(tags)
                .register(registry);
        FunctionCounter.builder("loggy.events.flushed", loggy, l -> l.getMetrics().eventsFlushed)
                .description("Events handed to the sender")
                .tags(tags)
                .register(registry);
        FunctionCounter.builder("loggy.batches.flushed", loggy, l -> l.getMetrics().batchesFlushed)
                .description("Buffered batches handed to the sender")
                .tags(tags)
                .register(registry);
        FunctionCounter.builder("loggy.delivery.failures", loggy, l -> l.getMetrics().deliveryFailures)
                .description("Sends the collector did not accept")
                .tags(tags)
                .register(registry);

        Gauge.builder("loggy.buffer.depth", loggy, l -> l.getMetrics().bufferDepth)
                .description("Events waiting for the next flush")
                .tags(tags)
                .register(registry);
    }
}
