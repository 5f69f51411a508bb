package com.loggy.sdk.client;

import com.loggy.sdk.exception.LoggyException;
import com.loggy.sdk.model.LogEvent;

import java.util.List;

/**
 * Callback invoked when a send to the collector did not succeed.
 *
 * <p>Delivery is fire-and-forget: the events have already left the buffer and
 * will not be resent by the logger. Implementations must be thread-safe and
 * should not throw. The default implementation writes an SLF4J debug line.</p>
 */
@FunctionalInterface
public interface DeliveryFailureCallback {

    /**
     * @param events the events carried by the failed request, in send order
     * @param cause  why delivery failed; {@link LoggyException#getStatusCode()}
     *               is set when the collector answered with a non-2xx status
     */
    void onDeliveryFailure(List<LogEvent> events, LoggyException cause);
}
