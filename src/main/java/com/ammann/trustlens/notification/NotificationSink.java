/* (C)2026 */
package com.ammann.trustlens.notification;

import com.ammann.trustlens.model.DeliveryOutcome;

/**
 * Destination for outbound alert notifications.
 *
 * <p>Implementations make at most one delivery attempt per call and never throw for
 * delivery problems; the outcome is reported as a {@link DeliveryOutcome}.
 */
public interface NotificationSink {

    /**
     * Delivers a text message.
     *
     * @param message message text
     * @return outcome of the delivery attempt
     */
    DeliveryOutcome send(String message);

    /**
     * @return {@code true} if a destination is configured
     */
    boolean isConfigured();
}
