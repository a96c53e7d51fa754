package com.vidnyan.guard.application.port.out;

import com.vidnyan.guard.domain.verdict.AlertNotification;

/**
 * Output port: a destination for alert notifications.
 */
public interface AlertSink {

    String name();

    /**
     * Deliver one notification. Called off the decision path.
     */
    void send(AlertNotification notification) throws AlertDeliveryException;
}
