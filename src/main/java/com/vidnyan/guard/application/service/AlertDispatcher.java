package com.vidnyan.guard.application.service;

import com.vidnyan.guard.application.port.out.AlertDeliveryException;
import com.vidnyan.guard.application.port.out.AlertSink;
import com.vidnyan.guard.domain.verdict.AlertNotification;
import com.vidnyan.guard.domain.verdict.Verdict;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget fan-out of alert notifications to every configured sink.
 * Each sink gets its own task; a slow or failing sink affects nobody else.
 */
@Slf4j
public class AlertDispatcher {

    private final List<AlertSink> sinks;
    private final Executor executor;

    public AlertDispatcher(List<AlertSink> sinks, Executor executor) {
        this.sinks = List.copyOf(sinks);
        this.executor = executor;
    }

    public void dispatch(Verdict verdict) {
        verdict.alert().ifPresent(this::dispatch);
    }

    public void dispatch(AlertNotification notification) {
        for (AlertSink sink : sinks) {
            try {
                executor.execute(() -> deliver(sink, notification));
            } catch (RejectedExecutionException e) {
                log.warn("Dropped alert for {}: dispatch queue full", sink.name());
            }
        }
    }

    private void deliver(AlertSink sink, AlertNotification notification) {
        try {
            sink.send(notification);
            log.debug("Alert delivered via {}", sink.name());
        } catch (AlertDeliveryException e) {
            log.warn("Alert delivery via {} failed: {}", e.getSinkName(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Alert delivery via {} failed unexpectedly", sink.name(), e);
        }
    }

    public List<String> sinkNames() {
        return sinks.stream().map(AlertSink::name).toList();
    }
}
