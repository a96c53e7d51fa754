package com.vidnyan.guard.application.service;

import com.vidnyan.guard.application.port.out.AlertSink;
import com.vidnyan.guard.domain.event.ExecEvent;
import com.vidnyan.guard.domain.rule.RiskLevel;
import com.vidnyan.guard.domain.rule.RuleAction;
import com.vidnyan.guard.domain.rule.RuleSetTier;
import com.vidnyan.guard.domain.verdict.RuleMatch;
import com.vidnyan.guard.domain.verdict.Verdict;
import com.vidnyan.guard.support.RecordingAlertSink;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class AlertDispatcherTest {

    private static final ExecEvent EVENT = new ExecEvent("npm install left-pad");

    private static Verdict alertVerdict() {
        return Verdict.resolve(EVENT,
                List.of(new RuleMatch("watch_npm", "npm installs", RiskLevel.WARNING, RuleAction.ALERT, false)),
                RuleSetTier.FRESH, 200);
    }

    @Test
    void dispatch_ShouldNotifyEverySinkEvenWhenOneFails() {
        // Arrange
        RecordingAlertSink broken = new RecordingAlertSink("broken", true);
        RecordingAlertSink healthy = new RecordingAlertSink("healthy");
        AlertDispatcher dispatcher = new AlertDispatcher(List.<AlertSink>of(broken, healthy), Runnable::run);

        // Act
        dispatcher.dispatch(alertVerdict());

        // Assert
        assertEquals(1, broken.received().size());
        assertEquals(1, healthy.received().size());
        assertEquals(List.of("watch_npm"), healthy.received().get(0).ruleNames());
    }

    @Test
    void dispatch_ShouldSkipPlainAllow() {
        RecordingAlertSink sink = new RecordingAlertSink("sink");
        AlertDispatcher dispatcher = new AlertDispatcher(List.of(sink), Runnable::run);

        dispatcher.dispatch(Verdict.allow(EVENT, RuleSetTier.FRESH));

        assertTrue(sink.received().isEmpty());
    }

    @Test
    void dispatch_ShouldSurviveFullQueue() {
        RecordingAlertSink sink = new RecordingAlertSink("sink");
        AlertDispatcher dispatcher = new AlertDispatcher(List.of(sink), task -> {
            throw new RejectedExecutionException("queue full");
        });

        assertDoesNotThrow(() -> dispatcher.dispatch(alertVerdict()));
        assertTrue(sink.received().isEmpty());
        assertEquals(List.of("sink"), dispatcher.sinkNames());
    }
}
