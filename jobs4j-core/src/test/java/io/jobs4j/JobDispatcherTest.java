package io.jobs4j;

import io.jobs4j.engine.RecordingQueueEngine;
import io.jobs4j.fixtures.DailyCleanupCron;
import io.jobs4j.fixtures.LegacySendEmailJob;
import io.jobs4j.fixtures.SendEmailJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobDispatcherTest {

    private RecordingQueueEngine engine;
    private JobDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        engine = new RecordingQueueEngine();
        dispatcher = new JobDispatcher(engine);
    }

    @Test
    void dispatchShouldResolveNameFromHandlerType() {
        String id = dispatcher.dispatch(SendEmailJob.class, Map.of("to", "ada@example.com"));

        RecordingQueueEngine.Sent sent = engine.sent.get(0);
        assertEquals(id, sent.id());
        assertEquals("send-email", sent.name());
        assertEquals(Map.of("to", "ada@example.com"), sent.data());
        assertEquals(Map.of(), sent.options());
    }

    @Test
    void dispatchShouldHonourJobNameAnnotation() {
        dispatcher.dispatch(LegacySendEmailJob.class, null, Map.of("priority", 1));

        RecordingQueueEngine.Sent sent = engine.sent.get(0);
        assertEquals("send-email", sent.name());
        assertEquals(Map.of(), sent.data());
        assertEquals(Map.of("priority", 1), sent.options());
    }

    @Test
    void sendShouldRejectBlankName() {
        assertThrows(IllegalArgumentException.class, () -> dispatcher.send(" ", Map.of()));
        assertTrue(engine.sent.isEmpty());
    }

    @Test
    void sendAfterDurationShouldAddStartAfter() {
        Instant before = Instant.now();

        dispatcher.sendAfter("send-email", Duration.ofMinutes(5), Map.of(), Map.of("retryLimit", 2));

        Map<String, Object> options = engine.sent.get(0).options();
        Instant startAfter = (Instant) options.get(JobDispatcher.START_AFTER_OPTION);
        assertTrue(!startAfter.isBefore(before.plus(Duration.ofMinutes(5))));
        assertEquals(2, options.get("retryLimit"));
    }

    @Test
    void sendAfterInstantShouldOverrideCallerStartAfter() {
        Instant at = Instant.parse("2030-01-01T00:00:00Z");

        dispatcher.sendAfter("send-email", at, Map.of(), Map.of("startAfter", "ignored"));

        assertEquals(at, engine.sent.get(0).options().get("startAfter"));
    }

    @Test
    void sendAfterShouldRejectNegativeDelay() {
        assertThrows(IllegalArgumentException.class,
                () -> dispatcher.sendAfter("send-email", Duration.ofSeconds(-1), Map.of()));
    }

    @Test
    void scheduleShouldUseResolvedName() {
        dispatcher.schedule(DailyCleanupCron.class, "*/15 * * * *");

        RecordingQueueEngine.Scheduled scheduled = engine.schedules.get("daily-cleanup");
        assertEquals("*/15 * * * *", scheduled.cron());
        assertEquals(Map.of(), scheduled.options());
    }

    @Test
    void engineFailureShouldPropagate() {
        JobDispatcher failing = new JobDispatcher(new RecordingQueueEngine() {
            @Override
            public String send(String name, Object data, Map<String, Object> options) {
                throw new IllegalStateException("engine down");
            }
        });

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> failing.send("x", Map.of()));
        assertEquals("engine down", ex.getMessage());
    }
}
