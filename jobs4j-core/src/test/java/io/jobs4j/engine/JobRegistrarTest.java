package io.jobs4j.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobs4j.Dispatchable;
import io.jobs4j.core.HandlerDescriptor;
import io.jobs4j.core.HandlerKind;
import io.jobs4j.fixtures.AuditTrailJob;
import io.jobs4j.fixtures.DailyCleanupCron;
import io.jobs4j.fixtures.SendEmailJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobRegistrarTest {

    private RecordingQueueEngine engine;
    private JobRegistrar registrar;

    @BeforeEach
    void setUp() {
        engine = new RecordingQueueEngine();
        registrar = new JobRegistrar(engine, new ReflectiveHandlerFactory(), new ObjectMapper());
        SendEmailJob.HANDLED.clear();
        AuditTrailJob.HANDLED.clear();
        AuditTrailJob.LOGGERS.clear();
    }

    @Test
    void registerWorkerShouldPassOptionsToEngine() {
        registrar.registerWorker("send-email", HandlerDescriptor.of(SendEmailJob.class), Map.of("queue", "emails"));

        assertTrue(engine.workers.containsKey("send-email"));
        assertEquals(Map.of("queue", "emails"), engine.workOptions.get("send-email"));
    }

    @Test
    void workerShouldProcessBatchSequentiallyInOrder() throws Exception {
        registrar.registerWorker("send-email", HandlerDescriptor.of(SendEmailJob.class), Map.of());

        engine.deliver("send-email",
                Map.of("to", "a@example.com", "subject", "1"),
                new SendEmailJob.Email("b@example.com", "2"),
                Map.of("to", "c@example.com", "subject", "3"));

        assertEquals(List.of("1", "2", "3"), SendEmailJob.HANDLED.stream().map(SendEmailJob.Email::subject).toList());
    }

    @Test
    void workerShouldInjectLoggerIntoLoggerAwareHandlers() throws Exception {
        registrar.registerWorker("audit-trail", HandlerDescriptor.of(AuditTrailJob.class), null);

        engine.deliver("audit-trail", Map.of("event", "login"));

        assertEquals(List.of(Map.of("event", "login")), AuditTrailJob.HANDLED);
        assertNotNull(AuditTrailJob.LOGGERS.get(0));
        assertEquals(AuditTrailJob.class.getName(), AuditTrailJob.LOGGERS.get(0).getName());
        assertEquals(Map.of(), engine.workOptions.get("audit-trail"));
    }

    @Test
    void workerShouldCreateFreshHandlerPerJob() throws Exception {
        List<Object> instances = new ArrayList<>();
        HandlerFactory factory = new HandlerFactory() {
            @Override
            public <T> T create(Class<T> type) throws Exception {
                T instance = new ReflectiveHandlerFactory().create(type);
                instances.add(instance);
                return instance;
            }
        };
        JobRegistrar tracking = new JobRegistrar(engine, factory, new ObjectMapper());
        tracking.registerWorker("send-email", HandlerDescriptor.of(SendEmailJob.class), Map.of());

        engine.deliver("send-email", Map.of("to", "x", "subject", "a"), Map.of("to", "y", "subject", "b"));

        assertEquals(2, instances.size());
        assertTrue(instances.get(0) != instances.get(1));
    }

    @Test
    void workerShouldPropagateHandlerFailureAndStopBatch() {
        registrar.registerWorker("failing", HandlerDescriptor.of(FailingJob.class), Map.of());
        FailingJob.CALLS.clear();

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> engine.deliver("failing", "first", "second"));

        assertEquals("rejected first", ex.getMessage());
        assertEquals(List.of("first"), FailingJob.CALLS);
    }

    @Test
    void scheduledWorkerShouldCallZeroArgHandle() throws Exception {
        int before = DailyCleanupCron.RUNS.get();
        registrar.registerWorker("daily-cleanup", HandlerDescriptor.of(DailyCleanupCron.class), Map.of());

        engine.deliver("daily-cleanup", Map.of());

        assertEquals(before + 1, DailyCleanupCron.RUNS.get());
    }

    @Test
    void registerWorkerShouldRejectUnsupportedKind() {
        HandlerDescriptor descriptor = HandlerDescriptor.of(SendEmailJob.class);

        assertThrows(IllegalArgumentException.class,
                () -> registrar.registerWorker("send-email", descriptor, HandlerKind.SCHEDULABLE, Map.of()));
    }

    @Test
    void registerWorkerTwiceShouldReplacePreviousWorker() {
        registrar.registerWorker("send-email", HandlerDescriptor.of(SendEmailJob.class), Map.of("queue", "a"));
        WorkHandler first = engine.workers.get("send-email");

        registrar.registerWorker("send-email", HandlerDescriptor.of(SendEmailJob.class), Map.of("queue", "b"));

        assertEquals(1, engine.workers.size());
        assertTrue(first != engine.workers.get("send-email"));
        assertEquals(Map.of("queue", "b"), engine.workOptions.get("send-email"));
    }

    @Test
    void registerScheduleShouldPassOptionsVerbatim() {
        Map<String, Object> options = Map.of("queue", "default", "tz", "Europe/Berlin");

        registrar.registerSchedule("daily-cleanup", "0 2 * * *", options);

        RecordingQueueEngine.Scheduled scheduled = engine.schedules.get("daily-cleanup");
        assertEquals("0 2 * * *", scheduled.cron());
        assertEquals(Map.of(), scheduled.data());
        assertSame(options, scheduled.options());
    }

    public static class FailingJob implements Dispatchable<String> {
        static final List<String> CALLS = new ArrayList<>();

        @Override
        public void handle(String payload) {
            CALLS.add(payload);
            throw new IllegalStateException("rejected " + payload);
        }
    }
}
