package io.jobs4j.internal.memory;

import io.jobs4j.config.InMemoryEngineProperties;
import io.jobs4j.engine.QueueEngine;
import io.jobs4j.engine.QueuedJob;
import io.jobs4j.engine.WorkHandler;
import io.jobs4j.utils.CronSchedules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Date;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Non-durable {@link QueueEngine} for tests and local development.
 *
 * <p>Core capabilities:
 * <ul>
 *   <li>Delayed jobs ({@code startAfter})</li>
 *   <li>Retries with fixed ({@code retryDelay}) or exponential delay</li>
 *   <li>Batched delivery ({@code batchSize} work option)</li>
 *   <li>Overlap prevention ({@code singletonKey})</li>
 *   <li>Cron schedules evaluated with Quartz</li>
 * </ul>
 *
 * <p>Jobs may be sent before {@link #start()} and before a worker exists for their name; they are
 * held until both are in place. Everything is lost when the JVM exits.
 */
public class InMemoryQueueEngine implements QueueEngine {
    private static final Logger log = LoggerFactory.getLogger(InMemoryQueueEngine.class);

    public static final String START_AFTER = "startAfter";
    public static final String RETRY_LIMIT = "retryLimit";
    public static final String RETRY_DELAY = "retryDelay";
    public static final String SINGLETON_KEY = "singletonKey";
    public static final String BATCH_SIZE = "batchSize";
    public static final String TIME_ZONE = "tz";

    private final InMemoryEngineProperties props;

    private final AtomicBoolean started = new AtomicBoolean(false);

    private ExecutorService workerPool;

    private Thread pollerThread;
    private Thread dispatcherThread;

    private final DelayQueue<DelayedJob> queue = new DelayQueue<>();
    private final ConcurrentHashMap<String, JobRecord> jobs = new ConcurrentHashMap<>();

    private final Object workerLock = new Object();
    private final ConcurrentHashMap<String, Worker> workers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Queue<JobRecord>> parked = new ConcurrentHashMap<>();

    private final Object singletonLock = new Object();
    // name + '\u0000' + singletonKey -> id of the live job holding it
    private final ConcurrentHashMap<String, String> liveSingletons = new ConcurrentHashMap<>();

    private final Queue<String> finished = new ConcurrentLinkedQueue<>();
    private final AtomicInteger finishedCount = new AtomicInteger();

    private final ConcurrentHashMap<String, CronSchedule> schedules = new ConcurrentHashMap<>();

    private final Semaphore globalSem;

    private static final class JobRecord {
        private final String id;
        private final String name;
        private final Object data;
        private final String singletonKey;
        private final int retryLimit;
        private final Duration retryDelay;
        private volatile JobState state = JobState.CREATED;
        private volatile int attempts;

        private JobRecord(String name, Object data, String singletonKey, int retryLimit, Duration retryDelay) {
            this.id = UUID.randomUUID().toString();
            this.name = name;
            this.data = data;
            this.singletonKey = singletonKey;
            this.retryLimit = retryLimit;
            this.retryDelay = retryDelay;
        }

        private QueuedJobState snapshot() {
            return new QueuedJobState(id, name, state, attempts);
        }
    }

    private static final class DelayedJob implements Delayed {
        private final JobRecord job;
        private final Instant runAt;

        private DelayedJob(JobRecord job, Instant runAt) {
            this.job = job;
            this.runAt = runAt;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            long ms = Duration.between(Instant.now(), runAt).toMillis();
            return unit.convert(ms, TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            if (other == this) return 0;
            if (other instanceof DelayedJob o) {
                return this.runAt.compareTo(o.runAt);
            }
            long d1 = this.getDelay(TimeUnit.MILLISECONDS);
            long d2 = other.getDelay(TimeUnit.MILLISECONDS);
            return Long.compare(d1, d2);
        }
    }

    private record Worker(WorkHandler handler, int batchSize) {
    }

    private static final class CronSchedule {
        private final String name;
        private final String cron;
        private final Object data;
        private final Map<String, Object> options;
        private final ZoneId zone;
        private volatile Instant nextRunAt;

        private CronSchedule(String name, String cron, Object data, Map<String, Object> options, ZoneId zone, Instant nextRunAt) {
            this.name = name;
            this.cron = cron;
            this.data = data;
            this.options = options;
            this.zone = zone;
            this.nextRunAt = nextRunAt;
        }
    }

    public InMemoryQueueEngine() {
        this(new InMemoryEngineProperties());
    }

    public InMemoryQueueEngine(InMemoryEngineProperties props) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        if (props.getMaxConcurrency() <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be a positive number");
        }
        this.globalSem = new Semaphore(props.getMaxConcurrency());
    }

    /**
     * Start delivering jobs and evaluating schedules. Idempotent.
     */
    @Override
    public void start() {
        Duration interval = Objects.requireNonNull(props.getProcessEvery(), "processEvery must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("processEvery must be a positive duration");
        }

        if (!started.compareAndSet(false, true)) {
            return;
        }

        log.info("In-memory queue engine starting with processEvery={}, maxConcurrency={}, retryLimit={}",
                props.getProcessEvery(),
                props.getMaxConcurrency(),
                props.getRetryLimit());

        workerPool = Executors.newFixedThreadPool(props.getMaxConcurrency(), r -> {
            Thread t = new Thread(r);
            t.setName("jobs4j.worker");
            t.setDaemon(true);
            return t;
        });

        dispatcherThread = new Thread(this::dispatchLoop);
        dispatcherThread.setName("jobs4j.dispatcher");
        dispatcherThread.setDaemon(true);
        dispatcherThread.start();

        pollerThread = new Thread(this::pollerLoop);
        pollerThread.setName("jobs4j.cron");
        pollerThread.setDaemon(true);
        pollerThread.start();

        log.info("In-memory queue engine started.");
    }

    /**
     * Stop delivering jobs, waiting up to {@code shutdownTimeout} for running handlers. Idempotent.
     * Pending jobs are kept and resume on the next {@link #start()}.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("In-memory queue engine stopping...");

        if (pollerThread != null) {
            pollerThread.interrupt();
            pollerThread = null;
        }

        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
            dispatcherThread = null;
        }

        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(props.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    workerPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workerPool.shutdownNow();
            } finally {
                workerPool = null;
            }
        }

        log.info("In-memory queue engine stopped.");
    }

    public boolean isStarted() {
        return started.get();
    }

    /**
     * @return job id, or {@code null} if a job with the same name and {@code singletonKey} is still pending or running
     */
    @Override
    public String send(String name, Object data, Map<String, Object> options) {
        Objects.requireNonNull(name, "name must not be null");
        Map<String, Object> opts = options == null ? Map.of() : options;

        Instant runAt = startAfter(opts.get(START_AFTER));
        String singletonKey = opts.get(SINGLETON_KEY) == null ? null : String.valueOf(opts.get(SINGLETON_KEY));
        int retryLimit = intOption(opts, RETRY_LIMIT, props.getRetryLimit());
        Object delay = opts.get(RETRY_DELAY);
        Duration retryDelay = delay == null ? null : Duration.ofSeconds(longValue(RETRY_DELAY, delay));

        JobRecord job = new JobRecord(name, data, singletonKey, retryLimit, retryDelay);
        if (singletonKey != null) {
            synchronized (singletonLock) {
                if (liveSingletons.putIfAbsent(singletonSlot(name, singletonKey), job.id) != null) {
                    log.debug("Job skipped, singleton still active name={} singletonKey={}", name, singletonKey);
                    return null;
                }
                jobs.put(job.id, job);
            }
        } else {
            jobs.put(job.id, job);
        }

        queue.offer(new DelayedJob(job, runAt));
        log.debug("Job queued name={} id={} runAt={}", name, job.id, runAt);
        return job.id;
    }

    /**
     * Register the worker for {@code name}, replacing any previous one. Jobs that arrived while no
     * worker existed are released.
     */
    @Override
    public void work(String name, Map<String, Object> options, WorkHandler handler) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        int batchSize = intOption(options == null ? Map.of() : options, BATCH_SIZE, 1);
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be a positive number");
        }

        int released = 0;
        synchronized (workerLock) {
            Worker previous = workers.put(name, new Worker(handler, batchSize));
            if (previous != null) {
                log.debug("Worker replaced name={}", name);
            }
            Queue<JobRecord> waiting = parked.remove(name);
            if (waiting != null) {
                for (JobRecord job : waiting) {
                    queue.offer(new DelayedJob(job, Instant.now()));
                    released++;
                }
            }
        }
        log.debug("Worker registered name={} batchSize={} released={}", name, batchSize, released);
    }

    /**
     * Install or replace the schedule for {@code name}. The {@code tz} option selects the time zone the
     * expression is evaluated in; all options are passed on to the jobs the schedule creates.
     *
     * @throws IllegalArgumentException if the cron expression cannot be evaluated
     */
    @Override
    public void schedule(String name, String cron, Object data, Map<String, Object> options) {
        Objects.requireNonNull(name, "name must not be null");
        CronSchedules.validate(cron);
        Map<String, Object> opts = options == null ? Map.of() : Map.copyOf(options);

        ZoneId zone = opts.get(TIME_ZONE) == null ? ZoneId.systemDefault() : ZoneId.of(String.valueOf(opts.get(TIME_ZONE)));
        Instant next = CronSchedules.nextRunAfter(cron, zone, Instant.now());
        schedules.put(name, new CronSchedule(name, cron, data, opts, zone, next));
        log.debug("Schedule installed name={} cron={} zone={} nextRunAt={}", name, cron, zone, next);
    }

    @Override
    public void unschedule(String name) {
        Objects.requireNonNull(name, "name must not be null");
        if (schedules.remove(name) != null) {
            log.debug("Schedule removed name={}", name);
        }
    }

    /**
     * @return snapshot of the job, or {@code null} if unknown (or cleaned up after completion)
     */
    public QueuedJobState getJob(String id) {
        JobRecord job = id == null ? null : jobs.get(id);
        return job == null ? null : job.snapshot();
    }

    public Set<String> workerNames() {
        return Set.copyOf(workers.keySet());
    }

    public Set<String> scheduleNames() {
        return Set.copyOf(schedules.keySet());
    }

    /**
     * Next time the schedule for {@code name} fires, or {@code null} if there is none.
     */
    public Instant nextRunAt(String name) {
        CronSchedule schedule = schedules.get(name);
        return schedule == null ? null : schedule.nextRunAt;
    }

    private static String singletonSlot(String name, String singletonKey) {
        return name + '\u0000' + singletonKey;
    }

    private void pollerLoop() {
        while (started.get()) {
            try {
                fireDueSchedules(Instant.now());
            } catch (Exception e) {
                log.error("jobs4j cron poll failed msg={}", e.getMessage(), e);
            }

            try {
                Thread.sleep(props.getProcessEvery().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    private void fireDueSchedules(Instant now) {
        for (CronSchedule schedule : schedules.values()) {
            Instant due = schedule.nextRunAt;
            if (due == null || now.isBefore(due)) {
                continue;
            }
            schedule.nextRunAt = CronSchedules.nextRunAfter(schedule.cron, schedule.zone, now);
            if (schedules.get(schedule.name) != schedule) {
                continue; // replaced or removed meanwhile
            }
            String id = send(schedule.name, schedule.data, schedule.options);
            log.debug("Schedule fired name={} id={} nextRunAt={}", schedule.name, id, schedule.nextRunAt);
        }
    }

    private void dispatchLoop() {
        while (started.get()) {
            try {
                DelayedJob dj = queue.take();
                JobRecord job = dj.job;

                Worker worker;
                synchronized (workerLock) {
                    worker = workers.get(job.name);
                    if (worker == null) {
                        parked.computeIfAbsent(job.name, n -> new ConcurrentLinkedQueue<>()).add(job);
                        log.debug("No worker for job, parked name={} id={}", job.name, job.id);
                        continue;
                    }
                }

                List<JobRecord> batch = new ArrayList<>();
                batch.add(job);
                collectReady(job.name, worker.batchSize(), batch);

                if (!submitToWorker(worker, batch)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("jobs4j dispatcher failed msg={}", e.getMessage(), e);
            }
        }
    }

    private void collectReady(String name, int batchSize, List<JobRecord> batch) {
        if (batch.size() >= batchSize) {
            return;
        }
        for (Iterator<DelayedJob> it = queue.iterator(); it.hasNext() && batch.size() < batchSize; ) {
            DelayedJob candidate = it.next();
            if (candidate.job.name.equals(name)
                    && candidate.getDelay(TimeUnit.MILLISECONDS) <= 0
                    && queue.remove(candidate)) {
                batch.add(candidate.job);
            }
        }
    }

    private boolean submitToWorker(Worker worker, List<JobRecord> batch) throws InterruptedException {
        try {
            globalSem.acquire();
        } catch (InterruptedException e) {
            requeue(batch);
            throw e;
        }

        ExecutorService pool = workerPool;
        List<QueuedJob> delivered = new ArrayList<>(batch.size());
        for (JobRecord job : batch) {
            job.state = JobState.ACTIVE;
            job.attempts++;
            delivered.add(new QueuedJob(job.id, job.name, job.data));
        }

        try {
            if (pool == null) {
                throw new RejectedExecutionException("worker pool is shut down");
            }
            pool.submit(() -> {
                try {
                    worker.handler().handle(delivered);
                    for (JobRecord job : batch) {
                        complete(job);
                    }
                } catch (Exception e) {
                    log.error("jobs4j job failed name={} ids={} msg={}", batch.get(0).name, ids(batch), e.getMessage(), e);
                    for (JobRecord job : batch) {
                        fail(job);
                    }
                } finally {
                    globalSem.release();
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            // stopping: put the batch back untouched for the next start
            for (JobRecord job : batch) {
                job.attempts--;
                job.state = JobState.CREATED;
            }
            requeue(batch);
            globalSem.release();
            log.debug("Worker pool unavailable, requeued jobs count={}", batch.size());
            return false;
        }
    }

    private void requeue(List<JobRecord> batch) {
        Instant now = Instant.now();
        for (JobRecord job : batch) {
            queue.offer(new DelayedJob(job, now));
        }
    }

    private void complete(JobRecord job) {
        job.state = JobState.COMPLETED;
        log.debug("Job completed name={} id={} attempts={}", job.name, job.id, job.attempts);
        finish(job);
    }

    private void fail(JobRecord job) {
        if (job.attempts <= job.retryLimit) {
            Duration delay = job.retryDelay != null ? job.retryDelay : retryDelay(job.attempts);
            job.state = JobState.RETRY;
            queue.offer(new DelayedJob(job, Instant.now().plus(delay)));
            log.debug("Job scheduled for retry name={} id={} attempts={} delay={}", job.name, job.id, job.attempts, delay);
            return;
        }
        job.state = JobState.FAILED;
        log.warn("jobs4j job reached retry limit name={} id={} attempts={} retryLimit={}",
                job.name, job.id, job.attempts, job.retryLimit);
        finish(job);
    }

    /**
     * Release the singleton slot of a job in a terminal state and drop it from {@link #jobs},
     * either right away or once more than {@code maxFinishedJobs} newer ones have finished.
     */
    private void finish(JobRecord job) {
        if (job.singletonKey != null) {
            liveSingletons.remove(singletonSlot(job.name, job.singletonKey), job.id);
        }
        if (props.isCleanupFinishedJobs()) {
            jobs.remove(job.id);
            return;
        }
        finished.offer(job.id);
        finishedCount.incrementAndGet();
        int limit = Math.max(0, props.getMaxFinishedJobs());
        while (finishedCount.get() > limit) {
            String oldest = finished.poll();
            if (oldest == null) {
                break;
            }
            finishedCount.decrementAndGet();
            jobs.remove(oldest);
        }
    }

    /**
     * Job retry delay for handler failures when no {@code retryDelay} is given.
     * attempt starts from 1 (first failure).
     * Default: 10s, 20s, 40s, 80s, 160s... capped at 10 minutes.
     */
    private static Duration retryDelay(int attempt) {
        int exp = Math.max(0, attempt - 1);
        exp = Math.min(exp, 20); // avoid overflow
        long ms = Math.min(10_000L * (1L << exp), 600_000L);
        return Duration.ofMillis(ms);
    }

    private static Instant startAfter(Object value) {
        Instant now = Instant.now();
        if (value == null) {
            return now;
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof Duration duration) {
            return now.plus(duration);
        }
        if (value instanceof Number seconds) {
            return now.plusSeconds(seconds.longValue());
        }
        if (value instanceof CharSequence text) {
            return Instant.parse(text);
        }
        throw new IllegalArgumentException("Unsupported startAfter value: " + value.getClass().getName());
    }

    private static int intOption(Map<String, Object> options, String key, int fallback) {
        Object value = options.get(key);
        return value == null ? fallback : (int) longValue(key, value);
    }

    private static long longValue(String key, Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof CharSequence text) {
            try {
                return Long.parseLong(text.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be a number but was \"" + text + "\"", e);
            }
        }
        throw new IllegalArgumentException(key + " must be a number but was " + value.getClass().getName());
    }

    private static List<String> ids(List<JobRecord> batch) {
        List<String> ids = new ArrayList<>(batch.size());
        for (JobRecord job : batch) {
            ids.add(job.id);
        }
        return ids;
    }
}
