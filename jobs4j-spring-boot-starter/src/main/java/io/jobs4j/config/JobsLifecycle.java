package io.jobs4j.config;

import io.jobs4j.discovery.DiscoveryReport;
import io.jobs4j.discovery.JobAutoDiscovery;
import io.jobs4j.engine.QueueEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Runs job discovery and bridges the queue engine start/stop lifecycle with the Spring container.
 */
public class JobsLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(JobsLifecycle.class);

    private final JobAutoDiscovery discovery;
    private final QueueEngine engine;
    private final boolean autoStart;
    private final boolean failOnDiscoveryError;
    private volatile boolean running = false;

    public JobsLifecycle(JobAutoDiscovery discovery, QueueEngine engine, boolean autoStart, boolean failOnDiscoveryError) {
        this.discovery = discovery;
        this.engine = engine;
        this.autoStart = autoStart;
        this.failOnDiscoveryError = failOnDiscoveryError;
    }

    @Override
    public void start() {
        try {
            DiscoveryReport report = discovery.discover();
            log.info("Jobs registered jobs={} cron={}", report.jobNames().size(), report.cronNames().size());
        } catch (RuntimeException e) {
            if (failOnDiscoveryError) {
                throw e;
            }
            log.error("Jobs discovery failed, continuing without it msg={}", e.getMessage(), e);
        }

        if (autoStart) {
            engine.start();
        }
        running = true;
    }

    @Override
    public void stop() {
        engine.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
