package io.jobs4j.discovery;

import io.jobs4j.core.CronConfig;
import io.jobs4j.core.HandlerDescriptor;
import io.jobs4j.core.HandlerKind;
import io.jobs4j.core.JobConfig;
import io.jobs4j.core.JobConfigExtractor;
import io.jobs4j.core.JobsSettings;
import io.jobs4j.engine.JobRegistrar;
import io.jobs4j.exception.DuplicateJobNameException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Scans the configured job and cron directories and registers every handler found with the engine.
 *
 * <p>A pass validates the settings, registers job handlers, then cron handlers. The first error
 * aborts the pass and leaves it {@link DiscoveryState#FAILED}; registrations made before the error
 * stay in place. Passes are serialised; each one starts over from validation.
 */
public class JobAutoDiscovery {
    private static final Logger log = LoggerFactory.getLogger(JobAutoDiscovery.class);

    private final JobsSettings settings;
    private final JobFileScanner jobScanner;
    private final JobFileScanner cronScanner;
    private final HandlerClassImporter importer;
    private final JobConfigExtractor extractor;
    private final JobRegistrar registrar;

    private volatile DiscoveryState state = DiscoveryState.NOT_STARTED;
    private volatile Throwable lastError;

    public JobAutoDiscovery(JobsSettings settings,
                            HandlerClassImporter importer,
                            JobConfigExtractor extractor,
                            JobRegistrar registrar) {
        this(settings,
                new JobFileScanner(HandlerFileConvention.JOB),
                new JobFileScanner(HandlerFileConvention.CRON),
                importer, extractor, registrar);
    }

    public JobAutoDiscovery(JobsSettings settings,
                            JobFileScanner jobScanner,
                            JobFileScanner cronScanner,
                            HandlerClassImporter importer,
                            JobConfigExtractor extractor,
                            JobRegistrar registrar) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.jobScanner = Objects.requireNonNull(jobScanner, "jobScanner must not be null");
        this.cronScanner = Objects.requireNonNull(cronScanner, "cronScanner must not be null");
        this.importer = Objects.requireNonNull(importer, "importer must not be null");
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.registrar = Objects.requireNonNull(registrar, "registrar must not be null");
    }

    public DiscoveryState state() {
        return state;
    }

    /**
     * Error that failed the most recent pass, or {@code null}.
     */
    public Throwable lastError() {
        return lastError;
    }

    public synchronized DiscoveryReport discover() {
        lastError = null;
        Map<String, Class<?>> claimed = new HashMap<>();
        List<String> jobNames = new ArrayList<>();
        List<String> cronNames = new ArrayList<>();

        try {
            state = DiscoveryState.VALIDATING;
            validateSettings();

            state = DiscoveryState.SCANNING_JOBS;
            Path jobsPath = settings.jobsPath();
            log.info("Discovering jobs path={}", jobsPath);
            for (Path file : jobScanner.scan(jobsPath)) {
                String name = registerJob(file, claimed);
                if (name != null) {
                    jobNames.add(name);
                }
            }

            state = DiscoveryState.SCANNING_CRON;
            Path cronPath = settings.cronPath();
            log.info("Discovering cron jobs path={}", cronPath);
            for (Path file : cronScanner.scan(cronPath)) {
                String name = registerCron(file, claimed);
                if (name != null) {
                    cronNames.add(name);
                }
            }

            state = DiscoveryState.COMPLETE;
        } catch (RuntimeException | Error e) {
            lastError = e;
            state = DiscoveryState.FAILED;
            throw e;
        }

        DiscoveryReport report = new DiscoveryReport(jobNames, cronNames);
        log.info("Discovery complete jobs={} cron={}", report.jobNames(), report.cronNames());
        return report;
    }

    private void validateSettings() {
        try {
            settings.validate();
        } catch (RuntimeException e) {
            log.error("Invalid jobs settings msg={}", e.getMessage());
            throw e;
        }
    }

    private String registerJob(Path file, Map<String, Class<?>> claimed) {
        try {
            HandlerDescriptor descriptor = importer.importDescriptor(file);
            if (descriptor == null) {
                log.debug("Skipping path={}: no constructible handler type", file);
                return null;
            }
            if (!descriptor.supports(HandlerKind.DISPATCHABLE)) {
                log.debug("Skipping path={}: {} does not implement Dispatchable", file, descriptor.typeName());
                return null;
            }

            JobConfig config = extractor.extractJobConfig(descriptor);
            extractor.validateJobConfig(config, file.toString());
            claim(config.jobName(), descriptor, file, claimed);

            registrar.registerWorker(config.jobName(), descriptor, HandlerKind.DISPATCHABLE, config.workOptions());
            return config.jobName();
        } catch (RuntimeException e) {
            log.error("Failed to register job path={} msg={}", file, e.getMessage(), e);
            throw e;
        }
    }

    private String registerCron(Path file, Map<String, Class<?>> claimed) {
        try {
            HandlerDescriptor descriptor = importer.importDescriptor(file);
            if (descriptor == null) {
                log.debug("Skipping path={}: no constructible handler type", file);
                return null;
            }
            if (!descriptor.supports(HandlerKind.SCHEDULABLE)) {
                log.debug("Skipping path={}: {} does not implement Schedulable", file, descriptor.typeName());
                return null;
            }

            CronConfig config = extractor.extractCronConfig(descriptor);
            extractor.validateCronConfig(config, file.toString());
            claim(config.jobName(), descriptor, file, claimed);

            registrar.registerWorker(config.jobName(), descriptor, HandlerKind.SCHEDULABLE, config.workOptions());
            registrar.registerSchedule(config.jobName(), config.schedule(), config.scheduleOptions());
            return config.jobName();
        } catch (RuntimeException e) {
            log.error("Failed to register cron job path={} msg={}", file, e.getMessage(), e);
            throw e;
        }
    }

    private static void claim(String jobName, HandlerDescriptor descriptor, Path file, Map<String, Class<?>> claimed) {
        Class<?> existing = claimed.putIfAbsent(jobName, descriptor.type());
        if (existing != null && existing != descriptor.type()) {
            throw new DuplicateJobNameException(jobName, existing, descriptor.type(), file.toString());
        }
    }
}
