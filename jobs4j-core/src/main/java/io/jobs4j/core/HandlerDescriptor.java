package io.jobs4j.core;

import io.jobs4j.annotation.JobName;
import io.jobs4j.annotation.Queue;
import io.jobs4j.annotation.Schedule;
import io.jobs4j.annotation.ScheduleOption;
import io.jobs4j.annotation.WorkOption;
import io.jobs4j.utils.OptionValues;

import java.lang.reflect.Method;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Identity and configuration of a handler type, independent of the file it was loaded from.
 *
 * <p>All attributes except {@code type} are optional; absent values are {@code null}.
 * Option maps keep declaration order.
 */
public record HandlerDescriptor(
        Class<?> type,
        String jobName,
        String queue,
        Map<String, Object> workOptions,
        Map<String, Object> scheduleOptions,
        String schedule
) {

    public HandlerDescriptor {
        Objects.requireNonNull(type, "type must not be null");
        workOptions = copyOrNull(workOptions);
        scheduleOptions = copyOrNull(scheduleOptions);
    }

    /**
     * Reads the handler metadata annotations of {@code type}.
     */
    public static HandlerDescriptor of(Class<?> type) {
        Objects.requireNonNull(type, "type must not be null");

        Builder b = builder(type);

        JobName jobName = type.getAnnotation(JobName.class);
        if (jobName != null) {
            b.jobName(jobName.value());
        }
        Queue queue = type.getAnnotation(Queue.class);
        if (queue != null) {
            b.queue(queue.value());
        }
        Schedule schedule = type.getAnnotation(Schedule.class);
        if (schedule != null) {
            b.schedule(schedule.value());
        }
        for (WorkOption option : type.getAnnotationsByType(WorkOption.class)) {
            b.workOption(option.key(), OptionValues.parse(option.value()));
        }
        for (ScheduleOption option : type.getAnnotationsByType(ScheduleOption.class)) {
            b.scheduleOption(option.key(), OptionValues.parse(option.value()));
        }
        return b.build();
    }

    public static Builder builder(Class<?> type) {
        return new Builder(type);
    }

    /**
     * Simple name of the handler type, used in error messages and for name derivation.
     */
    public String typeName() {
        return type.getSimpleName();
    }

    public boolean supports(HandlerKind kind) {
        return kind.matches(type);
    }

    /**
     * Declared parameter type of the single-argument {@code handle} method, or {@code Object}
     * when the handler is generic or not dispatchable.
     */
    public Class<?> payloadType() {
        Class<?> found = null;
        for (Method m : type.getMethods()) {
            if (!"handle".equals(m.getName()) || m.getParameterCount() != 1 || m.isBridge() || m.isSynthetic()) {
                continue;
            }
            Class<?> candidate = m.getParameterTypes()[0];
            if (found == null || found.isAssignableFrom(candidate)) {
                found = candidate;
            }
        }
        return found == null ? Object.class : found;
    }

    private static Map<String, Object> copyOrNull(Map<String, Object> options) {
        if (options == null) {
            return null;
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public static final class Builder {
        private final Class<?> type;
        private String jobName;
        private String queue;
        private Map<String, Object> workOptions;
        private Map<String, Object> scheduleOptions;
        private String schedule;

        private Builder(Class<?> type) {
            this.type = Objects.requireNonNull(type, "type must not be null");
        }

        public Builder jobName(String jobName) {
            this.jobName = jobName;
            return this;
        }

        public Builder queue(String queue) {
            this.queue = queue;
            return this;
        }

        public Builder schedule(String schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder workOptions(Map<String, Object> workOptions) {
            this.workOptions = workOptions == null ? null : new LinkedHashMap<>(workOptions);
            return this;
        }

        public Builder workOption(String key, Object value) {
            requireKey(key);
            if (value == null) {
                return this;
            }
            if (workOptions == null) {
                workOptions = new LinkedHashMap<>();
            }
            workOptions.put(key, value);
            return this;
        }

        public Builder scheduleOptions(Map<String, Object> scheduleOptions) {
            this.scheduleOptions = scheduleOptions == null ? null : new LinkedHashMap<>(scheduleOptions);
            return this;
        }

        public Builder scheduleOption(String key, Object value) {
            requireKey(key);
            if (value == null) {
                return this;
            }
            if (scheduleOptions == null) {
                scheduleOptions = new LinkedHashMap<>();
            }
            scheduleOptions.put(key, value);
            return this;
        }

        public HandlerDescriptor build() {
            return new HandlerDescriptor(type, jobName, queue, workOptions, scheduleOptions, schedule);
        }

        private static void requireKey(String key) {
            Objects.requireNonNull(key, "key must not be null");
            if (key.isBlank()) {
                throw new IllegalArgumentException("key must not be blank");
            }
        }
    }
}
