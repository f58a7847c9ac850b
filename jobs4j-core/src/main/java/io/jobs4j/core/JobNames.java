package io.jobs4j.core;

import io.jobs4j.annotation.JobName;

import java.util.Locale;
import java.util.Objects;

/**
 * Canonical job name resolution.
 *
 * <p>An explicit, non-blank name override always wins. Otherwise the simple type name loses one
 * trailing {@code Job} or {@code Cron} suffix and is converted to lowercase kebab-case:
 * {@code SendEmailNotificationJob -> "send-email-notification"},
 * {@code DailyCleanupCron -> "daily-cleanup"}.
 */
public final class JobNames {
    private JobNames() {
    }

    public static String resolve(HandlerDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        String explicit = descriptor.jobName();
        if (explicit != null && !explicit.isEmpty()) {
            return explicit;
        }
        return fromTypeName(descriptor.typeName());
    }

    public static String resolve(Class<?> handlerType) {
        Objects.requireNonNull(handlerType, "handlerType must not be null");
        JobName annotation = handlerType.getAnnotation(JobName.class);
        if (annotation != null && !annotation.value().isEmpty()) {
            return annotation.value();
        }
        return fromTypeName(handlerType.getSimpleName());
    }

    public static String fromTypeName(String typeName) {
        Objects.requireNonNull(typeName, "typeName must not be null");

        String name = stripSuffix(typeName);

        StringBuilder out = new StringBuilder(name.length() + 8);
        char previous = 0;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c) && !Character.isUpperCase(previous)) {
                out.append('-');
            }
            out.append(c);
            previous = c;
        }

        String kebab = out.toString().toLowerCase(Locale.ROOT);
        return kebab.startsWith("-") ? kebab.substring(1) : kebab;
    }

    private static String stripSuffix(String typeName) {
        if (typeName.endsWith("Job") && typeName.length() > 3) {
            return typeName.substring(0, typeName.length() - 3);
        }
        if (typeName.endsWith("Cron") && typeName.length() > 4) {
            return typeName.substring(0, typeName.length() - 4);
        }
        return typeName;
    }
}
