package io.jobs4j.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Cron schedule of a {@link io.jobs4j.Schedulable} handler. Required for cron handlers.
 *
 * <p>Standard five-field syntax, e.g. {@code "0 2 * * *"} runs daily at 2 AM.
 * A six-field expression with leading seconds is accepted as well.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Schedule {

    String value();
}
