package io.jobs4j.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * A single engine work option, e.g. {@code @WorkOption(key = "batchSize", value = "5")}.
 *
 * <p>{@link #value()} is read as a JSON literal ({@code "5"}, {@code "true"}, {@code "\"text\""});
 * anything that does not parse as JSON is passed on as a plain string.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Repeatable(WorkOptions.class)
@Documented
public @interface WorkOption {

    String key();

    String value();
}
