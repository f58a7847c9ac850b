package io.jobs4j.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * A single engine schedule option, passed through verbatim to the engine's schedule call.
 * Overlap prevention (e.g. {@code singletonKey}) is configured here.
 *
 * <p>Values follow the same JSON-literal rules as {@link WorkOption}.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Repeatable(ScheduleOptions.class)
@Documented
public @interface ScheduleOption {

    String key();

    String value();
}
