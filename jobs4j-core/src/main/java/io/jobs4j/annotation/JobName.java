package io.jobs4j.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Overrides the job name derived from the class name.
 *
 * <p>Default: kebab-case of the simple class name without its {@code Job}/{@code Cron} suffix
 * ({@code CreateDatabaseJob -> "create-database"}).
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface JobName {

    String value();
}
