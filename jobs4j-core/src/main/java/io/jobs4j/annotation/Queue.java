package io.jobs4j.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Queue the handler runs in. Must be one of the configured queues when a queue list is set.
 * Without this annotation the configured default queue (or {@code "default"}) is used.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Queue {

    String value();
}
