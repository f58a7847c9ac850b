package io.jobs4j.engine;

/**
 * Resolves handler instances for worker callbacks; usually backed by a DI container so handlers
 * can declare their own dependencies.
 */
@FunctionalInterface
public interface HandlerFactory {

    <T> T create(Class<T> type) throws Exception;
}
