package io.jobs4j.engine;

/**
 * Creates handlers through their no-arg constructor. Used when no DI container is present.
 */
public class ReflectiveHandlerFactory implements HandlerFactory {

    @Override
    public <T> T create(Class<T> type) throws Exception {
        var constructor = type.getDeclaredConstructor();
        constructor.setAccessible(true);
        return constructor.newInstance();
    }
}
