package io.jobs4j.config;

import io.jobs4j.engine.HandlerFactory;
import org.springframework.beans.factory.config.AutowireCapableBeanFactory;

import java.util.Objects;

/**
 * Resolves handlers from the application context: a unique bean of the handler type is reused,
 * otherwise a new instance is created with its dependencies autowired.
 */
public class SpringHandlerFactory implements HandlerFactory {
    private final AutowireCapableBeanFactory beanFactory;

    public SpringHandlerFactory(AutowireCapableBeanFactory beanFactory) {
        this.beanFactory = Objects.requireNonNull(beanFactory, "beanFactory must not be null");
    }

    @Override
    public <T> T create(Class<T> type) {
        T bean = beanFactory.getBeanProvider(type).getIfUnique();
        if (bean != null) {
            return bean;
        }
        return beanFactory.createBean(type);
    }
}
