package io.jobs4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobs4j.JobDispatcher;
import io.jobs4j.core.JobConfigExtractor;
import io.jobs4j.core.JobsSettings;
import io.jobs4j.discovery.HandlerClassImporter;
import io.jobs4j.discovery.JobAutoDiscovery;
import io.jobs4j.engine.HandlerFactory;
import io.jobs4j.engine.JobRegistrar;
import io.jobs4j.engine.QueueEngine;
import io.jobs4j.internal.memory.InMemoryQueueEngine;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.config.AutowireCapableBeanFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot auto-configuration entrypoint for job discovery and dispatch.
 *
 * <p>An in-memory engine is provided when the application defines no {@link QueueEngine} bean.
 */
@AutoConfiguration
@ConditionalOnClass(JobAutoDiscovery.class)
@EnableConfigurationProperties(JobsProperties.class)
@ConditionalOnProperty(prefix = "jobs", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobsConfig {

    @Bean
    @ConditionalOnMissingBean
    public JobsSettings jobsSettings(JobsProperties props) {
        JobsSettings settings = props.toSettings();
        settings.validate();
        return settings;
    }

    @Bean
    @ConditionalOnMissingBean(QueueEngine.class)
    public InMemoryQueueEngine inMemoryQueueEngine(JobsProperties props) {
        return new InMemoryQueueEngine(props.getMemory());
    }

    @Bean
    @ConditionalOnMissingBean(HandlerFactory.class)
    public SpringHandlerFactory springHandlerFactory(AutowireCapableBeanFactory beanFactory) {
        return new SpringHandlerFactory(beanFactory);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobRegistrar jobRegistrar(QueueEngine engine, HandlerFactory handlerFactory, ObjectProvider<ObjectMapper> objectMapper) {
        return new JobRegistrar(engine, handlerFactory, objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public JobConfigExtractor jobConfigExtractor(JobsSettings settings) {
        return new JobConfigExtractor(settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public HandlerClassImporter handlerClassImporter() {
        return new HandlerClassImporter();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobAutoDiscovery jobAutoDiscovery(JobsSettings settings,
                                             HandlerClassImporter importer,
                                             JobConfigExtractor extractor,
                                             JobRegistrar registrar) {
        return new JobAutoDiscovery(settings, importer, extractor, registrar);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobDispatcher jobDispatcher(QueueEngine engine) {
        return new JobDispatcher(engine);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobsLifecycle jobsLifecycle(JobAutoDiscovery discovery, QueueEngine engine, JobsProperties props) {
        return new JobsLifecycle(discovery, engine, props.isAutoStart(), props.isFailOnDiscoveryError());
    }
}
