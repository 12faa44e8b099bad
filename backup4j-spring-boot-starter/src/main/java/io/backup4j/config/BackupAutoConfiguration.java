package io.backup4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.backup4j.Dispatcher;
import io.backup4j.TaskHandler;
import io.backup4j.adapter.StandardAdapters;
import io.backup4j.core.AdapterRegistry;
import io.backup4j.core.DestinationStore;
import io.backup4j.core.ReloadChannel;
import io.backup4j.core.ReloadPublisher;
import io.backup4j.core.ScheduleStore;
import io.backup4j.core.SourceStore;
import io.backup4j.core.TaskHandlerRegistry;
import io.backup4j.crypto.CredentialVault;
import io.backup4j.internal.BackupTaskExecutor;
import io.backup4j.internal.ScheduleDispatcher;
import io.backup4j.internal.ScheduleManager;
import io.backup4j.internal.kafka.KafkaReloadChannel;
import io.backup4j.internal.kafka.KafkaReloadPublisher;
import io.backup4j.internal.mongo.MongoDestinationStore;
import io.backup4j.internal.mongo.MongoScheduleStore;
import io.backup4j.internal.mongo.MongoSourceStore;
import io.backup4j.internal.task.BackupTaskHandlers;
import io.backup4j.internal.task.TaskWorkerPool;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.ssl.SslBundles;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Spring Boot auto-configuration entrypoint for the backup service.
 */
@AutoConfiguration(after = {MongoDataAutoConfiguration.class, KafkaAutoConfiguration.class})
@ConditionalOnClass({MongoTemplate.class, KafkaTemplate.class})
@EnableConfigurationProperties(BackupProperties.class)
@ConditionalOnProperty(prefix = "backup", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BackupAutoConfiguration {

    static final String SECRET_KEY_ENV = "SECRET_KEY";

    @Bean
    @ConditionalOnMissingBean
    public ScheduleStore backupScheduleStore(MongoTemplate mongoTemplate) {
        return new MongoScheduleStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public SourceStore backupSourceStore(MongoTemplate mongoTemplate) {
        return new MongoSourceStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public DestinationStore backupDestinationStore(MongoTemplate mongoTemplate) {
        return new MongoDestinationStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected BackupMongoIndexConfig backupMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new BackupMongoIndexConfig(mongoTemplate);
    }

    /**
     * The secret is read on every use, so a deployment without one still starts and fails
     * only when a credential is encrypted or decrypted.
     */
    @Bean
    @ConditionalOnMissingBean
    public CredentialVault credentialVault(BackupProperties props) {
        return new CredentialVault(() -> {
            String configured = props.getSecretKey();
            return configured == null || configured.isBlank() ? System.getenv(SECRET_KEY_ENV) : configured;
        });
    }

    @Bean
    @ConditionalOnMissingBean
    public AdapterRegistry adapterRegistry(BackupProperties props, ObjectMapper objectMapper) {
        return StandardAdapters.registry(props.getWorkDir(), objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public BackupTaskExecutor backupTaskExecutor(SourceStore sourceStore,
                                                 DestinationStore destinationStore,
                                                 CredentialVault credentialVault,
                                                 AdapterRegistry adapterRegistry) {
        return new BackupTaskExecutor(sourceStore, destinationStore, credentialVault, adapterRegistry);
    }

    /**
     * Built-in backup handlers plus any {@link TaskHandler} beans the application declares.
     */
    @Bean
    @ConditionalOnMissingBean
    public TaskHandlerRegistry taskHandlerRegistry(BackupTaskExecutor executor,
                                                   ObjectProvider<TaskHandler<?, ?>> extraHandlers) {
        List<TaskHandler<?, ?>> handlers = new ArrayList<>(BackupTaskHandlers.forExecutor(executor));
        extraHandlers.orderedStream().forEach(handlers::add);
        return new TaskHandlerRegistry(handlers);
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskWorkerPool taskWorkerPool(TaskHandlerRegistry registry, ObjectMapper objectMapper, BackupProperties props) {
        return new TaskWorkerPool(registry, objectMapper, props.getMaxConcurrency(), props.getTaskTimeLimit());
    }

    @Bean
    @ConditionalOnMissingBean
    public ReloadPublisher reloadPublisher(BackupProperties props,
                                           @Qualifier("backupReloadProducerFactory")
                                           ProducerFactory<String, String> producerFactory) {
        return new KafkaReloadPublisher(new KafkaTemplate<>(producerFactory), props.getReloadTopic());
    }

    /**
     * Producer behind the reload publisher; a bean so its producer is closed with the context.
     */
    @Bean
    @ConditionalOnMissingBean(name = "backupReloadProducerFactory")
    public ProducerFactory<String, String> backupReloadProducerFactory(ObjectProvider<KafkaProperties> kafkaProperties,
                                                                       ObjectProvider<SslBundles> sslBundles) {
        Map<String, Object> config = kafkaProperties.getIfAvailable(KafkaProperties::new)
                .buildProducerProperties(sslBundles.getIfAvailable());
        config.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        config.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        return new DefaultKafkaProducerFactory<>(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public ReloadChannel reloadChannel(BackupProperties props,
                                       ObjectProvider<KafkaProperties> kafkaProperties,
                                       ObjectProvider<SslBundles> sslBundles) {
        Map<String, Object> config = kafkaProperties.getIfAvailable(KafkaProperties::new)
                .buildConsumerProperties(sslBundles.getIfAvailable());
        config.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        config.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        config.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        return new KafkaReloadChannel(new DefaultKafkaConsumerFactory<>(config),
                props.getReloadTopic(), props.getReloadGroupId());
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleManager scheduleManager(ScheduleStore scheduleStore,
                                           SourceStore sourceStore,
                                           DestinationStore destinationStore,
                                           ReloadPublisher reloadPublisher,
                                           BackupProperties props,
                                           ObjectProvider<Clock> clock) {
        return new ScheduleManager(scheduleStore, sourceStore, destinationStore, reloadPublisher,
                ZoneId.of(props.getTimezone()), clock.getIfAvailable(Clock::systemUTC));
    }

    @Bean
    @ConditionalOnMissingBean
    public Dispatcher scheduleDispatcher(ScheduleStore scheduleStore,
                                         ScheduleManager scheduleManager,
                                         TaskWorkerPool taskWorkerPool,
                                         ReloadChannel reloadChannel,
                                         BackupProperties props,
                                         ObjectProvider<Clock> clock) {
        return new ScheduleDispatcher(scheduleStore, scheduleManager, taskWorkerPool, reloadChannel,
                ZoneId.of(props.getTimezone()), props.getReloadPollTimeout(), props.getReconnectMaxBackoff(),
                clock.getIfAvailable(Clock::systemUTC));
    }

    @Bean
    @ConditionalOnMissingBean
    public BackupLifecycle backupLifecycle(Dispatcher dispatcher, TaskWorkerPool taskWorkerPool, BackupProperties props) {
        return new BackupLifecycle(dispatcher, taskWorkerPool, props.getShutdownGrace());
    }

    @Bean
    @ConditionalOnProperty(prefix = "backup", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton backupIndexesInitializer(BackupMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
