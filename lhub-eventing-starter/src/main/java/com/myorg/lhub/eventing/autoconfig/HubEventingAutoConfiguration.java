package com.myorg.lhub.eventing.autoconfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.lhub.contracts.core.envelope.EnvelopeCodec;
import com.myorg.lhub.eventing.DefaultHubPublisher;
import com.myorg.lhub.eventing.HubEventingProperties;
import com.myorg.lhub.eventing.HubPublisher;
import com.myorg.lhub.eventing.deadletter.DeadLetterSink;
import com.myorg.lhub.eventing.deadletter.KafkaDeadLetterSink;
import com.myorg.lhub.eventing.deadletter.LoggingDeadLetterSink;
import com.myorg.lhub.eventing.quota.InMemoryQuotaCounterStore;
import com.myorg.lhub.eventing.quota.QuotaCounterStore;
import com.myorg.lhub.eventing.quota.QuotaStoreGuard;
import com.myorg.lhub.eventing.retry.RetryListener;
import com.myorg.lhub.eventing.retry.RetryPolicy;
import com.myorg.lhub.kafka.KafkaProducerAutoConfiguration;
import com.myorg.lhub.kafka.KafkaProperties;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.util.StringUtils;

import java.time.Clock;

@AutoConfiguration(
        after = {KafkaProducerAutoConfiguration.class, HubEventingRedisAutoConfiguration.class},
        afterName = "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration"
)
@EnableConfigurationProperties({HubEventingProperties.class, KafkaProperties.class})
@ConditionalOnClass(KafkaTemplate.class)
public class HubEventingAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock hubClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public EnvelopeCodec envelopeCodec(ObjectProvider<ObjectMapper> mapper) {
        return new EnvelopeCodec(mapper.getIfAvailable(() -> new ObjectMapper().findAndRegisterModules()));
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(HubPublisher.class)
    @ConditionalOnBean(KafkaTemplate.class)
    public HubPublisher hubPublisher(KafkaTemplate<String, byte[]> template,
                                            EnvelopeCodec codec,
                                            HubEventingProperties props,
                                            @Qualifier("publishRetryListener") ObjectProvider<RetryListener> retryListener) {
        var p = props.getPublisher();
        RetryPolicy policy = new RetryPolicy(p.getMaxAttempts(), p.getBackoffBase(), p.getBackoffMax(), p.getAttemptTimeout());
        return new DefaultHubPublisher(template, codec, policy, p.getMaxRecordBytes(),
                retryListener.getIfAvailable(() -> RetryListener.NOOP));
    }

    @Bean
    @ConditionalOnMissingBean(DeadLetterSink.class)
    @ConditionalOnBean(KafkaTemplate.class)
    @ConditionalOnProperty(prefix = "lhub.kafka.dlq", name = "enabled", havingValue = "true", matchIfMissing = true)
    public DeadLetterSink kafkaDeadLetterSink(KafkaTemplate<String, byte[]> template,
                                              EnvelopeCodec codec,
                                              KafkaProperties kafkaProps,
                                              HubEventingProperties props,
                                              Environment env) {
        return new KafkaDeadLetterSink(template, codec, kafkaProps, producerName(props, env));
    }

    @Bean
    @ConditionalOnMissingBean(DeadLetterSink.class)
    @ConditionalOnProperty(prefix = "lhub.kafka.dlq", name = "enabled", havingValue = "false")
    public DeadLetterSink loggingDeadLetterSink() {
        return new LoggingDeadLetterSink();
    }

    // ---------------- Quota counter store ----------------

    /**
     * store=redis but Redis is not on classpath -> fail fast.
     */
    @Configuration
    @ConditionalOnProperty(prefix = "lhub.eventing.quota", name = "store", havingValue = "redis")
    @ConditionalOnMissingClass("org.springframework.data.redis.connection.RedisConnectionFactory")
    static class MissingRedisDependencyFailFastConfig {
        @Bean
        public Object failFastRedisMissing() {
            throw new IllegalStateException(
                    "lhub.eventing.quota.store=redis but Redis is not on the classpath. " +
                            "Add spring-boot-starter-data-redis and configure spring.data.redis.*."
            );
        }
    }

    /**
     * store=memory, or store=auto when no Redis store was configured.
     */
    @Configuration
    @ConditionalOnExpression("'${lhub.eventing.quota.store:auto}'.toLowerCase() != 'redis'")
    static class MemoryFallbackQuotaConfig {

        @Bean(destroyMethod = "close")
        @ConditionalOnMissingBean(QuotaCounterStore.class)
        public QuotaCounterStore quotaCounterStore(HubEventingProperties props, Clock clock) {
            return new InMemoryQuotaCounterStore(clock, props.getQuota().getCleanupInterval());
        }
    }

    @Bean
    @ConditionalOnBean(QuotaCounterStore.class)
    public QuotaStoreGuard quotaStoreGuard(HubEventingProperties props, Environment env, QuotaCounterStore store) {
        return new QuotaStoreGuard(props, env, store);
    }

    static String producerName(HubEventingProperties props, Environment env) {
        String producer = props.getProducerName();
        if (!StringUtils.hasText(producer)) {
            producer = env.getProperty("spring.application.name", "unknown-service");
        }
        return producer;
    }
}
