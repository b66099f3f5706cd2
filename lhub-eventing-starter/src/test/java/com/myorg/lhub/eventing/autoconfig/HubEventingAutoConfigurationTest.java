package com.myorg.lhub.eventing.autoconfig;

import com.myorg.lhub.eventing.HubPublisher;
import com.myorg.lhub.eventing.deadletter.DeadLetterSink;
import com.myorg.lhub.eventing.deadletter.KafkaDeadLetterSink;
import com.myorg.lhub.eventing.deadletter.LoggingDeadLetterSink;
import com.myorg.lhub.eventing.quota.InMemoryQuotaCounterStore;
import com.myorg.lhub.eventing.quota.QuotaCounterStore;
import com.myorg.lhub.eventing.quota.RedisQuotaCounterStore;
import com.myorg.lhub.kafka.KafkaProducerAutoConfiguration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class HubEventingAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    KafkaProducerAutoConfiguration.class,
                    HubEventingRedisAutoConfiguration.class,
                    HubEventingAutoConfiguration.class
            ));

    @Test
    void wiresPublisherDeadLetterSinkAndMemoryCountersByDefault() {
        runner.run(ctx -> {
            assertThat(ctx).hasSingleBean(HubPublisher.class);
            assertThat(ctx.getBean(DeadLetterSink.class)).isInstanceOf(KafkaDeadLetterSink.class);
            assertThat(ctx.getBean(QuotaCounterStore.class)).isInstanceOf(InMemoryQuotaCounterStore.class);
        });
    }

    @Test
    void disabledDlqFallsBackToLogging() {
        runner.withPropertyValues("lhub.kafka.dlq.enabled=false").run(ctx ->
                assertThat(ctx.getBean(DeadLetterSink.class)).isInstanceOf(LoggingDeadLetterSink.class));
    }

    @Test
    void autoStorePrefersRedisWhenAConnectionFactoryExists() {
        runner.withUserConfiguration(RedisConfig.class).run(ctx ->
                assertThat(ctx.getBean(QuotaCounterStore.class)).isInstanceOf(RedisQuotaCounterStore.class));
    }

    @Test
    void memoryStoreIgnoresRedis() {
        runner.withUserConfiguration(RedisConfig.class)
                .withPropertyValues("lhub.eventing.quota.store=memory")
                .run(ctx -> assertThat(ctx.getBean(QuotaCounterStore.class)).isInstanceOf(InMemoryQuotaCounterStore.class));
    }

    @Test
    void requireSharedRefusesInMemoryCounters() {
        runner.withPropertyValues("lhub.eventing.quota.require-shared=true").run(ctx ->
                assertThat(ctx).hasFailed());
    }

    @Configuration(proxyBeanMethods = false)
    static class RedisConfig {
        @Bean
        RedisConnectionFactory redisConnectionFactory() {
            return mock(RedisConnectionFactory.class);
        }
    }
}
