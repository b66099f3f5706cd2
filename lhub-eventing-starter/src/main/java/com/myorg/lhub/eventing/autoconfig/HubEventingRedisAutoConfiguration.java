package com.myorg.lhub.eventing.autoconfig;

import com.myorg.lhub.eventing.HubEventingProperties;
import com.myorg.lhub.eventing.quota.QuotaCounterStore;
import com.myorg.lhub.eventing.quota.RedisQuotaCounterStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.util.StringUtils;

/**
 * Redis-backed quota counters, kept apart from {@link HubEventingAutoConfiguration} so the starter
 * still loads when Redis is not on the classpath.
 */
@Slf4j
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration")
@EnableConfigurationProperties(HubEventingProperties.class)
@ConditionalOnClass(RedisConnectionFactory.class)
public class HubEventingRedisAutoConfiguration {

    /**
     * store=redis without any RedisConnectionFactory: build a standalone Lettuce one from spring.data.redis.*.
     */
    @Configuration
    @ConditionalOnProperty(prefix = "lhub.eventing.quota", name = "store", havingValue = "redis")
    @ConditionalOnClass(LettuceConnectionFactory.class)
    @ConditionalOnMissingBean(RedisConnectionFactory.class)
    static class EnsureRedisConnectionFactoryConfig {

        @Bean
        public RedisConnectionFactory redisConnectionFactory(Environment env) {
            String host = env.getProperty("spring.data.redis.host", "localhost");
            int port = Integer.parseInt(env.getProperty("spring.data.redis.port", "6379"));
            int db = Integer.parseInt(env.getProperty("spring.data.redis.database", "0"));
            String username = env.getProperty("spring.data.redis.username");
            String password = env.getProperty("spring.data.redis.password");

            log.warn("No RedisConnectionFactory bean found; creating standalone LettuceConnectionFactory for quota counters");

            RedisStandaloneConfiguration cfg = new RedisStandaloneConfiguration(host, port);
            cfg.setDatabase(db);
            if (StringUtils.hasText(username)) {
                cfg.setUsername(username);
            }
            if (StringUtils.hasText(password)) {
                cfg.setPassword(RedisPassword.of(password));
            }
            return new LettuceConnectionFactory(cfg);
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "lhub.eventing.quota", name = "store", havingValue = "redis")
    static class StrictRedisQuotaConfig {

        @Bean
        @ConditionalOnMissingBean(StringRedisTemplate.class)
        public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory cf) {
            return new StringRedisTemplate(cf);
        }

        @Bean
        @ConditionalOnMissingBean(QuotaCounterStore.class)
        public QuotaCounterStore quotaCounterStore(HubEventingProperties props, StringRedisTemplate redis) {
            return new RedisQuotaCounterStore(redis, props.getQuota().getKeyPrefix());
        }
    }

    /**
     * store=auto: use Redis when a RedisConnectionFactory is already there.
     */
    @Configuration
    @ConditionalOnProperty(prefix = "lhub.eventing.quota", name = "store", havingValue = "auto", matchIfMissing = true)
    @ConditionalOnBean(RedisConnectionFactory.class)
    static class AutoRedisQuotaConfig {

        @Bean
        @ConditionalOnMissingBean(StringRedisTemplate.class)
        public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory cf) {
            return new StringRedisTemplate(cf);
        }

        @Bean
        @ConditionalOnMissingBean(QuotaCounterStore.class)
        public QuotaCounterStore quotaCounterStore(HubEventingProperties props, StringRedisTemplate redis) {
            return new RedisQuotaCounterStore(redis, props.getQuota().getKeyPrefix());
        }
    }
}
