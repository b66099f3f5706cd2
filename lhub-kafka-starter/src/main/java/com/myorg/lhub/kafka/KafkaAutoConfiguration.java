package com.myorg.lhub.kafka;

import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.KafkaAdmin;

import java.util.HashMap;
import java.util.Map;

@AutoConfiguration(before = org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration.class)
@EnableConfigurationProperties(KafkaProperties.class)
public class KafkaAutoConfiguration {

    /**
     * KafkaAdmin wired to lhub.kafka.bootstrap-servers so the topic declarations below are applied.
     * (Spring Boot's default KafkaAdmin reads spring.kafka.bootstrap-servers, which we don't use.)
     */
    @Bean
    @ConditionalOnMissingBean
    public KafkaAdmin kafkaAdmin(KafkaProperties props) {
        Map<String, Object> cfg = new HashMap<>();
        cfg.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, props.getBootstrapServers());
        KafkaAdmin admin = new KafkaAdmin(cfg);
        // the service must start even when the broker is briefly unreachable
        admin.setFatalIfBrokerNotAvailable(false);
        return admin;
    }

    /** Source topics and their dead-letter twins, applied by {@link KafkaAdmin} on startup. */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "lhub.kafka.topics", name = "create", havingValue = "true", matchIfMissing = true)
    static class TopicDeclarations {

        @Bean
        public NewTopic lineageTopic(KafkaProperties props) {
            return topic(props, props.getTopics().getLineage());
        }

        @Bean
        public NewTopic spansTopic(KafkaProperties props) {
            return topic(props, props.getTopics().getSpans());
        }

        @Bean
        public NewTopic metricsTopic(KafkaProperties props) {
            return topic(props, props.getTopics().getMetrics());
        }

        @Bean
        @ConditionalOnProperty(prefix = "lhub.kafka.dlq", name = "enabled", havingValue = "true", matchIfMissing = true)
        public NewTopic lineageDlqTopic(KafkaProperties props) {
            return topic(props, props.dlqTopic(props.getTopics().getLineage()));
        }

        @Bean
        @ConditionalOnProperty(prefix = "lhub.kafka.dlq", name = "enabled", havingValue = "true", matchIfMissing = true)
        public NewTopic spansDlqTopic(KafkaProperties props) {
            return topic(props, props.dlqTopic(props.getTopics().getSpans()));
        }

        @Bean
        @ConditionalOnProperty(prefix = "lhub.kafka.dlq", name = "enabled", havingValue = "true", matchIfMissing = true)
        public NewTopic metricsDlqTopic(KafkaProperties props) {
            return topic(props, props.dlqTopic(props.getTopics().getMetrics()));
        }

        private static NewTopic topic(KafkaProperties props, String name) {
            var t = props.getTopics();
            return TopicBuilder.name(name).partitions(t.getPartitions()).replicas(t.getReplicas()).build();
        }
    }
}
