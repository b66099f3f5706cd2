package com.myorg.lhub.kafka;

import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Producer side. Values are already-encoded envelope bytes, so the producer only moves bytes and
 * never re-serializes: what the publisher computed is what lands in the log.
 */
@AutoConfiguration(before = org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration.class)
@ConditionalOnClass(KafkaTemplate.class)
@EnableConfigurationProperties(KafkaProperties.class)
public class KafkaProducerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ProducerFactory<String, byte[]> producerFactory(KafkaProperties props) {
        Map<String, Object> p = new HashMap<>();
        p.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, props.getBootstrapServers());
        p.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        p.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class);

        var pr = props.getProducer();
        p.put(ProducerConfig.ACKS_CONFIG, pr.getAcks());
        p.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, pr.isIdempotence());
        p.put(ProducerConfig.RETRIES_CONFIG, pr.getRetries());
        // <= 5 keeps per-partition ordering with idempotence on
        p.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, pr.getMaxInFlight());
        p.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, pr.getCompression());
        p.put(ProducerConfig.LINGER_MS_CONFIG, pr.getLingerMs());
        p.put(ProducerConfig.BATCH_SIZE_CONFIG, pr.getBatchSize());
        p.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, pr.getDeliveryTimeoutMs());
        p.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, pr.getRequestTimeoutMs());
        p.put(ProducerConfig.MAX_REQUEST_SIZE_CONFIG, pr.getMaxRequestSize());
        p.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, pr.getMaxBlockMs());
        return new DefaultKafkaProducerFactory<>(p);
    }

    @Bean
    @ConditionalOnMissingBean
    public KafkaTemplate<String, byte[]> kafkaTemplate(ProducerFactory<String, byte[]> pf) {
        return new KafkaTemplate<>(pf);
    }
}
