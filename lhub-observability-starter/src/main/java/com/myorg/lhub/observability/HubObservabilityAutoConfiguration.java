package com.myorg.lhub.observability;

import com.myorg.lhub.eventing.HubPublisher;
import com.myorg.lhub.eventing.retry.RetryListener;
import com.myorg.lhub.kafka.KafkaProperties;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

import java.util.List;

@AutoConfiguration(afterName = {
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"
})
@ConditionalOnClass(HubPublisher.class)
@EnableConfigurationProperties({HubObservabilityProperties.class, KafkaProperties.class})
public class HubObservabilityAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    public HubMetrics hubMetrics(MeterRegistry registry, Environment env, HubObservabilityProperties props) {
        String app = env.getProperty("spring.application.name", "unknown-service");
        return new HubMetrics(registry, app, props);
    }

    /**
     * Pre-register meters at startup so /actuator/metrics/<name> never returns 404.
     */
    @Bean
    public SmartLifecycle hubMetricsPreRegisterLifecycle(
            HubObservabilityProperties props,
            KafkaProperties kafkaProps,
            ObjectProvider<HubMetrics> metricsProvider
    ) {
        return new SmartLifecycle() {
            private boolean running = false;

            @Override public void start() {
                if (props.isEnabled() && props.isMetricsEnabled()) {
                    HubMetrics m = metricsProvider.getIfAvailable();
                    var t = kafkaProps.getTopics();
                    if (m != null) m.preRegisterBaseMeters(List.of(t.getLineage(), t.getSpans(), t.getMetrics()));
                }
                running = true;
            }

            @Override public void stop() { running = false; }
            @Override public boolean isRunning() { return running; }
            @Override public int getPhase() { return Integer.MIN_VALUE; } // start very early
        };
    }

    /** Counts publisher retries; picked up by name by the publisher auto-configuration. */
    @Bean(name = "publishRetryListener")
    @ConditionalOnMissingBean(name = "publishRetryListener")
    public RetryListener publishRetryListener(HubObservabilityProperties props, ObjectProvider<HubMetrics> metricsProvider) {
        return (what, attempt, error, backoff) -> {
            HubMetrics m = metricsProvider.getIfAvailable();
            if (m != null && props.isEnabled() && props.isMetricsEnabled()) m.incPublishRetry();
        };
    }

    @Bean
    public static BeanPostProcessor observingPublisherBpp(
            ObjectProvider<HubObservabilityProperties> propsProvider,
            ObjectProvider<HubMetrics> metricsProvider
    ) {
        return new BeanPostProcessor() {
            @Override
            public Object postProcessAfterInitialization(Object bean, String beanName) {
                if (!(bean instanceof HubPublisher publisher)) return bean;
                if (bean instanceof ObservingHubPublisher) return bean;
                HubObservabilityProperties props = propsProvider.getObject();
                if (!props.isEnabled()) return bean;

                return new ObservingHubPublisher(publisher, props, metricsProvider.getIfAvailable());
            }
        };
    }
}
