package com.myorg.lhub.kafka;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
public class KafkaDlqAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public HubDlqReasonClassifier hubDlqReasonClassifier() {
        return new DefaultHubDlqReasonClassifier();
    }
}
