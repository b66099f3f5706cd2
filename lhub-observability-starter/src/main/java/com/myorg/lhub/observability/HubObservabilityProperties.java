package com.myorg.lhub.observability;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "lhub.observability")
public class HubObservabilityProperties {
    private boolean enabled = true;

    private boolean mdcEnabled = true;
    private boolean metricsEnabled = true;

    // low-cardinality tags only; never tag namespace or eventId
    private boolean tagTopic = true;
    private boolean tagOutcome = true;
}
