package com.myorg.lhub.eventing.quota;

import com.myorg.lhub.eventing.HubEventingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.env.Environment;

/**
 * Startup check: an in-process counter under a prod profile or {@code require-shared=true} would
 * let every replica admit the full daily quota, so startup fails instead.
 */
@Slf4j
@RequiredArgsConstructor
public class QuotaStoreGuard implements SmartInitializingSingleton {

    private final HubEventingProperties props;
    private final Environment env;
    private final QuotaCounterStore store;

    @Override
    public void afterSingletonsInstantiated() {
        if (store.shared()) {
            log.info("Quota counters: {}", store.getClass().getSimpleName());
            return;
        }

        boolean isProd = false;
        for (String p : env.getActiveProfiles()) {
            if ("prod".equalsIgnoreCase(p) || "production".equalsIgnoreCase(p)) {
                isProd = true;
                break;
            }
        }

        String msg = "Quota counters are in-memory (store=" + props.getQuota().getStore()
                + "); each gateway instance enforces its own daily limit.";
        if (props.getQuota().isRequireShared() || isProd) {
            throw new IllegalStateException(msg + " Configure lhub.eventing.quota.store=redis.");
        }
        log.warn(msg);
    }
}
