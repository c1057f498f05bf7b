package com.flowb.social.config;

import com.flowb.social.model.Crew;
import com.flowb.social.store.DataStore;
import com.flowb.social.store.StoreQuery;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for data store connectivity.
 * Reads a single crew row to prove the store answers and the service key is accepted.
 */
@Component
public class DataStoreHealthIndicator implements HealthIndicator {

    private final DataStore dataStore;
    private final DataStoreProperties properties;

    @Autowired
    public DataStoreHealthIndicator(DataStore dataStore, DataStoreProperties properties) {
        this.dataStore = dataStore;
        this.properties = properties;
    }

    @Override
    public Health health() {
        try {
            dataStore.query(StoreQuery.from(Crew.TABLE).limit(1), Crew.class);
            return Health.up()
                .withDetail("store", properties.getUrl())
                .build();
        } catch (Exception e) {
            return Health.down()
                .withDetail("error", "Data store connection failed")
                .withDetail("message", e.getMessage())
                .build();
        }
    }
}
