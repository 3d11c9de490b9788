package com.recursa.core.health;

import com.recursa.core.persistence.StateStore;
import com.recursa.core.persistence.StateStoreException;
import com.recursa.core.persistence.StoreProperties;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for the task state store. Reports DOWN when a
 * probe read fails.
 */
@Component("stateStoreHealthIndicator")
public class StateStoreHealthIndicator implements HealthIndicator {

    static final String PROBE_TASK_ID = "__health_probe__";

    private final StateStore store;
    private final StoreProperties props;

    public StateStoreHealthIndicator(StateStore store, StoreProperties props) {
        this.store = store;
        this.props = props;
    }

    @Override
    public Health health() {
        try {
            store.load(PROBE_TASK_ID);
            return Health.up()
                    .withDetail("type", props.getType())
                    .withDetail("store", store.getClass().getSimpleName())
                    .build();
        } catch (StateStoreException e) {
            return Health.down()
                    .withDetail("type", props.getType())
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}
