package com.ops.incident.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the store under the "aerospike" key of /actuator/health. DOWN takes the
 * overall status down with it, so the endpoint answers 503 while no node is reachable.
 */
@Component
public class AerospikeHealthIndicator implements HealthIndicator {

    private static final Logger log = LoggerFactory.getLogger(AerospikeHealthIndicator.class);

    private final AerospikeClient client;
    private final String namespace;

    public AerospikeHealthIndicator(AerospikeClient client,
                                    @Qualifier("aerospikeNamespace") String namespace) {
        this.client = client;
        this.namespace = namespace;
    }

    @Override
    public Health health() {
        try {
            if (!client.isConnected()) {
                return Health.down()
                        .withDetail("namespace", namespace)
                        .withDetail("error", "no cluster node reachable")
                        .build();
            }
            return Health.up()
                    .withDetail("namespace", namespace)
                    .withDetail("nodes", client.getNodeNames().size())
                    .build();
        } catch (AerospikeException e) {
            log.warn("Aerospike health check failed: {}", e.getMessage());
            return Health.down(e).withDetail("namespace", namespace).build();
        }
    }
}
