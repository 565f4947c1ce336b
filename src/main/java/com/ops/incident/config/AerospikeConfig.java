package com.ops.incident.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * Aerospike connection and the default read/write policies shared by all repositories.
 * Replaced by mock beans under the "test" profile.
 */
@Configuration
@Profile("!test")
public class AerospikeConfig {

    private static final Logger log = LoggerFactory.getLogger(AerospikeConfig.class);

    public static final String SET_LOGS = "logs";
    public static final String SET_INCIDENTS = "incidents";
    public static final String SET_SEQUENCES = "sequences";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:incidents}")
    private String namespace;

    @Value("${aerospike.max-conns-per-node:100}")
    private int maxConnsPerNode;

    // Milliseconds
    @Value("${aerospike.total-timeout-ms:3000}")
    private int totalTimeoutMs;

    @Value("${aerospike.socket-timeout-ms:1000}")
    private int socketTimeoutMs;

    @Bean(destroyMethod = "close")
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = maxConnsPerNode;
        clientPolicy.timeout = 5000;
        clientPolicy.readPolicyDefault = defaultReadPolicy();
        clientPolicy.writePolicyDefault = defaultWritePolicy();

        log.info("Connecting to Aerospike at {}:{} (namespace={})", host, port, namespace);
        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        applyTimeouts(policy);
        return policy;
    }

    @Bean
    public Policy defaultReadPolicy() {
        Policy policy = new Policy();
        applyTimeouts(policy);
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }

    private void applyTimeouts(Policy policy) {
        policy.totalTimeout = totalTimeoutMs;
        policy.socketTimeout = socketTimeoutMs;
    }
}
