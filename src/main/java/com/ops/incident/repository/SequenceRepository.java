package com.ops.incident.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Operation;
import com.aerospike.client.Record;
import com.aerospike.client.policy.WritePolicy;
import com.ops.incident.config.AerospikeConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

/**
 * Monotonic id allocation backed by atomic Aerospike counters, one record per sequence name.
 */
@Repository
public class SequenceRepository {

    private static final String VALUE_BIN = "value";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;

    public SequenceRepository(AerospikeClient client,
                              @Qualifier("aerospikeNamespace") String namespace,
                              @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
    }

    /**
     * Reserve {@code count} consecutive ids.
     *
     * @return the first id of the reserved block
     */
    public long reserve(String sequence, int count) {
        Key key = new Key(namespace, AerospikeConfig.SET_SEQUENCES, sequence);
        Record record = client.operate(writePolicy, key,
                Operation.add(new Bin(VALUE_BIN, count)),
                Operation.get(VALUE_BIN));
        return record.getLong(VALUE_BIN) - count + 1;
    }

    public long next(String sequence) {
        return reserve(sequence, 1);
    }
}
