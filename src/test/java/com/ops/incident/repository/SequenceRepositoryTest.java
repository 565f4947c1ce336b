package com.ops.incident.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Key;
import com.aerospike.client.Operation;
import com.aerospike.client.Record;
import com.aerospike.client.policy.WritePolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SequenceRepositoryTest {

    @Mock
    private AerospikeClient client;

    private final WritePolicy writePolicy = new WritePolicy();
    private SequenceRepository repository;

    @BeforeEach
    void setUp() {
        repository = new SequenceRepository(client, "test", writePolicy);
    }

    @Test
    void reserve_returnsFirstIdOfBlock() {
        when(client.operate(eq(writePolicy), any(Key.class), any(Operation[].class)))
                .thenReturn(new Record(Map.of("value", 25L), 1, 0));

        // counter now at 25 after adding 10 -> block is 16..25
        assertThat(repository.reserve("log_id", 10)).isEqualTo(16L);
    }

    @Test
    void next_singleId() {
        when(client.operate(eq(writePolicy), any(Key.class), any(Operation[].class)))
                .thenReturn(new Record(Map.of("value", 1L), 1, 0));

        assertThat(repository.next("incident_id")).isEqualTo(1L);
    }
}
