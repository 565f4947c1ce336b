package com.ops.incident.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ScanCallback;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.ops.incident.model.AnomalySeverity;
import com.ops.incident.model.Incident;
import com.ops.incident.model.IncidentStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IncidentRepositoryTest {

    @Mock
    private AerospikeClient client;

    @Mock
    private SequenceRepository sequenceRepository;

    private final WritePolicy writePolicy = new WritePolicy();
    private final Policy readPolicy = new Policy();
    private IncidentRepository repository;

    @BeforeEach
    void setUp() {
        repository = new IncidentRepository(client, "test", writePolicy, readPolicy, sequenceRepository);
    }

    @Test
    void create_assignsIdAndDefaults() {
        when(sequenceRepository.next("incident_id")).thenReturn(42L);
        Incident incident = Incident.builder()
                .severity(AnomalySeverity.HIGH)
                .description("Error rate spike detected: 20/25 logs are errors (80.0%)")
                .build();

        long id = repository.create(incident);

        assertThat(id).isEqualTo(42L);
        assertThat(incident.getId()).isEqualTo(42L);
        assertThat(incident.getStatus()).isEqualTo(IncidentStatus.OPEN);
        assertThat(incident.getCreatedAt()).isNotNull();

        ArgumentCaptor<Bin[]> bins = ArgumentCaptor.forClass(Bin[].class);
        verify(client).put(eq(writePolicy), any(Key.class), bins.capture());
        assertThat(bins.getValue()).extracting(bin -> bin.name)
                .contains("id", "createdAt", "status", "severity", "description");
    }

    @Test
    void findById_mapsStoredBins() {
        Map<String, Object> bins = new HashMap<>();
        bins.put("id", 7L);
        bins.put("createdAt", Instant.parse("2026-10-19T10:00:00Z").toEpochMilli());
        bins.put("status", "RESOLVED");
        bins.put("severity", "MEDIUM");
        bins.put("description", "High error rate in checkout");
        bins.put("summary", "Checkout failing");
        bins.put("rootCause", "Gateway timeouts");
        bins.put("resolvedAt", Instant.parse("2026-10-19T11:00:00Z").toEpochMilli());
        when(client.get(eq(readPolicy), any(Key.class))).thenReturn(new Record(bins, 1, 0));

        Incident incident = repository.findById(7L);

        assertThat(incident.getId()).isEqualTo(7L);
        assertThat(incident.getStatus()).isEqualTo(IncidentStatus.RESOLVED);
        assertThat(incident.getSeverity()).isEqualTo(AnomalySeverity.MEDIUM);
        assertThat(incident.getSummary()).isEqualTo("Checkout failing");
        assertThat(incident.getResolvedAt()).isEqualTo(Instant.parse("2026-10-19T11:00:00Z"));
        assertThat(incident.hasSummary()).isTrue();
    }

    @Test
    void findById_missing_returnsNull() {
        when(client.get(eq(readPolicy), any(Key.class))).thenReturn(null);

        assertThat(repository.findById(8L)).isNull();
    }

    @Test
    void findRecent_newestFirstAndNegativeLimitYieldsNothing() {
        doAnswer(invocation -> {
            ScanCallback callback = invocation.getArgument(3);
            callback.scanCallback(null, storedIncident(1L, "2026-10-19T10:00:00Z"));
            callback.scanCallback(null, storedIncident(2L, "2026-10-19T10:05:00Z"));
            return null;
        }).when(client).scanAll(any(ScanPolicy.class), eq("test"), eq("incidents"), any(ScanCallback.class));

        assertThat(repository.findRecent(1)).extracting(Incident::getId).containsExactly(2L);
        assertThat(repository.findRecent(5)).extracting(Incident::getId).containsExactly(2L, 1L);
        assertThat(repository.findRecent(-1)).isEmpty();
    }

    private static Record storedIncident(long id, String createdAt) {
        Map<String, Object> bins = new HashMap<>();
        bins.put("id", id);
        bins.put("createdAt", Instant.parse(createdAt).toEpochMilli());
        bins.put("status", "OPEN");
        bins.put("severity", "HIGH");
        bins.put("description", "incident " + id);
        return new Record(bins, 1, 0);
    }
}
