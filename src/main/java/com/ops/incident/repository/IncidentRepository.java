package com.ops.incident.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.ops.incident.config.AerospikeConfig;
import com.ops.incident.model.AnomalySeverity;
import com.ops.incident.model.Incident;
import com.ops.incident.model.IncidentStatus;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

@Repository
public class IncidentRepository {

    static final String INCIDENT_SEQUENCE = "incident_id";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final SequenceRepository sequenceRepository;

    public IncidentRepository(AerospikeClient client,
                              @Qualifier("aerospikeNamespace") String namespace,
                              @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                              @Qualifier("defaultReadPolicy") Policy readPolicy,
                              SequenceRepository sequenceRepository) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.sequenceRepository = sequenceRepository;
    }

    /**
     * Persist a new incident. Assigns id and creation time on the passed object.
     *
     * @return the new incident id
     */
    public long create(Incident incident) {
        long id = sequenceRepository.next(INCIDENT_SEQUENCE);
        incident.setId(id);
        if (incident.getCreatedAt() == null) {
            incident.setCreatedAt(Instant.now());
        }
        if (incident.getStatus() == null) {
            incident.setStatus(IncidentStatus.OPEN);
        }

        Key key = new Key(namespace, AerospikeConfig.SET_INCIDENTS, id);
        client.put(writePolicy, key,
                new Bin("id", id),
                new Bin("createdAt", incident.getCreatedAt().toEpochMilli()),
                new Bin("status", incident.getStatus().name()),
                new Bin("severity", incident.getSeverity().name()),
                new Bin("description", incident.getDescription()));
        return id;
    }

    public Incident findById(long id) {
        Key key = new Key(namespace, AerospikeConfig.SET_INCIDENTS, id);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    public List<Incident> findRecent(int limit) {
        List<Incident> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_INCIDENTS,
                (key, record) -> {
                    synchronized (results) {
                        results.add(mapRecord(record));
                    }
                });

        results.sort(Comparator.comparing(Incident::getCreatedAt)
                .thenComparingLong(Incident::getId)
                .reversed());
        int max = Math.max(limit, 0);
        if (results.size() > max) {
            return new ArrayList<>(results.subList(0, max));
        }
        return results;
    }

    public int countOpen() {
        AtomicInteger open = new AtomicInteger();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_INCIDENTS,
                (key, record) -> {
                    if (IncidentStatus.OPEN.name().equals(record.getString("status"))) {
                        open.incrementAndGet();
                    }
                }, "status");
        return open.get();
    }

    public void updateSummary(long id, String summary, String rootCause) {
        Key key = new Key(namespace, AerospikeConfig.SET_INCIDENTS, id);
        client.put(writePolicy, key,
                new Bin("summary", summary),
                new Bin("rootCause", rootCause));
    }

    public void markResolved(long id, Instant resolvedAt) {
        Key key = new Key(namespace, AerospikeConfig.SET_INCIDENTS, id);
        client.put(writePolicy, key,
                new Bin("status", IncidentStatus.RESOLVED.name()),
                new Bin("resolvedAt", resolvedAt.toEpochMilli()));
    }

    private Incident mapRecord(Record record) {
        long resolvedAt = record.getLong("resolvedAt");
        return Incident.builder()
                .id(record.getLong("id"))
                .createdAt(Instant.ofEpochMilli(record.getLong("createdAt")))
                .status(IncidentStatus.valueOf(record.getString("status")))
                .severity(AnomalySeverity.valueOf(record.getString("severity")))
                .description(record.getString("description"))
                .summary(record.getString("summary"))
                .rootCause(record.getString("rootCause"))
                .resolvedAt(resolvedAt > 0 ? Instant.ofEpochMilli(resolvedAt) : null)
                .build();
    }
}
