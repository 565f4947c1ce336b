package com.ops.incident.engine;

import com.ops.incident.model.LogRecord;
import com.ops.incident.model.ServiceBucket;
import com.ops.incident.model.SeverityClass;
import com.ops.incident.model.TimeBucket;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Counts normalized records into one-minute buckets and per-service buckets.
 * Input order does not matter; every record lands in exactly one bucket of each kind.
 */
@Component
public class BucketAggregator {

    public BucketAggregation aggregate(Iterable<LogRecord> records) {
        TreeMap<Instant, TimeBucket> timeBuckets = new TreeMap<>();
        Map<String, ServiceBucket> serviceBuckets = new LinkedHashMap<>();

        for (LogRecord record : records) {
            Instant minute = record.getTimestamp().truncatedTo(ChronoUnit.MINUTES);
            SeverityClass severity = record.getSeverityClass();

            timeBuckets.computeIfAbsent(minute, TimeBucket::new).record(severity);
            serviceBuckets.computeIfAbsent(record.getService(), ServiceBucket::new).record(severity);
        }

        return new BucketAggregation(
                new ArrayList<>(timeBuckets.values()),
                new ArrayList<>(serviceBuckets.values()));
    }
}
