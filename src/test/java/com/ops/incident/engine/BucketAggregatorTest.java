package com.ops.incident.engine;

import com.ops.incident.model.LogRecord;
import com.ops.incident.model.ServiceBucket;
import com.ops.incident.model.TimeBucket;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BucketAggregatorTest {

    private final BucketAggregator aggregator = new BucketAggregator();

    private static LogRecord record(String timestamp, String level, String service) {
        return LogRecord.builder()
                .timestamp(Instant.parse(timestamp))
                .level(level)
                .service(service)
                .message("")
                .metadata(Map.of())
                .build();
    }

    @Test
    void aggregate_groupsByMinute_sortedAscending() {
        List<LogRecord> records = List.of(
                record("2024-01-01T10:02:15Z", "info", "api"),
                record("2024-01-01T10:00:59Z", "error", "api"),
                record("2024-01-01T10:00:01Z", "warn", "db"),
                record("2024-01-01T10:02:45Z", "error", "db"));

        BucketAggregation aggregation = aggregator.aggregate(records);
        List<TimeBucket> buckets = aggregation.getTimeBuckets();

        assertThat(buckets).extracting(TimeBucket::getKey).containsExactly(
                Instant.parse("2024-01-01T10:00:00Z"),
                Instant.parse("2024-01-01T10:02:00Z"));

        assertThat(buckets.get(0).getTotal()).isEqualTo(2);
        assertThat(buckets.get(0).getErrorCount()).isEqualTo(1);
        assertThat(buckets.get(0).getWarningCount()).isEqualTo(1);
        assertThat(buckets.get(1).getTotal()).isEqualTo(2);
        assertThat(buckets.get(1).getErrorCount()).isEqualTo(1);
        assertThat(buckets.get(1).getWarningCount()).isZero();
    }

    @Test
    void aggregate_servicesInFirstSeenOrder() {
        List<LogRecord> records = List.of(
                record("2024-01-01T10:00:00Z", "info", "payments"),
                record("2024-01-01T10:01:00Z", "error", "auth"),
                record("2024-01-01T10:02:00Z", "critical", "payments"),
                record("2024-01-01T10:03:00Z", "info", "unknown"));

        List<ServiceBucket> services = aggregator.aggregate(records).getServiceBuckets();

        assertThat(services).extracting(ServiceBucket::getService)
                .containsExactly("payments", "auth", "unknown");
        assertThat(services.get(0).getTotal()).isEqualTo(2);
        assertThat(services.get(0).getErrorCount()).isEqualTo(1);
        assertThat(services.get(0).getErrorRate()).isEqualTo(0.5);
    }

    @Test
    void aggregate_everyRecordCountedOnce() {
        List<LogRecord> records = List.of(
                record("2024-01-01T10:00:00Z", "info", "a"),
                record("2024-01-01T10:00:30Z", "error", "b"),
                record("2024-01-01T10:05:00Z", "fatal", "a"),
                record("2024-01-01T11:00:00Z", "warning", "c"),
                record("2024-01-01T11:00:00Z", "", "c"));

        BucketAggregation aggregation = aggregator.aggregate(records);

        long timeTotal = aggregation.getTimeBuckets().stream().mapToLong(TimeBucket::getTotal).sum();
        long serviceTotal = aggregation.getServiceBuckets().stream().mapToLong(ServiceBucket::getTotal).sum();
        assertThat(timeTotal).isEqualTo(records.size());
        assertThat(serviceTotal).isEqualTo(records.size());
        for (TimeBucket bucket : aggregation.getTimeBuckets()) {
            assertThat(bucket.getErrorCount() + bucket.getWarningCount()).isLessThanOrEqualTo(bucket.getTotal());
        }
    }

    @Test
    void aggregate_noRecords_noBuckets() {
        BucketAggregation aggregation = aggregator.aggregate(List.of());

        assertThat(aggregation.getTimeBuckets()).isEmpty();
        assertThat(aggregation.getServiceBuckets()).isEmpty();
    }
}
