package com.ops.incident.engine;

import com.ops.incident.model.ServiceBucket;
import com.ops.incident.model.TimeBucket;
import lombok.Value;

import java.util.List;

/**
 * Per-minute buckets in ascending time order and per-service buckets in first-seen order.
 */
@Value
public class BucketAggregation {
    List<TimeBucket> timeBuckets;
    List<ServiceBucket> serviceBuckets;
}
