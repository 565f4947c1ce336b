package com.ops.incident.engine;

import com.ops.incident.model.ServiceBucket;
import com.ops.incident.model.TimeBucket;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything a detector may look at for one batch. Built fresh per call and never shared.
 */
@Value
@Builder
public class DetectionContext {
    // Ascending by minute; index i lines up with baseline.getErrorRates()[i]
    List<TimeBucket> timeBuckets;

    // First-seen order
    List<ServiceBucket> serviceBuckets;

    BaselineStatistics baseline;
}
