package com.oru.governance.overcommit;

import com.oru.governance.adapters.InventoryAdapter.ClusterCapacity;
import com.oru.governance.domain.model.GovernanceOptions;
import com.oru.governance.domain.model.OvercommitResult;
import com.oru.governance.domain.model.OvercommitStatus;
import com.oru.governance.domain.model.ResourceKind;
import com.oru.governance.domain.model.ResourceOvercommit;
import com.oru.governance.domain.model.ResourceSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Sums declared requests across a scope and relates them to allocatable capacity.
 *
 * STATUS:
 * - ratio above {@code overcommitCritical}: CRITICAL
 * - ratio above {@code overcommitWarning}: WARNING
 * - otherwise HEALTHY
 * - capacity unknown or zero: CAPACITY_UNKNOWN with no ratio
 *
 * Containers without a request of a kind are counted, not guessed. Limits
 * are summed alongside and related to the same capacity. Totals beyond the
 * range of a long are reported as {@link Long#MAX_VALUE} and flagged
 * saturated; the ratios are computed from the exact sums.
 */
@Slf4j
@Service
public class OvercommitAggregator {

    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    public OvercommitResult aggregate(String scopeId, Optional<ClusterCapacity> capacity,
                                      List<ResourceSnapshot> snapshots, GovernanceOptions options) {
        OvercommitResult result = new OvercommitResult(
                scopeId,
                aggregate(ResourceKind.CPU, capacity, snapshots, options),
                aggregate(ResourceKind.MEMORY, capacity, snapshots, options));
        log.debug("Overcommit for {}: cpu={} memory={}", scopeId, result.cpu().status(), result.memory().status());
        return result;
    }

    private ResourceOvercommit aggregate(ResourceKind kind, Optional<ClusterCapacity> capacity,
                                         List<ResourceSnapshot> snapshots, GovernanceOptions options) {
        BigInteger requested = BigInteger.ZERO;
        BigInteger limits = BigInteger.ZERO;
        int withRequest = 0;
        int unaccounted = 0;
        int withoutLimit = 0;
        for (ResourceSnapshot snapshot : snapshots) {
            Long request = snapshot.request(kind);
            if (request == null) {
                unaccounted++;
            } else {
                requested = requested.add(BigInteger.valueOf(request));
                withRequest++;
            }
            Long limit = snapshot.limit(kind);
            if (limit == null) {
                withoutLimit++;
            } else {
                limits = limits.add(BigInteger.valueOf(limit));
            }
        }
        boolean saturated = requested.compareTo(LONG_MAX) > 0 || limits.compareTo(LONG_MAX) > 0;
        if (saturated) {
            log.warn("Declared {} totals exceed the counter range; reporting them saturated", kind);
        }

        Long allocatable = capacity.map(c -> c.capacity(kind)).orElse(null);
        if (allocatable == null || allocatable <= 0) {
            return new ResourceOvercommit(kind, allocatable, saturate(requested), null,
                    OvercommitStatus.CAPACITY_UNKNOWN, withRequest, unaccounted,
                    saturate(limits), null, withoutLimit, saturated);
        }

        double ratio = requested.doubleValue() / allocatable;
        OvercommitStatus status;
        if (ratio > options.getOvercommitCritical()) {
            status = OvercommitStatus.CRITICAL;
        } else if (ratio > options.getOvercommitWarning()) {
            status = OvercommitStatus.WARNING;
        } else {
            status = OvercommitStatus.HEALTHY;
        }
        return new ResourceOvercommit(kind, allocatable, saturate(requested), ratio, status, withRequest, unaccounted,
                saturate(limits), limits.doubleValue() / allocatable, withoutLimit, saturated);
    }

    private static long saturate(BigInteger total) {
        return total.min(LONG_MAX).longValueExact();
    }
}
