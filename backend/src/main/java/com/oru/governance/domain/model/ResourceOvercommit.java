package com.oru.governance.domain.model;

/**
 * Requested-to-capacity ratio of one resource kind across a scope.
 *
 * @param capacity              allocatable capacity, null when unknown
 * @param requested             sum of all present requests, clamped to {@link Long#MAX_VALUE}
 * @param ratio                 requested / capacity, null when capacity is unknown or zero
 * @param containersWithRequest containers contributing to {@code requested}
 * @param unaccountedContainers containers with no request of this kind
 * @param limits                sum of all present limits
 * @param limitRatio            limits / capacity, null when capacity is unknown or zero
 * @param containersWithoutLimit containers with no limit of this kind
 * @param saturated             a sum exceeded {@link Long#MAX_VALUE} and is reported clamped
 */
public record ResourceOvercommit(
        ResourceKind resourceKind,
        Long capacity,
        long requested,
        Double ratio,
        OvercommitStatus status,
        int containersWithRequest,
        int unaccountedContainers,
        long limits,
        Double limitRatio,
        int containersWithoutLimit,
        boolean saturated
) {
}
