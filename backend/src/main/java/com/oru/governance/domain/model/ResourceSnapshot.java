package com.oru.governance.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Normalized resource declarations of one container in one pod.
 *
 * CPU values are millicores, memory values bytes. An undeclared value is
 * {@code null}; zero is a real declaration.
 */
public record ResourceSnapshot(
        String namespace,
        String workloadName,
        String controllerKind,
        String podName,
        String containerName,
        Long cpuRequest,
        Long cpuLimit,
        Long memoryRequest,
        Long memoryLimit,
        Duration workloadAge
) {

    public ResourceSnapshot {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(workloadName, "workloadName");
        Objects.requireNonNull(podName, "podName");
        Objects.requireNonNull(containerName, "containerName");
        requireNonNegative("cpuRequest", cpuRequest);
        requireNonNegative("cpuLimit", cpuLimit);
        requireNonNegative("memoryRequest", memoryRequest);
        requireNonNegative("memoryLimit", memoryLimit);
        workloadAge = workloadAge == null || workloadAge.isNegative() ? Duration.ZERO : workloadAge;
    }

    public Long request(ResourceKind kind) {
        return kind == ResourceKind.CPU ? cpuRequest : memoryRequest;
    }

    public Long limit(ResourceKind kind) {
        return kind == ResourceKind.CPU ? cpuLimit : memoryLimit;
    }

    public WorkloadTarget target() {
        return new WorkloadTarget(namespace, workloadName, containerName);
    }

    /**
     * Guaranteed when every kind declares request == limit, best-effort when
     * nothing is declared at all, burstable otherwise.
     */
    public QosClass qosClass() {
        boolean anyDeclared = false;
        boolean allMatched = true;
        for (ResourceKind kind : ResourceKind.values()) {
            Long request = request(kind);
            Long limit = limit(kind);
            anyDeclared |= request != null || limit != null;
            allMatched &= request != null && request.equals(limit);
        }
        if (!anyDeclared) {
            return QosClass.BEST_EFFORT;
        }
        return allMatched ? QosClass.GUARANTEED : QosClass.BURSTABLE;
    }

    private static void requireNonNegative(String field, Long value) {
        if (value != null && value < 0) {
            throw new IllegalArgumentException(field + " must not be negative: " + value);
        }
    }
}
