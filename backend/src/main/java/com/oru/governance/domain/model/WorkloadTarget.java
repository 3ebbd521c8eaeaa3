package com.oru.governance.domain.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identity of one declarable container resource: a container within a workload.
 * Metric queries and recommendations are keyed by this.
 */
public record WorkloadTarget(String namespace, String workloadName, String containerName) {

    public static final Comparator<WorkloadTarget> ORDER = Comparator
            .comparing(WorkloadTarget::namespace)
            .thenComparing(WorkloadTarget::workloadName)
            .thenComparing(WorkloadTarget::containerName);

    public WorkloadTarget {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(workloadName, "workloadName");
        Objects.requireNonNull(containerName, "containerName");
    }

    @Override
    public String toString() {
        return namespace + "/" + workloadName + "/" + containerName;
    }
}
