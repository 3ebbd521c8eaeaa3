package com.oru.governance.adapters;

import com.oru.governance.domain.model.GovernanceScope;
import com.oru.governance.domain.model.ResourceKind;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Port interface for cluster inventory.
 *
 * ADAPTER PATTERN:
 * Implementations read workload declarations from the orchestrator and hand
 * back raw, unparsed quantity strings. Interpretation is left to the
 * normalizer so every backend is judged by the same grammar.
 *
 * FAILURE CONTRACT:
 * - Per-namespace or per-workload listing problems are reported as
 *   {@link InventoryFailure}s alongside whatever could be listed.
 * - {@link com.oru.governance.domain.exception.InventoryUnavailableException}
 *   is thrown only when nothing at all can be listed for the scope.
 */
public interface InventoryAdapter {

    /**
     * Lists the declared resources of every workload in scope.
     */
    WorkloadInventory listWorkloadResourceSpecs(GovernanceScope scope);

    /**
     * Allocatable capacity of the nodes backing the scope, if known.
     * May throw; callers treat any failure as unknown capacity.
     */
    Optional<ClusterCapacity> getClusterCapacity(GovernanceScope scope);

    /**
     * A controller-level workload with its running pods.
     */
    record RawWorkloadSpec(
            String namespace,
            String name,
            String controllerKind,
            Instant creationTimestamp,
            List<RawPodSpec> pods
    ) {
        public RawWorkloadSpec {
            pods = pods == null ? List.of() : List.copyOf(pods);
        }
    }

    record RawPodSpec(String name, List<RawContainerSpec> containers) {
        public RawPodSpec {
            containers = containers == null ? List.of() : List.copyOf(containers);
        }
    }

    /**
     * Requests and limits keyed by resource name ({@code cpu}, {@code memory}),
     * values exactly as declared, e.g. {@code "250m"} or {@code "1Gi"}.
     */
    record RawContainerSpec(String name, Map<String, String> requests, Map<String, String> limits) {
        public RawContainerSpec {
            requests = requests == null ? Map.of() : Map.copyOf(requests);
            limits = limits == null ? Map.of() : Map.copyOf(limits);
        }

        public String request(ResourceKind kind) {
            return requests.get(kind.getFieldName());
        }

        public String limit(ResourceKind kind) {
            return limits.get(kind.getFieldName());
        }
    }

    record InventoryFailure(String namespace, String workloadName, String reason) {
    }

    record WorkloadInventory(List<RawWorkloadSpec> workloads, List<InventoryFailure> failures) {
        public WorkloadInventory {
            workloads = workloads == null ? List.of() : List.copyOf(workloads);
            failures = failures == null ? List.of() : List.copyOf(failures);
        }

        public static WorkloadInventory of(List<RawWorkloadSpec> workloads) {
            return new WorkloadInventory(workloads, List.of());
        }
    }

    /**
     * Summed node allocatable capacity. A null component means that
     * resource could not be determined.
     */
    record ClusterCapacity(Long cpuMillicores, Long memoryBytes, int nodeCount) {

        public Long capacity(ResourceKind kind) {
            return kind == ResourceKind.CPU ? cpuMillicores : memoryBytes;
        }
    }
}
