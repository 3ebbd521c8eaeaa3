package com.oru.governance.normalization;

import com.oru.governance.adapters.InventoryAdapter.RawContainerSpec;
import com.oru.governance.adapters.InventoryAdapter.RawPodSpec;
import com.oru.governance.adapters.InventoryAdapter.RawWorkloadSpec;
import com.oru.governance.domain.exception.MalformedQuantityException;
import com.oru.governance.domain.model.GovernanceOptions;
import com.oru.governance.domain.model.GovernanceScope;
import com.oru.governance.domain.model.ResourceKind;
import com.oru.governance.domain.model.ResourceSnapshot;
import com.oru.governance.domain.model.RuleId;
import com.oru.governance.domain.model.Severity;
import com.oru.governance.domain.model.ValidationFinding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Turns raw inventory declarations into uniform {@link ResourceSnapshot}s.
 *
 * NORMALIZATION RULES:
 * 1. One snapshot per container per pod
 * 2. Undeclared quantities become null, never zero
 * 3. A container with any malformed quantity is dropped with an INFO finding
 * 4. A workload without namespace, name or creation time is dropped with an INFO finding
 * 5. System namespaces are skipped in cluster scope unless explicitly included
 *
 * The normalizer is pure: same inputs, same output, no side effects beyond logging.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResourceModelNormalizer {

    private final ResourceQuantityParser quantityParser;

    public NormalizationResult normalize(
            List<RawWorkloadSpec> workloads,
            GovernanceScope scope,
            Instant now,
            GovernanceOptions options
    ) {
        List<ResourceSnapshot> snapshots = new ArrayList<>();
        List<ValidationFinding> findings = new ArrayList<>();
        TreeSet<String> excluded = new TreeSet<>();

        for (RawWorkloadSpec workload : workloads) {
            if (!hasMetadata(workload)) {
                findings.add(missingMetadata(workload));
                continue;
            }
            if (scope.isCluster() && !options.isIncludeSystemNamespaces()
                    && options.isSystemNamespace(workload.namespace())) {
                excluded.add(workload.namespace());
                continue;
            }

            Duration age = Duration.between(workload.creationTimestamp(), now);
            for (RawPodSpec pod : workload.pods()) {
                for (RawContainerSpec container : pod.containers()) {
                    normalizeContainer(workload, pod, container, age, snapshots, findings);
                }
            }
        }

        if (!excluded.isEmpty()) {
            log.debug("Excluded system namespaces from cluster scope: {}", excluded);
        }
        log.debug("Normalized {} workloads into {} snapshots ({} data-quality findings)",
                workloads.size(), snapshots.size(), findings.size());
        return new NormalizationResult(snapshots, findings, excluded);
    }

    private void normalizeContainer(
            RawWorkloadSpec workload,
            RawPodSpec pod,
            RawContainerSpec container,
            Duration age,
            List<ResourceSnapshot> snapshots,
            List<ValidationFinding> findings
    ) {
        String podName = pod.name() == null ? workload.name() : pod.name();
        if (isBlank(container.name())) {
            findings.add(ValidationFinding.builder()
                    .namespace(workload.namespace())
                    .workloadName(workload.name())
                    .podName(podName)
                    .ruleId(RuleId.MISSING_METADATA)
                    .severity(Severity.INFO)
                    .message("Container without a name in pod " + podName + " was skipped")
                    .detail(Map.of("field", "container.name"))
                    .remediation("Inspect the pod manifest; every container must be named")
                    .build());
            return;
        }

        Map<String, Long> values = new LinkedHashMap<>();
        for (ResourceKind kind : ResourceKind.values()) {
            String[][] fields = {
                    {kind.getFieldName() + " request", container.request(kind)},
                    {kind.getFieldName() + " limit", container.limit(kind)}
            };
            for (String[] field : fields) {
                try {
                    values.put(field[0], parseOptional(field[1], kind));
                } catch (MalformedQuantityException e) {
                    log.debug("Dropping {}/{}/{}: {}", workload.namespace(), podName, container.name(), e.getMessage());
                    findings.add(malformedQuantity(workload, podName, container.name(), kind, field[0], e));
                    return;
                }
            }
        }

        snapshots.add(new ResourceSnapshot(
                workload.namespace(),
                workload.name(),
                workload.controllerKind(),
                podName,
                container.name(),
                values.get("cpu request"),
                values.get("cpu limit"),
                values.get("memory request"),
                values.get("memory limit"),
                age
        ));
    }

    private Long parseOptional(String quantity, ResourceKind kind) {
        if (quantity == null || quantity.isBlank()) {
            return null;
        }
        return quantityParser.parse(quantity, kind);
    }

    private ValidationFinding malformedQuantity(
            RawWorkloadSpec workload, String podName, String containerName,
            ResourceKind kind, String field, MalformedQuantityException e) {
        Map<String, String> detail = new LinkedHashMap<>();
        detail.put("field", field);
        detail.put("value", e.getValue());
        return ValidationFinding.builder()
                .namespace(workload.namespace())
                .workloadName(workload.name())
                .podName(podName)
                .containerName(containerName)
                .ruleId(RuleId.MALFORMED_QUANTITY)
                .severity(Severity.INFO)
                .resourceKind(kind)
                .message(String.format("Container skipped: %s '%s' is not a valid quantity", field, e.getValue()))
                .detail(detail)
                .remediation("Use Kubernetes quantity notation such as 250m, 0.5, 512Mi or 1Gi")
                .build();
    }

    private ValidationFinding missingMetadata(RawWorkloadSpec workload) {
        List<String> missing = new ArrayList<>();
        if (isBlank(workload.namespace())) {
            missing.add("namespace");
        }
        if (isBlank(workload.name())) {
            missing.add("name");
        }
        if (workload.creationTimestamp() == null) {
            missing.add("creationTimestamp");
        }
        String fields = String.join(",", missing);
        return ValidationFinding.builder()
                .namespace(isBlank(workload.namespace()) ? null : workload.namespace())
                .workloadName(isBlank(workload.name()) ? null : workload.name())
                .ruleId(RuleId.MISSING_METADATA)
                .severity(Severity.INFO)
                .message("Workload skipped: missing " + fields)
                .detail(Map.of("missing", fields))
                .remediation("Check the inventory source; controllers must expose namespace, name and creation time")
                .build();
    }

    private static boolean hasMetadata(RawWorkloadSpec workload) {
        return !isBlank(workload.namespace()) && !isBlank(workload.name()) && workload.creationTimestamp() != null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
