package com.oru.governance.domain.model;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A single categorized, severity-ranked observation about a subject.
 *
 * The subject is namespace/workload/pod/container; trailing parts are null
 * for workload- or namespace-level findings. {@code detail} keeps insertion
 * order and holds the literal observed values in Kubernetes notation.
 */
@Builder
public record ValidationFinding(
        String namespace,
        String workloadName,
        String podName,
        String containerName,
        RuleId ruleId,
        Severity severity,
        ResourceKind resourceKind,
        String message,
        Map<String, String> detail,
        String remediation
) {

    public ValidationFinding {
        Objects.requireNonNull(ruleId, "ruleId");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
        detail = detail == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(detail));
    }

    /**
     * Starts a builder with the subject fields taken from a snapshot.
     */
    public static ValidationFindingBuilder about(ResourceSnapshot snapshot) {
        return builder()
                .namespace(snapshot.namespace())
                .workloadName(snapshot.workloadName())
                .podName(snapshot.podName())
                .containerName(snapshot.containerName());
    }

    public FindingCategory category() {
        return ruleId.getCategory();
    }

    /**
     * Human readable subject path, e.g. {@code payments/api/api-7d9f/app}.
     */
    public String subject() {
        StringBuilder path = new StringBuilder(namespace == null ? "<unknown>" : namespace);
        for (String part : new String[]{workloadName, podName, containerName}) {
            if (part != null) {
                path.append('/').append(part);
            }
        }
        return path.toString();
    }

    public String detailText() {
        return detail.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", "));
    }

    public boolean concerns(WorkloadTarget target) {
        return target.namespace().equals(namespace)
                && target.workloadName().equals(workloadName)
                && (containerName == null || target.containerName().equals(containerName));
    }
}
