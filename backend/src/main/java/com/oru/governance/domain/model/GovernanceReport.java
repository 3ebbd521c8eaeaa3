package com.oru.governance.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Immutable result of one governance run.
 *
 * Caveats list every place where data was partial (failed namespaces,
 * unknown capacity, unresolved queries) so an incomplete report never
 * looks complete.
 */
public record GovernanceReport(
        GovernanceScope scope,
        Instant generatedAt,
        TimeRange timeRange,
        List<ValidationFinding> findings,
        List<WorkloadEntry> workloads,
        OvercommitResult overcommit,
        ReportSummary summary,
        List<String> caveats
) {

    public GovernanceReport {
        findings = List.copyOf(findings);
        workloads = List.copyOf(workloads);
        caveats = List.copyOf(caveats);
    }

    public String scopeId() {
        return scope.id();
    }

    public List<Recommendation> recommendations() {
        return workloads.stream()
                .flatMap(w -> w.recommendations().values().stream())
                .toList();
    }

    public Optional<WorkloadEntry> workload(WorkloadTarget target) {
        return workloads.stream().filter(w -> w.target().equals(target)).findFirst();
    }

    public List<ValidationFinding> findingsFor(RuleId ruleId) {
        return findings.stream().filter(f -> f.ruleId() == ruleId).toList();
    }
}
