package com.oru.governance.service;

import com.oru.governance.adapters.InventoryAdapter;
import com.oru.governance.adapters.InventoryAdapter.ClusterCapacity;
import com.oru.governance.adapters.InventoryAdapter.InventoryFailure;
import com.oru.governance.adapters.InventoryAdapter.WorkloadInventory;
import com.oru.governance.config.GovernanceOptionsValidator;
import com.oru.governance.domain.exception.InvalidConfigurationException;
import com.oru.governance.domain.exception.InventoryUnavailableException;
import com.oru.governance.domain.model.GovernanceOptions;
import com.oru.governance.domain.model.GovernanceReport;
import com.oru.governance.domain.model.GovernanceScope;
import com.oru.governance.domain.model.OvercommitResult;
import com.oru.governance.domain.model.Recommendation;
import com.oru.governance.domain.model.ResourceKind;
import com.oru.governance.domain.model.ResourceSnapshot;
import com.oru.governance.domain.model.RuleId;
import com.oru.governance.domain.model.Severity;
import com.oru.governance.domain.model.TimeRange;
import com.oru.governance.domain.model.ValidationFinding;
import com.oru.governance.domain.model.WorkloadCategory;
import com.oru.governance.domain.model.WorkloadEntry;
import com.oru.governance.domain.model.WorkloadTarget;
import com.oru.governance.metrics.MetricQueryPlanner;
import com.oru.governance.metrics.QueryStatus;
import com.oru.governance.metrics.WorkloadMetricResult;
import com.oru.governance.normalization.NormalizationResult;
import com.oru.governance.normalization.ResourceModelNormalizer;
import com.oru.governance.overcommit.OvercommitAggregator;
import com.oru.governance.recommendation.HistoricalRecommendationReducer;
import com.oru.governance.recommendation.UsageComparison;
import com.oru.governance.report.GovernanceReportAssembler;
import com.oru.governance.validation.ValidationRuleEngine;
import com.oru.governance.validation.WorkloadClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point of the resource governance engine.
 *
 * PIPELINE:
 * 1. Validate options and arguments (rejects, never clamps)
 * 2. List inventory for the scope; only a total listing failure is fatal
 * 3. Normalize declarations into container snapshots
 * 4. Run validation rules and overcommit aggregation (cheap, synchronous)
 * 5. Query history for established targets with bounded concurrency
 * 6. Reduce samples into recommendations and compare them with declarations
 * 7. Assemble the report, with caveats wherever data was partial
 *
 * Each call works on its own state; concurrent reports share only the
 * metric query executor.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResourceGovernanceEngine {

    private static final List<ResourceKind> KINDS = List.of(ResourceKind.values());

    private final InventoryAdapter inventoryAdapter;
    private final ResourceModelNormalizer normalizer;
    private final ValidationRuleEngine ruleEngine;
    private final WorkloadClassifier workloadClassifier;
    private final OvercommitAggregator overcommitAggregator;
    private final MetricQueryPlanner queryPlanner;
    private final HistoricalRecommendationReducer reducer;
    private final UsageComparison usageComparison;
    private final GovernanceReportAssembler assembler;
    private final GovernanceOptionsValidator optionsValidator;
    private final GovernanceOptions defaultGovernanceOptions;
    private final Clock clock;

    /**
     * Generates a report using the configured default options.
     */
    public GovernanceReport generateReport(GovernanceScope scope, TimeRange timeRange) {
        return generateReport(scope, timeRange, defaultGovernanceOptions);
    }

    /**
     * Generates a report with per-call options.
     *
     * @throws InvalidConfigurationException  if scope, range or options are invalid
     * @throws InventoryUnavailableException  if no workload at all could be listed
     */
    public GovernanceReport generateReport(GovernanceScope scope, TimeRange timeRange, GovernanceOptions options) {
        if (scope == null || timeRange == null) {
            throw new InvalidConfigurationException("scope and time range must be set");
        }
        optionsValidator.validate(options);

        Instant now = clock.instant();
        if (!timeRange.start().isBefore(now)) {
            throw new InvalidConfigurationException("time range " + timeRange + " starts in the future");
        }
        log.info("Generating governance report for {} over {}", scope.id(), timeRange);

        List<String> caveats = new ArrayList<>();
        List<ValidationFinding> findings = new ArrayList<>();

        WorkloadInventory inventory = inventoryAdapter.listWorkloadResourceSpecs(scope);
        if (inventory.workloads().isEmpty() && !inventory.failures().isEmpty()) {
            throw new InventoryUnavailableException("No workload could be listed for " + scope.id()
                    + ": " + inventory.failures().get(0).reason());
        }
        recordInventoryFailures(inventory.failures(), findings, caveats);

        NormalizationResult normalized = normalizer.normalize(inventory.workloads(), scope, now, options);
        List<ResourceSnapshot> snapshots = normalized.snapshots();
        findings.addAll(normalized.findings());
        if (!normalized.excludedNamespaces().isEmpty()) {
            caveats.add("System namespaces excluded: " + String.join(", ", normalized.excludedNamespaces()));
        }
        if (snapshots.isEmpty()) {
            caveats.add("No container resource declarations found for " + scope.id());
        }

        findings.addAll(ruleEngine.validate(snapshots, options));

        OvercommitResult overcommit = overcommitAggregator.aggregate(
                scope.id(), fetchCapacity(scope, caveats), snapshots, options);
        if (!overcommit.capacityKnown()) {
            caveats.add("Cluster capacity unknown; overcommit ratios not computed");
        }

        Map<WorkloadTarget, List<ResourceSnapshot>> byTarget = groupByTarget(snapshots);
        Map<WorkloadTarget, WorkloadCategory> categories = workloadClassifier.classify(byTarget, findings, options);

        Map<WorkloadTarget, Map<ResourceKind, Recommendation>> recommendations =
                options.isIncludeRecommendations()
                        ? recommend(byTarget, timeRange, options, caveats)
                        : Map.of();
        recommendations.forEach((target, byKind) -> byKind.values().forEach(recommendation ->
                findings.addAll(usageComparison.compare(recommendation, byTarget.get(target), options))));

        List<WorkloadEntry> entries = new ArrayList<>();
        byTarget.forEach((target, targetSnapshots) -> entries.add(new WorkloadEntry(
                target,
                targetSnapshots.get(0).controllerKind(),
                (int) targetSnapshots.stream().map(ResourceSnapshot::podName).distinct().count(),
                WorkloadClassifier.workloadAge(targetSnapshots),
                categories.get(target),
                recommendations.getOrDefault(target, Map.of()))));

        GovernanceReport report =
                assembler.assemble(scope, timeRange, now, findings, entries, snapshots, overcommit, caveats);
        log.info("Report for {}: {} targets, {} findings ({} error, {} warning), {} caveats",
                scope.id(), entries.size(), report.summary().totalFindings(),
                report.summary().findings(Severity.ERROR), report.summary().findings(Severity.WARNING),
                caveats.size());
        return report;
    }

    private void recordInventoryFailures(List<InventoryFailure> failures, List<ValidationFinding> findings,
                                         List<String> caveats) {
        for (InventoryFailure failure : failures) {
            log.warn("Inventory incomplete for {}/{}: {}", failure.namespace(),
                    failure.workloadName() == null ? "*" : failure.workloadName(), failure.reason());
            findings.add(ValidationFinding.builder()
                    .namespace(failure.namespace())
                    .workloadName(failure.workloadName())
                    .ruleId(RuleId.INVENTORY_FAILURE)
                    .severity(Severity.INFO)
                    .message("Inventory could not be listed: " + failure.reason())
                    .detail(Map.of("reason", failure.reason()))
                    .remediation("Check API access to this namespace and rerun the report")
                    .build());
            caveats.add("Inventory incomplete for namespace " + failure.namespace()
                    + (failure.workloadName() == null ? "" : " workload " + failure.workloadName()));
        }
    }

    private Optional<ClusterCapacity> fetchCapacity(GovernanceScope scope, List<String> caveats) {
        try {
            return inventoryAdapter.getClusterCapacity(scope);
        } catch (RuntimeException e) {
            log.warn("Capacity lookup failed for {}: {}", scope.id(), e.getMessage());
            caveats.add("Capacity lookup failed: " + e.getMessage());
            return Optional.empty();
        }
    }

    private Map<WorkloadTarget, Map<ResourceKind, Recommendation>> recommend(
            Map<WorkloadTarget, List<ResourceSnapshot>> byTarget,
            TimeRange timeRange,
            GovernanceOptions options,
            List<String> caveats
    ) {
        Map<WorkloadTarget, Map<ResourceKind, Recommendation>> recommendations = new LinkedHashMap<>();
        Map<WorkloadTarget, String> established = new LinkedHashMap<>();

        byTarget.forEach((target, snapshots) -> {
            Duration age = WorkloadClassifier.workloadAge(snapshots);
            if (age.compareTo(options.getMinimumDataSpan()) < 0) {
                Map<ResourceKind, Recommendation> byKind = new EnumMap<>(ResourceKind.class);
                for (ResourceKind kind : KINDS) {
                    byKind.put(kind, reducer.notQueried(target, kind, timeRange,
                            "workload age " + age + " is below the minimum data span", options));
                }
                recommendations.put(target, byKind);
            } else {
                established.put(target, controllerKind(snapshots));
            }
        });

        if (!established.isEmpty()) {
            Map<WorkloadTarget, WorkloadMetricResult> results =
                    queryPlanner.execute(queryPlanner.plan(established, KINDS, timeRange, options), options);
            long unresolved = results.values().stream()
                    .flatMap(r -> r.outcomes().values().stream())
                    .filter(o -> o.status() == QueryStatus.FAILED || o.status() == QueryStatus.TIMED_OUT)
                    .count();
            if (unresolved > 0) {
                caveats.add(unresolved + " metric queries failed or timed out; affected recommendations are insufficient-data");
            }
            recommendations.putAll(reducer.reduceAll(results, options));
        }
        return recommendations;
    }

    // null when controllers of different kinds share the target
    private static String controllerKind(List<ResourceSnapshot> snapshots) {
        List<String> kinds = snapshots.stream().map(ResourceSnapshot::controllerKind).distinct().toList();
        return kinds.size() == 1 ? kinds.get(0) : null;
    }

    private static Map<WorkloadTarget, List<ResourceSnapshot>> groupByTarget(List<ResourceSnapshot> snapshots) {
        Map<WorkloadTarget, List<ResourceSnapshot>> byTarget = new LinkedHashMap<>();
        snapshots.forEach(s -> byTarget.computeIfAbsent(s.target(), t -> new ArrayList<>()).add(s));
        return byTarget;
    }
}
