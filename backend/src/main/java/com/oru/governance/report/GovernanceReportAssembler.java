package com.oru.governance.report;

import com.oru.governance.domain.model.Confidence;
import com.oru.governance.domain.model.GovernanceReport;
import com.oru.governance.domain.model.GovernanceScope;
import com.oru.governance.domain.model.OvercommitResult;
import com.oru.governance.domain.model.QosClass;
import com.oru.governance.domain.model.Recommendation;
import com.oru.governance.domain.model.ReportSummary;
import com.oru.governance.domain.model.ResourceSnapshot;
import com.oru.governance.domain.model.Severity;
import com.oru.governance.domain.model.TimeRange;
import com.oru.governance.domain.model.ValidationFinding;
import com.oru.governance.domain.model.WorkloadEntry;
import com.oru.governance.domain.model.WorkloadTarget;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges the outputs of one run into a {@link GovernanceReport}.
 *
 * Nothing is dropped or recomputed: findings are only reordered (subject,
 * then rule, then resource kind) and workloads sorted by target. The
 * summary also counts pods per QoS class from the normalized snapshots.
 */
@Component
public class GovernanceReportAssembler {

    static final Comparator<ValidationFinding> FINDING_ORDER = Comparator
            .comparing(ValidationFinding::namespace, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(ValidationFinding::workloadName, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(ValidationFinding::podName, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(ValidationFinding::containerName, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(ValidationFinding::ruleId)
            .thenComparing(ValidationFinding::resourceKind, Comparator.nullsFirst(Comparator.naturalOrder()));

    public GovernanceReport assemble(
            GovernanceScope scope,
            TimeRange timeRange,
            Instant generatedAt,
            List<ValidationFinding> findings,
            List<WorkloadEntry> workloads,
            List<ResourceSnapshot> snapshots,
            OvercommitResult overcommit,
            List<String> caveats
    ) {
        List<ValidationFinding> orderedFindings = new ArrayList<>(findings);
        orderedFindings.sort(FINDING_ORDER);

        List<WorkloadEntry> orderedWorkloads = new ArrayList<>(workloads);
        orderedWorkloads.sort(Comparator.comparing(WorkloadEntry::target, WorkloadTarget.ORDER));

        return new GovernanceReport(
                scope,
                generatedAt,
                timeRange,
                orderedFindings,
                orderedWorkloads,
                overcommit,
                summarize(orderedFindings, orderedWorkloads, snapshots),
                caveats);
    }

    private ReportSummary summarize(List<ValidationFinding> findings, List<WorkloadEntry> workloads,
                                    List<ResourceSnapshot> snapshots) {
        Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity, 0L);
        }
        findings.forEach(f -> bySeverity.merge(f.severity(), 1L, Long::sum));

        Map<Confidence, Long> byConfidence = new EnumMap<>(Confidence.class);
        for (Confidence confidence : Confidence.values()) {
            byConfidence.put(confidence, 0L);
        }
        workloads.stream()
                .flatMap(w -> w.recommendations().values().stream())
                .map(Recommendation::confidence)
                .forEach(c -> byConfidence.merge(c, 1L, Long::sum));

        long workloadCount = workloads.stream()
                .map(w -> w.target().namespace() + "/" + w.target().workloadName())
                .distinct()
                .count();

        Map<String, List<ResourceSnapshot>> byPod = new LinkedHashMap<>();
        snapshots.forEach(s -> byPod.computeIfAbsent(s.namespace() + "/" + s.podName(), p -> new ArrayList<>()).add(s));
        Map<QosClass, Long> byQos = new EnumMap<>(QosClass.class);
        for (QosClass qosClass : QosClass.values()) {
            byQos.put(qosClass, 0L);
        }
        byPod.values().forEach(containers -> byQos.merge(QosClass.ofPod(containers), 1L, Long::sum));

        return new ReportSummary(bySeverity, byConfidence, findings.size(), (int) workloadCount, workloads.size(),
                byQos);
    }
}
