package com.oru.governance.validation;

import com.oru.governance.domain.model.FindingCategory;
import com.oru.governance.domain.model.GovernanceOptions;
import com.oru.governance.domain.model.ResourceSnapshot;
import com.oru.governance.domain.model.Severity;
import com.oru.governance.domain.model.ValidationFinding;
import com.oru.governance.domain.model.WorkloadCategory;
import com.oru.governance.domain.model.WorkloadTarget;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Buckets workload targets into new, outlier and compliant.
 *
 * Age wins over findings: a young workload is NEW even when misconfigured,
 * since its history is not yet representative.
 */
@Component
public class WorkloadClassifier {

    public Map<WorkloadTarget, WorkloadCategory> classify(
            Map<WorkloadTarget, List<ResourceSnapshot>> snapshotsByTarget,
            List<ValidationFinding> findings,
            GovernanceOptions options
    ) {
        Map<WorkloadTarget, WorkloadCategory> categories = new LinkedHashMap<>();
        snapshotsByTarget.forEach((target, snapshots) ->
                categories.put(target, classify(target, snapshots, findings, options)));
        return categories;
    }

    WorkloadCategory classify(WorkloadTarget target, List<ResourceSnapshot> snapshots,
                              List<ValidationFinding> findings, GovernanceOptions options) {
        Duration age = workloadAge(snapshots);
        if (age.compareTo(options.getNewWorkloadAge()) < 0) {
            return WorkloadCategory.NEW;
        }
        boolean misconfigured = findings.stream()
                .filter(f -> f.category() == FindingCategory.CONFIGURATION)
                .filter(f -> f.severity().isAtLeast(Severity.WARNING))
                .anyMatch(f -> f.concerns(target));
        return misconfigured ? WorkloadCategory.OUTLIER : WorkloadCategory.COMPLIANT;
    }

    /** Age of a target is that of its oldest controller; zero when nothing is known. */
    public static Duration workloadAge(List<ResourceSnapshot> snapshots) {
        return snapshots.stream()
                .map(ResourceSnapshot::workloadAge)
                .max(Duration::compareTo)
                .orElse(Duration.ZERO);
    }
}
