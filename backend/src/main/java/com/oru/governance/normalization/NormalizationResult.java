package com.oru.governance.normalization;

import com.oru.governance.domain.model.ResourceSnapshot;
import com.oru.governance.domain.model.ValidationFinding;

import java.util.List;
import java.util.Set;

/**
 * Output of the normalizer: one snapshot per interpretable container plus
 * data-quality findings for everything that had to be dropped.
 */
public record NormalizationResult(
        List<ResourceSnapshot> snapshots,
        List<ValidationFinding> findings,
        Set<String> excludedNamespaces
) {

    public NormalizationResult {
        snapshots = List.copyOf(snapshots);
        findings = List.copyOf(findings);
        excludedNamespaces = Set.copyOf(excludedNamespaces);
    }
}
