package com.oru.governance.validation;

import com.oru.governance.domain.model.GovernanceOptions;
import com.oru.governance.domain.model.ResourceSnapshot;
import com.oru.governance.domain.model.ValidationFinding;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs every {@link ResourceRule} over a list of snapshots.
 *
 * Rules are ordered by {@link com.oru.governance.domain.model.RuleId}, so for
 * one container findings come out in rule order, then kind order. Running it
 * twice on the same input yields the same list.
 */
@Slf4j
@Service
public class ValidationRuleEngine {

    private final List<ResourceRule> rules;

    public ValidationRuleEngine(List<ResourceRule> rules) {
        List<ResourceRule> ordered = new ArrayList<>(rules);
        ordered.sort(Comparator.comparing(ResourceRule::getRuleId));
        this.rules = List.copyOf(ordered);
        log.debug("Validation rules in order: {}", this.rules.stream().map(ResourceRule::getRuleId).toList());
    }

    public List<ValidationFinding> validate(List<ResourceSnapshot> snapshots, GovernanceOptions options) {
        List<ValidationFinding> findings = new ArrayList<>();
        for (ResourceSnapshot snapshot : snapshots) {
            for (ResourceRule rule : rules) {
                findings.addAll(rule.evaluate(snapshot, options));
            }
        }
        log.debug("Validated {} container snapshots: {} findings", snapshots.size(), findings.size());
        return findings;
    }

    public List<ResourceRule> getRules() {
        return rules;
    }
}
