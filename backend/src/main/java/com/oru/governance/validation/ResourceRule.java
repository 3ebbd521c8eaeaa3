package com.oru.governance.validation;

import com.oru.governance.domain.model.GovernanceOptions;
import com.oru.governance.domain.model.ResourceSnapshot;
import com.oru.governance.domain.model.RuleId;
import com.oru.governance.domain.model.ValidationFinding;

import java.util.List;

/**
 * One stateless configuration check applied to every container snapshot.
 *
 * Implementations evaluate resource kinds in declaration order (CPU, then
 * memory) and emit at most one finding per kind.
 */
public interface ResourceRule {

    RuleId getRuleId();

    List<ValidationFinding> evaluate(ResourceSnapshot snapshot, GovernanceOptions options);
}
