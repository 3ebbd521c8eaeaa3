package com.oru.governance.validation.rules;

import com.oru.governance.domain.model.GovernanceOptions;
import com.oru.governance.domain.model.ResourceKind;
import com.oru.governance.domain.model.ResourceSnapshot;
import com.oru.governance.domain.model.RuleId;
import com.oru.governance.domain.model.Severity;
import com.oru.governance.domain.model.ValidationFinding;
import com.oru.governance.validation.ResourceRule;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class MinimumRequestRule implements ResourceRule {

    @Override
    public RuleId getRuleId() {
        return RuleId.BELOW_MINIMUM_REQUEST;
    }

    @Override
    public List<ValidationFinding> evaluate(ResourceSnapshot snapshot, GovernanceOptions options) {
        List<ValidationFinding> findings = new ArrayList<>();
        for (ResourceKind kind : ResourceKind.values()) {
            Long request = snapshot.request(kind);
            long minimum = options.minimumRequest(kind);
            if (request == null || request >= minimum) {
                continue;
            }
            Map<String, String> detail = new LinkedHashMap<>();
            detail.put("request", kind.format(request));
            detail.put("minimum", kind.format(minimum));
            findings.add(ValidationFinding.about(snapshot)
                    .ruleId(getRuleId())
                    .severity(Severity.WARNING)
                    .resourceKind(kind)
                    .message(String.format("%s request %s is below the minimum of %s",
                            MissingLimitRule.capitalize(kind.displayName()), kind.format(request), kind.format(minimum)))
                    .detail(detail)
                    .remediation(String.format("Raise the %s request to at least %s",
                            kind.displayName(), kind.format(minimum)))
                    .build());
        }
        return findings;
    }
}
