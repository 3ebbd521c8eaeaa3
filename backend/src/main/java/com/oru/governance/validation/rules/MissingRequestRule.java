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

/**
 * Without a request the scheduler reserves nothing for the container.
 */
@Component
public class MissingRequestRule implements ResourceRule {

    @Override
    public RuleId getRuleId() {
        return RuleId.MISSING_REQUEST;
    }

    @Override
    public List<ValidationFinding> evaluate(ResourceSnapshot snapshot, GovernanceOptions options) {
        List<ValidationFinding> findings = new ArrayList<>();
        for (ResourceKind kind : ResourceKind.values()) {
            if (snapshot.request(kind) != null) {
                continue;
            }
            Map<String, String> detail = new LinkedHashMap<>();
            detail.put("request", "none");
            detail.put("limit", kind.formatNullable(snapshot.limit(kind)));
            findings.add(ValidationFinding.about(snapshot)
                    .ruleId(getRuleId())
                    .severity(Severity.ERROR)
                    .resourceKind(kind)
                    .message(String.format("No %s request declared (limit=%s)",
                            kind.displayName(), kind.formatNullable(snapshot.limit(kind))))
                    .detail(detail)
                    .remediation(String.format("Declare a %s request of at least %s so the scheduler reserves capacity",
                            kind.displayName(), kind.format(options.minimumRequest(kind))))
                    .build());
        }
        return findings;
    }
}
