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
import java.util.Locale;
import java.util.Map;

/**
 * A request without a limit lets the container burst unbounded.
 * Only fires when the request is present; a missing request is reported by
 * {@link MissingRequestRule} alone.
 */
@Component
public class MissingLimitRule implements ResourceRule {

    @Override
    public RuleId getRuleId() {
        return RuleId.MISSING_LIMIT;
    }

    @Override
    public List<ValidationFinding> evaluate(ResourceSnapshot snapshot, GovernanceOptions options) {
        List<ValidationFinding> findings = new ArrayList<>();
        for (ResourceKind kind : ResourceKind.values()) {
            Long request = snapshot.request(kind);
            if (request == null || snapshot.limit(kind) != null) {
                continue;
            }
            double ratio = options.limitRatio(kind);
            long suggestedLimit = (long) Math.ceil(request * ratio);

            Map<String, String> detail = new LinkedHashMap<>();
            detail.put("request", kind.format(request));
            detail.put("limit", "none");
            findings.add(ValidationFinding.about(snapshot)
                    .ruleId(getRuleId())
                    .severity(Severity.WARNING)
                    .resourceKind(kind)
                    .message(String.format("%s request %s has no limit",
                            capitalize(kind.displayName()), kind.format(request)))
                    .detail(detail)
                    .remediation(String.format(Locale.ROOT, "Set a %s limit around %s (%.1fx the request)",
                            kind.displayName(), kind.format(suggestedLimit), ratio))
                    .build());
        }
        return findings;
    }

    static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
