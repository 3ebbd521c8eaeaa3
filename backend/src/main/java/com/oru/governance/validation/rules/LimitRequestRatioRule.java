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
 * Checks the limit:request ratio against the target band.
 *
 * SEVERITY:
 * - limit below request: ERROR
 * - |ratio - target| above tolerance: WARNING
 * - |ratio - target| above twice the tolerance: ERROR
 *
 * Skipped when either side is undeclared or the request is zero.
 */
@Component
public class LimitRequestRatioRule implements ResourceRule {

    @Override
    public RuleId getRuleId() {
        return RuleId.RATIO_OUT_OF_BOUNDS;
    }

    @Override
    public List<ValidationFinding> evaluate(ResourceSnapshot snapshot, GovernanceOptions options) {
        List<ValidationFinding> findings = new ArrayList<>();
        for (ResourceKind kind : ResourceKind.values()) {
            Long request = snapshot.request(kind);
            Long limit = snapshot.limit(kind);
            if (request == null || limit == null || request == 0) {
                continue;
            }

            double target = options.limitRatio(kind);
            double tolerance = options.getRatioTolerance();
            double ratio = (double) limit / request;
            double deviation = Math.abs(ratio - target);

            Severity severity;
            String problem;
            if (limit < request) {
                severity = Severity.ERROR;
                problem = "limit is below the request";
            } else if (deviation > 2 * tolerance) {
                severity = Severity.ERROR;
                problem = "ratio is far outside the allowed band";
            } else if (deviation > tolerance) {
                severity = Severity.WARNING;
                problem = "ratio is outside the allowed band";
            } else {
                continue;
            }

            findings.add(buildFinding(snapshot, kind, request, limit, ratio, target, tolerance, severity, problem));
        }
        return findings;
    }

    private ValidationFinding buildFinding(ResourceSnapshot snapshot, ResourceKind kind, long request, long limit,
                                           double ratio, double target, double tolerance,
                                           Severity severity, String problem) {
        String requestText = kind.format(request);
        String limitText = kind.format(limit);
        String ratioText = String.format(Locale.ROOT, "%.1f", ratio);

        Map<String, String> detail = new LinkedHashMap<>();
        detail.put("request", requestText);
        detail.put("limit", limitText);
        detail.put("ratio", ratioText);
        detail.put("target", String.format(Locale.ROOT, "%.1f", target));
        detail.put("band", String.format(Locale.ROOT, "%.1f-%.1f", Math.max(0, target - tolerance), target + tolerance));

        long suggestedLimit = (long) Math.ceil(request * target);
        return ValidationFinding.about(snapshot)
                .ruleId(getRuleId())
                .severity(severity)
                .resourceKind(kind)
                .message(String.format("%s limit:request %s (request=%s, limit=%s, ratio=%s)",
                        MissingLimitRule.capitalize(kind.displayName()), problem, requestText, limitText, ratioText))
                .detail(detail)
                .remediation(String.format(Locale.ROOT, "Set the %s limit to about %s (%.1fx the %s request) or resize the request",
                        kind.displayName(), kind.format(suggestedLimit), target, requestText))
                .build();
    }
}
