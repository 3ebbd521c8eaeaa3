package com.oru.governance.recommendation;

import com.oru.governance.domain.model.GovernanceOptions;
import com.oru.governance.domain.model.Recommendation;
import com.oru.governance.domain.model.ResourceKind;
import com.oru.governance.domain.model.ResourceSnapshot;
import com.oru.governance.domain.model.RuleId;
import com.oru.governance.domain.model.Severity;
import com.oru.governance.domain.model.ValidationFinding;
import com.oru.governance.domain.model.WorkloadTarget;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Compares observed usage with what a target declares.
 *
 * THRESHOLDS (fractions of the largest declared request):
 * - observed percentile below {@code overProvisionedRatio}: INFO, request can shrink
 * - observed percentile above {@code underProvisionedRatio}: WARNING, risk of throttling or eviction
 */
@Component
public class UsageComparison {

    public List<ValidationFinding> compare(Recommendation recommendation, List<ResourceSnapshot> snapshots,
                                           GovernanceOptions options) {
        if (!recommendation.hasSuggestion() || recommendation.observedPercentile() == null) {
            return List.of();
        }
        ResourceKind kind = recommendation.resourceKind();
        Optional<Long> declared = snapshots.stream()
                .map(s -> s.request(kind))
                .filter(Objects::nonNull)
                .max(Long::compare);
        if (declared.isEmpty() || declared.get() == 0) {
            return List.of();
        }

        long request = declared.get();
        double observed = recommendation.observedPercentile();
        double utilization = observed / request;

        if (utilization < options.getOverProvisionedRatio()) {
            return List.of(finding(recommendation, RuleId.REQUEST_OVER_PROVISIONED, Severity.INFO, request,
                    String.format(Locale.ROOT, "%s request %s is well above observed p%.0f usage of %s",
                            capitalized(kind), kind.format(request), recommendation.percentile(), format(kind, observed))));
        }
        if (utilization > options.getUnderProvisionedRatio()) {
            return List.of(finding(recommendation, RuleId.REQUEST_UNDER_PROVISIONED, Severity.WARNING, request,
                    String.format(Locale.ROOT, "Observed p%.0f %s usage of %s is close to or above the request of %s",
                            recommendation.percentile(), kind.displayName(), format(kind, observed), kind.format(request))));
        }
        return List.of();
    }

    private ValidationFinding finding(Recommendation recommendation, RuleId ruleId, Severity severity,
                                      long request, String message) {
        WorkloadTarget target = recommendation.target();
        ResourceKind kind = recommendation.resourceKind();

        Map<String, String> detail = new LinkedHashMap<>();
        detail.put("request", kind.format(request));
        detail.put(String.format(Locale.ROOT, "p%.0f", recommendation.percentile()),
                format(kind, recommendation.observedPercentile()));
        detail.put("peak", format(kind, recommendation.observedPeak()));
        detail.put("suggestedRequest", kind.format(recommendation.suggestedRequest()));
        detail.put("samples", Integer.toString(recommendation.sampleCount()));

        return ValidationFinding.builder()
                .namespace(target.namespace())
                .workloadName(target.workloadName())
                .containerName(target.containerName())
                .ruleId(ruleId)
                .severity(severity)
                .resourceKind(kind)
                .message(message)
                .detail(detail)
                .remediation(String.format("Set the %s request to %s and the limit to %s",
                        kind.displayName(), kind.format(recommendation.suggestedRequest()),
                        kind.format(recommendation.suggestedLimit())))
                .build();
    }

    private static String format(ResourceKind kind, Double value) {
        return value == null ? "none" : kind.format((long) Math.ceil(value));
    }

    private static String capitalized(ResourceKind kind) {
        String name = kind.displayName();
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
}
