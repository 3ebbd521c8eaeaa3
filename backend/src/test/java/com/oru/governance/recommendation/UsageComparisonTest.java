package com.oru.governance.recommendation;

import com.oru.governance.domain.model.Confidence;
import com.oru.governance.domain.model.GovernanceOptions;
import com.oru.governance.domain.model.Recommendation;
import com.oru.governance.domain.model.ResourceKind;
import com.oru.governance.domain.model.ResourceSnapshot;
import com.oru.governance.domain.model.RuleId;
import com.oru.governance.domain.model.Severity;
import com.oru.governance.domain.model.ValidationFinding;
import com.oru.governance.domain.model.WorkloadTarget;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class UsageComparisonTest {

    private static final WorkloadTarget TARGET = new WorkloadTarget("payments", "api", "app");

    private final UsageComparison comparison = new UsageComparison();
    private final GovernanceOptions options = GovernanceOptions.defaults();

    @Test
    @DisplayName("Should report an over-provisioned request as INFO with observed values")
    void shouldReportOverProvisioned() {
        // Given p95 of 40m against a 500m request
        Recommendation recommendation = recommendation(40.0, 40L);

        // When
        List<ValidationFinding> findings = comparison.compare(recommendation, List.of(snapshot(500L)), options);

        // Then
        assertThat(findings).singleElement().satisfies(finding -> {
            assertThat(finding.ruleId()).isEqualTo(RuleId.REQUEST_OVER_PROVISIONED);
            assertThat(finding.severity()).isEqualTo(Severity.INFO);
            assertThat(finding.containerName()).isEqualTo("app");
            assertThat(finding.podName()).isNull();
            assertThat(finding.detail()).containsEntry("request", "500m").containsEntry("p95", "40m");
            assertThat(finding.remediation()).contains("40m").contains("120m");
        });
    }

    @Test
    @DisplayName("Should report an under-provisioned request as WARNING")
    void shouldReportUnderProvisioned() {
        Recommendation recommendation = recommendation(190.0, 190L);

        List<ValidationFinding> findings = comparison.compare(recommendation, List.of(snapshot(200L)), options);

        assertThat(findings).extracting(ValidationFinding::ruleId, ValidationFinding::severity)
                .containsExactly(org.assertj.core.groups.Tuple.tuple(RuleId.REQUEST_UNDER_PROVISIONED, Severity.WARNING));
    }

    @Test
    @DisplayName("Should stay silent inside the healthy band")
    void shouldAcceptHealthyUsage() {
        Recommendation recommendation = recommendation(130.0, 130L);

        assertThat(comparison.compare(recommendation, List.of(snapshot(200L)), options)).isEmpty();
    }

    @Test
    @DisplayName("Should compare against the largest declared request across pods")
    void shouldUseLargestRequest() {
        Recommendation recommendation = recommendation(190.0, 190L);

        List<ValidationFinding> findings = comparison.compare(recommendation,
                List.of(snapshot(200L), snapshot(1000L), snapshot(null)), options);

        assertThat(findings).extracting(ValidationFinding::ruleId).containsExactly(RuleId.REQUEST_OVER_PROVISIONED);
    }

    @Test
    @DisplayName("Should skip insufficient-data recommendations and undeclared requests")
    void shouldSkipWithoutData() {
        Recommendation insufficient = Recommendation.insufficient(TARGET, ResourceKind.CPU, 95, null, 3, "too few");

        assertThat(comparison.compare(insufficient, List.of(snapshot(500L)), options)).isEmpty();
        assertThat(comparison.compare(recommendation(40.0, 40L), List.of(snapshot(null)), options)).isEmpty();
    }

    // Helper methods

    private static Recommendation recommendation(double observed, long request) {
        return Recommendation.builder()
                .target(TARGET)
                .resourceKind(ResourceKind.CPU)
                .confidence(Confidence.SUFFICIENT_DATA)
                .suggestedRequest(request)
                .suggestedLimit(request * 3)
                .percentile(95)
                .sampleCount(72)
                .observedPercentile(observed)
                .observedPeak(observed * 1.2)
                .build();
    }

    private static ResourceSnapshot snapshot(Long cpuRequest) {
        return new ResourceSnapshot("payments", "api", "Deployment", "api-1", "app",
                cpuRequest, null, 64L << 20, null, Duration.ofDays(30));
    }
}
