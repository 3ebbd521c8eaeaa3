package com.oru.governance.normalization;

import com.oru.governance.adapters.InventoryAdapter.RawContainerSpec;
import com.oru.governance.adapters.InventoryAdapter.RawPodSpec;
import com.oru.governance.adapters.InventoryAdapter.RawWorkloadSpec;
import com.oru.governance.domain.model.GovernanceOptions;
import com.oru.governance.domain.model.GovernanceScope;
import com.oru.governance.domain.model.QosClass;
import com.oru.governance.domain.model.ResourceKind;
import com.oru.governance.domain.model.ResourceSnapshot;
import com.oru.governance.domain.model.RuleId;
import com.oru.governance.domain.model.Severity;
import com.oru.governance.domain.model.ValidationFinding;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ResourceModelNormalizer.
 *
 * Test strategy:
 * 1. Quantities are converted and absence stays null
 * 2. Bad data is dropped at the smallest possible granularity with an INFO finding
 * 3. System namespaces are only filtered in cluster scope
 */
class ResourceModelNormalizerTest {

    private static final Instant NOW = Instant.parse("2024-01-10T12:00:00Z");

    private final ResourceModelNormalizer normalizer = new ResourceModelNormalizer(new ResourceQuantityParser());
    private final GovernanceOptions options = GovernanceOptions.defaults();

    @Nested
    @DisplayName("Snapshot construction")
    class SnapshotTests {

        @Test
        @DisplayName("Should produce one snapshot per container per pod with canonical units")
        void shouldProduceSnapshotPerContainer() {
            // Given
            RawWorkloadSpec workload = workload("payments", "api", NOW.minus(Duration.ofDays(3)),
                    pod("api-1", container("app", Map.of("cpu", "250m", "memory", "256Mi"),
                                    Map.of("cpu", "1", "memory", "512Mi")),
                            container("sidecar", Map.of("cpu", "10m"), Map.of())),
                    pod("api-2", container("app", Map.of("cpu", "250m", "memory", "256Mi"),
                            Map.of("cpu", "1", "memory", "512Mi"))));

            // When
            NormalizationResult result = normalizer.normalize(
                    List.of(workload), GovernanceScope.namespace("payments"), NOW, options);

            // Then
            assertThat(result.findings()).isEmpty();
            assertThat(result.snapshots()).hasSize(3);

            ResourceSnapshot app = result.snapshots().get(0);
            assertThat(app.podName()).isEqualTo("api-1");
            assertThat(app.cpuRequest()).isEqualTo(250L);
            assertThat(app.cpuLimit()).isEqualTo(1000L);
            assertThat(app.memoryRequest()).isEqualTo(256L << 20);
            assertThat(app.memoryLimit()).isEqualTo(512L << 20);
            assertThat(app.workloadAge()).isEqualTo(Duration.ofDays(3));
            assertThat(app.qosClass()).isEqualTo(QosClass.BURSTABLE);
        }

        @Test
        @DisplayName("Should keep undeclared quantities as null, not zero")
        void shouldKeepAbsenceAsNull() {
            // Given
            RawWorkloadSpec workload = workload("payments", "worker", NOW,
                    pod("worker-1", container("main", Map.of("memory", "64Mi"), Map.of())));

            // When
            ResourceSnapshot snapshot = normalizer.normalize(
                    List.of(workload), GovernanceScope.cluster(), NOW, options).snapshots().get(0);

            // Then
            assertThat(snapshot.request(ResourceKind.CPU)).isNull();
            assertThat(snapshot.limit(ResourceKind.CPU)).isNull();
            assertThat(snapshot.limit(ResourceKind.MEMORY)).isNull();
            assertThat(snapshot.request(ResourceKind.MEMORY)).isEqualTo(64L << 20);
        }

        @Test
        @DisplayName("Should treat explicit zero as a declared value")
        void shouldKeepZero() {
            RawWorkloadSpec workload = workload("payments", "zero", NOW,
                    pod("zero-1", container("main", Map.of("cpu", "0"), Map.of())));

            ResourceSnapshot snapshot = normalizer.normalize(
                    List.of(workload), GovernanceScope.cluster(), NOW, options).snapshots().get(0);

            assertThat(snapshot.cpuRequest()).isZero();
        }
    }

    @Nested
    @DisplayName("Data quality")
    class DataQualityTests {

        @Test
        @DisplayName("Should drop only the container with a malformed quantity")
        void shouldDropMalformedContainer() {
            // Given
            RawWorkloadSpec workload = workload("payments", "api", NOW,
                    pod("api-1",
                            container("good", Map.of("cpu", "100m"), Map.of()),
                            container("bad", Map.of("cpu", "100m", "memory", "12Q"), Map.of())));

            // When
            NormalizationResult result = normalizer.normalize(
                    List.of(workload), GovernanceScope.cluster(), NOW, options);

            // Then
            assertThat(result.snapshots()).extracting(ResourceSnapshot::containerName).containsExactly("good");
            assertThat(result.findings()).singleElement().satisfies(finding -> {
                assertThat(finding.ruleId()).isEqualTo(RuleId.MALFORMED_QUANTITY);
                assertThat(finding.severity()).isEqualTo(Severity.INFO);
                assertThat(finding.containerName()).isEqualTo("bad");
                assertThat(finding.resourceKind()).isEqualTo(ResourceKind.MEMORY);
                assertThat(finding.detail()).containsEntry("field", "memory request").containsEntry("value", "12Q");
            });
        }

        @Test
        @DisplayName("Should drop workloads missing metadata")
        void shouldDropWorkloadWithoutMetadata() {
            // Given
            RawWorkloadSpec noTimestamp = workload("payments", "orphan", null,
                    pod("orphan-1", container("main", Map.of("cpu", "100m"), Map.of())));
            RawWorkloadSpec noNamespace = workload(null, "lost", NOW,
                    pod("lost-1", container("main", Map.of("cpu", "100m"), Map.of())));

            // When
            NormalizationResult result = normalizer.normalize(
                    List.of(noTimestamp, noNamespace), GovernanceScope.cluster(), NOW, options);

            // Then
            assertThat(result.snapshots()).isEmpty();
            assertThat(result.findings())
                    .extracting(ValidationFinding::ruleId, ValidationFinding::severity)
                    .containsOnly(org.assertj.core.groups.Tuple.tuple(RuleId.MISSING_METADATA, Severity.INFO));
            assertThat(result.findings().get(0).detail()).containsEntry("missing", "creationTimestamp");
            assertThat(result.findings().get(1).detail()).containsEntry("missing", "namespace");
        }
    }

    @Nested
    @DisplayName("System namespaces")
    class SystemNamespaceTests {

        private final List<RawWorkloadSpec> workloads = List.of(
                workload("kube-system", "coredns", NOW, pod("coredns-1", container("coredns", Map.of("cpu", "100m"), Map.of()))),
                workload("openshift-monitoring", "prom", NOW, pod("prom-1", container("prom", Map.of("cpu", "100m"), Map.of()))),
                workload("default", "hello", NOW, pod("hello-1", container("hello", Map.of("cpu", "100m"), Map.of()))),
                workload("payments", "api", NOW, pod("api-1", container("app", Map.of("cpu", "100m"), Map.of())))
        );

        @Test
        @DisplayName("Should exclude system namespaces in cluster scope")
        void shouldExcludeInClusterScope() {
            NormalizationResult result = normalizer.normalize(workloads, GovernanceScope.cluster(), NOW, options);

            assertThat(result.snapshots()).extracting(ResourceSnapshot::namespace).containsExactly("payments");
            assertThat(result.excludedNamespaces())
                    .containsExactlyInAnyOrder("kube-system", "openshift-monitoring", "default");
        }

        @Test
        @DisplayName("Should keep system namespaces when explicitly included")
        void shouldIncludeWhenConfigured() {
            GovernanceOptions including = options.toBuilder().includeSystemNamespaces(true).build();

            NormalizationResult result = normalizer.normalize(workloads, GovernanceScope.cluster(), NOW, including);

            assertThat(result.snapshots()).hasSize(4);
            assertThat(result.excludedNamespaces()).isEmpty();
        }

        @Test
        @DisplayName("Should never filter an explicitly requested namespace")
        void shouldNotFilterNamespaceScope() {
            NormalizationResult result = normalizer.normalize(
                    workloads.subList(0, 1), GovernanceScope.namespace("kube-system"), NOW, options);

            assertThat(result.snapshots()).hasSize(1);
        }
    }

    // Helper methods

    private static RawWorkloadSpec workload(String namespace, String name, Instant created, RawPodSpec... pods) {
        return new RawWorkloadSpec(namespace, name, "Deployment", created, List.of(pods));
    }

    private static RawPodSpec pod(String name, RawContainerSpec... containers) {
        return new RawPodSpec(name, List.of(containers));
    }

    private static RawContainerSpec container(String name, Map<String, String> requests, Map<String, String> limits) {
        return new RawContainerSpec(name, requests, limits);
    }
}
