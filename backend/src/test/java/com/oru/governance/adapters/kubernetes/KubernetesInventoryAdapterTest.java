package com.oru.governance.adapters.kubernetes;

import com.oru.governance.adapters.InventoryAdapter.ClusterCapacity;
import com.oru.governance.adapters.InventoryAdapter.RawWorkloadSpec;
import com.oru.governance.adapters.InventoryAdapter.WorkloadInventory;
import com.oru.governance.adapters.kubernetes.KubernetesObjects.Metadata;
import com.oru.governance.adapters.kubernetes.KubernetesObjects.OwnerReference;
import com.oru.governance.adapters.kubernetes.KubernetesObjects.Pod;
import com.oru.governance.domain.exception.InventoryUnavailableException;
import com.oru.governance.domain.model.GovernanceScope;
import com.oru.governance.domain.model.ResourceKind;
import com.oru.governance.normalization.ResourceQuantityParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class KubernetesInventoryAdapterTest {

    private static final String API = "http://k8s.test";

    private MockRestServiceServer server;
    private KubernetesInventoryAdapter adapter;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).ignoreExpectOrder(true).build();
        adapter = new KubernetesInventoryAdapter(restTemplate, new ResourceQuantityParser());
        ReflectionTestUtils.setField(adapter, "apiUrl", API);
        ReflectionTestUtils.setField(adapter, "token", "sa-token");
        ReflectionTestUtils.setField(adapter, "tokenFile", "/nonexistent");
    }

    @Nested
    @DisplayName("Owner resolution")
    class OwnerTests {

        @Test
        @DisplayName("Should map a ReplicaSet owner back to its Deployment using the pod template hash")
        void shouldStripReplicaSetHash() {
            Pod pod = pod("checkout-api-7d9f8c6b5-x2kqz", Map.of("pod-template-hash", "7d9f8c6b5"),
                    new OwnerReference("ReplicaSet", "checkout-api-7d9f8c6b5", true));

            assertThat(KubernetesInventoryAdapter.resolveOwner(pod)).containsExactly("Deployment", "checkout-api");
        }

        @Test
        @DisplayName("Should keep a standalone ReplicaSet whose name merely looks hashed")
        void shouldKeepStandaloneReplicaSet() {
            // Given
            Pod pod = pod("cache-primary-x2kqz", Map.of("app", "cache"),
                    new OwnerReference("ReplicaSet", "cache-primary", true));

            // When
            String[] owner = KubernetesInventoryAdapter.resolveOwner(pod);

            // Then
            assertThat(owner).containsExactly("ReplicaSet", "cache-primary");
        }

        @Test
        @DisplayName("Should keep a ReplicaSet whose name does not end with the template hash")
        void shouldKeepReplicaSetWithForeignHash() {
            Pod pod = pod("cache-primary-x2kqz", Map.of("pod-template-hash", "7d9f8c6b5"),
                    new OwnerReference("ReplicaSet", "cache-primary", true));

            assertThat(KubernetesInventoryAdapter.resolveOwner(pod)).containsExactly("ReplicaSet", "cache-primary");
        }

        @Test
        @DisplayName("Should keep StatefulSet owners as they are")
        void shouldKeepStatefulSet() {
            Pod pod = pod("ledger-0", new OwnerReference("StatefulSet", "ledger", true));

            assertThat(KubernetesInventoryAdapter.resolveOwner(pod)).containsExactly("StatefulSet", "ledger");
        }

        @Test
        @DisplayName("Should treat an unowned pod as its own workload")
        void shouldHandleBarePod() {
            Pod pod = new Pod(new Metadata("debug-shell", "payments", null, null, null), null, null);

            assertThat(KubernetesInventoryAdapter.resolveOwner(pod)).containsExactly("Pod", "debug-shell");
        }
    }

    @Nested
    @DisplayName("Namespace listing")
    class NamespaceListingTests {

        @Test
        @DisplayName("Should group pods by workload and date it by the oldest pod")
        void shouldGroupPods() {
            // Given
            server.expect(requestTo(startsWith(API + "/api/v1/namespaces/payments/pods")))
                    .andExpect(header("Authorization", "Bearer sa-token"))
                    .andRespond(withSuccess(PAYMENTS_PODS, MediaType.APPLICATION_JSON));

            // When
            WorkloadInventory inventory = adapter.listWorkloadResourceSpecs(GovernanceScope.namespace("payments"));

            // Then
            server.verify();
            assertThat(inventory.failures()).isEmpty();
            assertThat(inventory.workloads()).extracting(RawWorkloadSpec::name)
                    .containsExactly("checkout-api", "ledger");

            RawWorkloadSpec checkout = inventory.workloads().get(0);
            assertThat(checkout.controllerKind()).isEqualTo("Deployment");
            assertThat(checkout.pods()).hasSize(2);
            assertThat(checkout.creationTimestamp()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
            assertThat(checkout.pods().get(0).containers().get(0).request(ResourceKind.CPU)).isEqualTo("250m");
            assertThat(checkout.pods().get(0).containers().get(0).limit(ResourceKind.MEMORY)).isEqualTo("512Mi");

            RawWorkloadSpec ledger = inventory.workloads().get(1);
            assertThat(ledger.pods().get(0).containers().get(0).request(ResourceKind.CPU)).isNull();
        }

        @Test
        @DisplayName("Should keep only the requested workload")
        void shouldFilterWorkload() {
            server.expect(requestTo(startsWith(API + "/api/v1/namespaces/payments/pods")))
                    .andRespond(withSuccess(PAYMENTS_PODS, MediaType.APPLICATION_JSON));

            WorkloadInventory inventory = adapter.listWorkloadResourceSpecs(GovernanceScope.workload("payments", "ledger"));

            assertThat(inventory.workloads()).singleElement()
                    .satisfies(w -> assertThat(w.controllerKind()).isEqualTo("StatefulSet"));
        }
    }

    @Nested
    @DisplayName("Cluster listing")
    class ClusterListingTests {

        @Test
        @DisplayName("Should report a forbidden namespace as a failure and keep the rest")
        void shouldRecordNamespaceFailure() {
            // Given
            server.expect(requestTo(API + "/api/v1/namespaces?limit=1000"))
                    .andRespond(withSuccess("""
                            {"items":[{"metadata":{"name":"payments"}},{"metadata":{"name":"restricted"}}]}
                            """, MediaType.APPLICATION_JSON));
            server.expect(requestTo(startsWith(API + "/api/v1/namespaces/payments/pods")))
                    .andRespond(withSuccess(PAYMENTS_PODS, MediaType.APPLICATION_JSON));
            server.expect(requestTo(startsWith(API + "/api/v1/namespaces/restricted/pods")))
                    .andRespond(withStatus(HttpStatus.FORBIDDEN));

            // When
            WorkloadInventory inventory = adapter.listWorkloadResourceSpecs(GovernanceScope.cluster());

            // Then
            assertThat(inventory.workloads()).hasSize(2);
            assertThat(inventory.failures()).singleElement()
                    .satisfies(f -> assertThat(f.namespace()).isEqualTo("restricted"));
        }

        @Test
        @DisplayName("Should fail when namespaces cannot be listed")
        void shouldFailWithoutNamespaces() {
            server.expect(requestTo(API + "/api/v1/namespaces?limit=1000"))
                    .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

            assertThatThrownBy(() -> adapter.listWorkloadResourceSpecs(GovernanceScope.cluster()))
                    .isInstanceOf(InventoryUnavailableException.class);
        }
    }

    @Test
    @DisplayName("Should sum node allocatable capacity")
    void shouldSumNodeCapacity() {
        server.expect(requestTo(API + "/api/v1/nodes"))
                .andRespond(withSuccess("""
                        {"items":[
                          {"metadata":{"name":"node-a"},"status":{"allocatable":{"cpu":"3920m","memory":"16Gi"}}},
                          {"metadata":{"name":"node-b"},"status":{"allocatable":{"cpu":"4","memory":"16Gi"}}}
                        ]}
                        """, MediaType.APPLICATION_JSON));

        Optional<ClusterCapacity> capacity = adapter.getClusterCapacity(GovernanceScope.cluster());

        assertThat(capacity).hasValueSatisfying(c -> {
            assertThat(c.cpuMillicores()).isEqualTo(7920L);
            assertThat(c.memoryBytes()).isEqualTo(32L << 30);
            assertThat(c.nodeCount()).isEqualTo(2);
        });
    }

    private static Pod pod(String name, OwnerReference owner) {
        return pod(name, null, owner);
    }

    private static Pod pod(String name, Map<String, String> labels, OwnerReference owner) {
        return new Pod(new Metadata(name, "payments", "2024-01-01T00:00:00Z", labels, List.of(owner)), null, null);
    }

    private static final String PAYMENTS_PODS = """
            {"items":[
              {"metadata":{"name":"checkout-api-7d9f8c6b5-x2kq","namespace":"payments",
                           "creationTimestamp":"2024-01-03T00:00:00Z",
                           "labels":{"pod-template-hash":"7d9f8c6b5"},
                           "ownerReferences":[{"kind":"ReplicaSet","name":"checkout-api-7d9f8c6b5","controller":true}]},
               "spec":{"containers":[{"name":"app","resources":{
                   "requests":{"cpu":"250m","memory":"256Mi"},"limits":{"cpu":"500m","memory":"512Mi"}}}]}},
              {"metadata":{"name":"checkout-api-7d9f8c6b5-p8wz","namespace":"payments",
                           "creationTimestamp":"2024-01-01T00:00:00Z",
                           "labels":{"pod-template-hash":"7d9f8c6b5"},
                           "ownerReferences":[{"kind":"ReplicaSet","name":"checkout-api-7d9f8c6b5","controller":true}]},
               "spec":{"containers":[{"name":"app","resources":{
                   "requests":{"cpu":"250m","memory":"256Mi"},"limits":{"cpu":"500m","memory":"512Mi"}}}]}},
              {"metadata":{"name":"ledger-0","namespace":"payments",
                           "creationTimestamp":"2024-01-05T00:00:00Z",
                           "ownerReferences":[{"kind":"StatefulSet","name":"ledger","controller":true}]},
               "spec":{"containers":[{"name":"ledger","resources":{}}]}}
            ]}
            """;
}
