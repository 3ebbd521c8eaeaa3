package com.oru.governance.adapters.kubernetes;

import com.oru.governance.adapters.InventoryAdapter;
import com.oru.governance.adapters.kubernetes.KubernetesObjects.Container;
import com.oru.governance.adapters.kubernetes.KubernetesObjects.Namespace;
import com.oru.governance.adapters.kubernetes.KubernetesObjects.NamespaceList;
import com.oru.governance.adapters.kubernetes.KubernetesObjects.Node;
import com.oru.governance.adapters.kubernetes.KubernetesObjects.NodeList;
import com.oru.governance.adapters.kubernetes.KubernetesObjects.OwnerReference;
import com.oru.governance.adapters.kubernetes.KubernetesObjects.Pod;
import com.oru.governance.adapters.kubernetes.KubernetesObjects.PodList;
import com.oru.governance.domain.exception.InventoryUnavailableException;
import com.oru.governance.domain.exception.MalformedQuantityException;
import com.oru.governance.domain.model.GovernanceScope;
import com.oru.governance.normalization.ResourceQuantityParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Kubernetes API inventory adapter.
 *
 * API ENDPOINTS USED:
 * - GET /api/v1/namespaces (cluster scope)
 * - GET /api/v1/namespaces/{ns}/pods?fieldSelector=status.phase=Running
 * - GET /api/v1/nodes (allocatable capacity)
 *
 * WORKLOAD RESOLUTION:
 * Pods are grouped by their controlling owner. ReplicaSet owners are mapped
 * back to their Deployment by stripping the pod-template hash; pods without
 * an owner form a workload of their own. The oldest pod dates the workload.
 *
 * AUTHENTICATION:
 * Bearer token read from {@code kubernetes.token-file} (the in-cluster
 * service account path by default) or {@code kubernetes.token}.
 */
@Component
@ConditionalOnProperty(name = "app.env", havingValue = "cluster")
@Slf4j
public class KubernetesInventoryAdapter implements InventoryAdapter {

    private static final String POD_TEMPLATE_HASH = "pod-template-hash";

    private final RestTemplate restTemplate;
    private final ResourceQuantityParser quantityParser;

    @Value("${kubernetes.api-url:https://kubernetes.default.svc}")
    private String apiUrl;

    @Value("${kubernetes.token:}")
    private String token;

    @Value("${kubernetes.token-file:/var/run/secrets/kubernetes.io/serviceaccount/token}")
    private String tokenFile;

    public KubernetesInventoryAdapter(
            @Qualifier("kubernetesRestTemplate") RestTemplate restTemplate,
            ResourceQuantityParser quantityParser
    ) {
        this.restTemplate = restTemplate;
        this.quantityParser = quantityParser;
    }

    @Override
    public WorkloadInventory listWorkloadResourceSpecs(GovernanceScope scope) {
        return switch (scope.type()) {
            case CLUSTER -> listCluster();
            case NAMESPACE -> WorkloadInventory.of(listNamespace(scope.namespace(), null));
            case WORKLOAD -> WorkloadInventory.of(listNamespace(scope.namespace(), scope.workloadName()));
        };
    }

    @Override
    public Optional<ClusterCapacity> getClusterCapacity(GovernanceScope scope) {
        NodeList nodes = get("/api/v1/nodes", NodeList.class);
        if (nodes == null || nodes.items() == null || nodes.items().isEmpty()) {
            return Optional.empty();
        }
        long cpu = 0;
        long memory = 0;
        int counted = 0;
        for (Node node : nodes.items()) {
            Map<String, String> allocatable = node.status() == null ? null : node.status().allocatable();
            if (allocatable == null) {
                continue;
            }
            try {
                cpu += quantityParser.parseCpuMillicores(allocatable.get("cpu"));
                memory += quantityParser.parseMemoryBytes(allocatable.get("memory"));
                counted++;
            } catch (MalformedQuantityException e) {
                log.warn("Skipping node {} with unreadable allocatable capacity: {}",
                        node.metadata() == null ? "?" : node.metadata().name(), e.getMessage());
            }
        }
        return counted == 0 ? Optional.empty() : Optional.of(new ClusterCapacity(cpu, memory, counted));
    }

    private WorkloadInventory listCluster() {
        NamespaceList namespaces;
        try {
            namespaces = get("/api/v1/namespaces?limit=1000", NamespaceList.class);
        } catch (RestClientException e) {
            throw new InventoryUnavailableException("Cannot list namespaces: " + e.getMessage(), e);
        }
        if (namespaces == null || namespaces.items() == null) {
            throw new InventoryUnavailableException("Namespace listing returned no body");
        }

        List<RawWorkloadSpec> workloads = new ArrayList<>();
        List<InventoryFailure> failures = new ArrayList<>();
        for (Namespace namespace : namespaces.items()) {
            String name = namespace.metadata().name();
            try {
                workloads.addAll(listNamespace(name, null));
            } catch (InventoryUnavailableException e) {
                log.warn("Skipping namespace {}: {}", name, e.getMessage());
                failures.add(new InventoryFailure(name, null, e.getMessage()));
            }
        }
        if (workloads.isEmpty() && !failures.isEmpty()) {
            throw new InventoryUnavailableException("No namespace could be listed (" + failures.size() + " failed)");
        }
        return new WorkloadInventory(workloads, failures);
    }

    private List<RawWorkloadSpec> listNamespace(String namespace, String workloadFilter) {
        PodList pods;
        try {
            pods = get("/api/v1/namespaces/{namespace}/pods?fieldSelector={selector}", PodList.class,
                    namespace, "status.phase=Running");
        } catch (RestClientException e) {
            throw new InventoryUnavailableException("Cannot list pods in " + namespace + ": " + e.getMessage(), e);
        }
        if (pods == null || pods.items() == null) {
            return List.of();
        }

        Map<String, WorkloadBuilder> byWorkload = new LinkedHashMap<>();
        for (Pod pod : pods.items()) {
            if (pod.metadata() == null) {
                continue;
            }
            String[] owner = resolveOwner(pod);
            if (workloadFilter != null && !workloadFilter.equals(owner[1])) {
                continue;
            }
            byWorkload.computeIfAbsent(owner[0] + "/" + owner[1],
                    key -> new WorkloadBuilder(namespace, owner[1], owner[0])).add(pod);
        }
        log.debug("Namespace {}: {} pods in {} workloads", namespace, pods.items().size(), byWorkload.size());
        return byWorkload.values().stream().map(WorkloadBuilder::build).toList();
    }

    /**
     * A ReplicaSet owner is reported as its Deployment only when the pod's
     * {@code pod-template-hash} label confirms the generated suffix; a
     * standalone ReplicaSet keeps its own kind and name.
     *
     * @return {controllerKind, workloadName}
     */
    static String[] resolveOwner(Pod pod) {
        List<OwnerReference> owners = pod.metadata().ownerReferences();
        if (owners == null || owners.isEmpty()) {
            return new String[]{"Pod", pod.metadata().name()};
        }
        OwnerReference owner = owners.stream()
                .filter(o -> Boolean.TRUE.equals(o.controller()))
                .findFirst()
                .orElse(owners.get(0));
        if ("ReplicaSet".equals(owner.kind())) {
            Map<String, String> labels = pod.metadata().labels();
            String hash = labels == null ? null : labels.get(POD_TEMPLATE_HASH);
            String suffix = "-" + hash;
            if (hash != null && !hash.isEmpty() && owner.name().endsWith(suffix)
                    && owner.name().length() > suffix.length()) {
                return new String[]{"Deployment", owner.name().substring(0, owner.name().length() - suffix.length())};
            }
            return new String[]{"ReplicaSet", owner.name()};
        }
        if ("Job".equals(owner.kind())) {
            return new String[]{"Job", owner.name()};
        }
        return new String[]{owner.kind(), owner.name()};
    }

    private <T> T get(String pathTemplate, Class<T> type, Object... uriVariables) {
        HttpHeaders headers = new HttpHeaders();
        resolveToken().ifPresent(headers::setBearerAuth);
        return restTemplate.exchange(apiUrl + pathTemplate, HttpMethod.GET, new HttpEntity<>(headers), type, uriVariables)
                .getBody();
    }

    private Optional<String> resolveToken() {
        if (token != null && !token.isBlank()) {
            return Optional.of(token);
        }
        Path path = Path.of(tokenFile);
        if (!Files.isReadable(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(path).trim());
        } catch (IOException e) {
            throw new InventoryUnavailableException("Cannot read service account token " + tokenFile, e);
        }
    }

    private static final class WorkloadBuilder {
        private final String namespace;
        private final String name;
        private final String controllerKind;
        private final List<RawPodSpec> pods = new ArrayList<>();
        private Instant oldest;

        WorkloadBuilder(String namespace, String name, String controllerKind) {
            this.namespace = namespace;
            this.name = name;
            this.controllerKind = controllerKind;
        }

        void add(Pod pod) {
            Instant created = parseTimestamp(pod.metadata().creationTimestamp());
            if (created != null && (oldest == null || created.isBefore(oldest))) {
                oldest = created;
            }
            List<RawContainerSpec> containers = new ArrayList<>();
            if (pod.spec() != null && pod.spec().containers() != null) {
                for (Container container : pod.spec().containers()) {
                    containers.add(container.resources() == null
                            ? new RawContainerSpec(container.name(), null, null)
                            : new RawContainerSpec(container.name(),
                                    container.resources().requests(), container.resources().limits()));
                }
            }
            pods.add(new RawPodSpec(pod.metadata().name(), containers));
        }

        RawWorkloadSpec build() {
            return new RawWorkloadSpec(namespace, name, controllerKind, oldest, pods);
        }

        private static Instant parseTimestamp(String value) {
            if (value == null) {
                return null;
            }
            try {
                return Instant.parse(value);
            } catch (DateTimeParseException e) {
                log.debug("Unreadable creationTimestamp {}", value);
                return null;
            }
        }
    }
}
