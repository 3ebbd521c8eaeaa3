package com.oru.governance.adapters.kubernetes;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * The slices of the core/v1 API the inventory adapter reads.
 * Unknown fields are ignored; timestamps stay RFC 3339 strings.
 */
final class KubernetesObjects {

    private KubernetesObjects() {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Metadata(
            String name,
            String namespace,
            String creationTimestamp,
            Map<String, String> labels,
            List<OwnerReference> ownerReferences
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record OwnerReference(String kind, String name, Boolean controller) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record NamespaceList(List<Namespace> items) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Namespace(Metadata metadata) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PodList(List<Pod> items) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Pod(Metadata metadata, PodSpec spec, PodStatus status) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PodSpec(List<Container> containers) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PodStatus(String phase) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Container(String name, Resources resources) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Resources(Map<String, String> requests, Map<String, String> limits) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record NodeList(List<Node> items) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Node(Metadata metadata, NodeStatus status) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record NodeStatus(Map<String, String> allocatable) {
    }
}
