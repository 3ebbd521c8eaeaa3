package com.oru.governance.domain.model;

import com.oru.governance.domain.exception.InvalidConfigurationException;

/**
 * What a report covers: the whole cluster, one namespace, or one workload.
 */
public record GovernanceScope(Type type, String namespace, String workloadName) {

    public enum Type {
        CLUSTER,
        NAMESPACE,
        WORKLOAD
    }

    public GovernanceScope {
        if (type == null) {
            throw new InvalidConfigurationException("scope type must be set");
        }
        if (type != Type.CLUSTER && isBlank(namespace)) {
            throw new InvalidConfigurationException(type + " scope requires a namespace");
        }
        if (type == Type.WORKLOAD && isBlank(workloadName)) {
            throw new InvalidConfigurationException("workload scope requires a workload name");
        }
    }

    public static GovernanceScope cluster() {
        return new GovernanceScope(Type.CLUSTER, null, null);
    }

    public static GovernanceScope namespace(String namespace) {
        return new GovernanceScope(Type.NAMESPACE, namespace, null);
    }

    public static GovernanceScope workload(String namespace, String workloadName) {
        return new GovernanceScope(Type.WORKLOAD, namespace, workloadName);
    }

    public boolean isCluster() {
        return type == Type.CLUSTER;
    }

    /**
     * Stable identifier, e.g. {@code cluster}, {@code namespace:payments}
     * or {@code workload:payments/api}.
     */
    public String id() {
        return switch (type) {
            case CLUSTER -> "cluster";
            case NAMESPACE -> "namespace:" + namespace;
            case WORKLOAD -> "workload:" + namespace + "/" + workloadName;
        };
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
