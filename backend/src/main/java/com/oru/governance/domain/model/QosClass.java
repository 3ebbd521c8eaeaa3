package com.oru.governance.domain.model;

import java.util.Collection;

/**
 * Kubernetes quality-of-service class implied by resource declarations.
 */
public enum QosClass {
    GUARANTEED,
    BURSTABLE,
    BEST_EFFORT;

    /**
     * Class of a pod from its containers: guaranteed only when every container
     * is, best-effort only when every container is, burstable otherwise.
     */
    public static QosClass ofPod(Collection<ResourceSnapshot> containers) {
        if (containers.isEmpty()) {
            return BEST_EFFORT;
        }
        if (containers.stream().allMatch(c -> c.qosClass() == GUARANTEED)) {
            return GUARANTEED;
        }
        if (containers.stream().allMatch(c -> c.qosClass() == BEST_EFFORT)) {
            return BEST_EFFORT;
        }
        return BURSTABLE;
    }
}
