package com.oru.governance.domain.model;

import java.util.Map;

/**
 * Counters over a report. Every severity, confidence and QoS class is present, zero included.
 * Pods are counted once per namespace and pod name.
 */
public record ReportSummary(
        Map<Severity, Long> findingsBySeverity,
        Map<Confidence, Long> recommendationsByConfidence,
        int totalFindings,
        int workloadCount,
        int containerCount,
        Map<QosClass, Long> podsByQosClass
) {

    public ReportSummary {
        findingsBySeverity = Map.copyOf(findingsBySeverity);
        recommendationsByConfidence = Map.copyOf(recommendationsByConfidence);
        podsByQosClass = Map.copyOf(podsByQosClass);
    }

    public long findings(Severity severity) {
        return findingsBySeverity.getOrDefault(severity, 0L);
    }

    public long recommendations(Confidence confidence) {
        return recommendationsByConfidence.getOrDefault(confidence, 0L);
    }

    public long pods(QosClass qosClass) {
        return podsByQosClass.getOrDefault(qosClass, 0L);
    }
}
