package com.oru.governance.domain.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import org.hibernate.validator.constraints.time.DurationMin;

import java.time.Duration;
import java.util.List;

/**
 * Tunables of one governance run.
 *
 * Defaults mirror common capacity-management practice and are exposed as
 * named constants. Constraints are checked by
 * {@code GovernanceOptionsValidator} at engine entry; nothing is clamped.
 */
@Value
@Builder(toBuilder = true)
public class GovernanceOptions {

    public static final double DEFAULT_LIMIT_RATIO = 3.0;
    public static final double DEFAULT_RATIO_TOLERANCE = 2.0;
    public static final long DEFAULT_MINIMUM_CPU_MILLICORES = 10;
    public static final long DEFAULT_MINIMUM_MEMORY_BYTES = 32L << 20;
    public static final double DEFAULT_OVERCOMMIT_WARNING = 0.75;
    public static final double DEFAULT_OVERCOMMIT_CRITICAL = 0.9;
    public static final double DEFAULT_PERCENTILE = 95.0;
    public static final int DEFAULT_MINIMUM_SAMPLES = 10;
    public static final Duration DEFAULT_MINIMUM_DATA_SPAN = Duration.ofHours(1);
    public static final double DEFAULT_SEASONALITY_THRESHOLD = 0.5;
    public static final int DEFAULT_SEASONALITY_WINDOWS = 4;
    public static final int DEFAULT_TARGET_SAMPLES = 120;
    public static final int DEFAULT_MAX_SAMPLES = 11_000;
    public static final Duration DEFAULT_MINIMUM_STEP = Duration.ofSeconds(15);
    public static final int DEFAULT_MAX_CONCURRENT_QUERIES = 8;
    public static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_QUERY_RETRY_ATTEMPTS = 1;
    public static final Duration DEFAULT_BATCH_DEADLINE = Duration.ofMinutes(2);
    public static final Duration DEFAULT_NEW_WORKLOAD_AGE = Duration.ofDays(7);
    public static final double DEFAULT_OVER_PROVISIONED_RATIO = 0.5;
    public static final double DEFAULT_UNDER_PROVISIONED_RATIO = 0.8;
    public static final List<String> DEFAULT_SYSTEM_NAMESPACE_PREFIXES = List.of("kube-", "openshift-");
    public static final List<String> DEFAULT_SYSTEM_NAMESPACES =
            List.of("default", "kube-system", "kube-public", "kube-node-lease");

    // Validation

    @DecimalMin("1.0")
    @Builder.Default
    double cpuLimitRatio = DEFAULT_LIMIT_RATIO;

    @DecimalMin("1.0")
    @Builder.Default
    double memoryLimitRatio = DEFAULT_LIMIT_RATIO;

    @Positive
    @Builder.Default
    double ratioTolerance = DEFAULT_RATIO_TOLERANCE;

    @PositiveOrZero
    @Builder.Default
    long minimumCpuMillicores = DEFAULT_MINIMUM_CPU_MILLICORES;

    @PositiveOrZero
    @Builder.Default
    long minimumMemoryBytes = DEFAULT_MINIMUM_MEMORY_BYTES;

    @NotNull
    @Builder.Default
    Duration newWorkloadAge = DEFAULT_NEW_WORKLOAD_AGE;

    @Builder.Default
    boolean includeSystemNamespaces = false;

    @NotNull
    @Builder.Default
    List<String> systemNamespacePrefixes = DEFAULT_SYSTEM_NAMESPACE_PREFIXES;

    @NotNull
    @Builder.Default
    List<String> systemNamespaces = DEFAULT_SYSTEM_NAMESPACES;

    // Overcommit

    @Positive
    @Builder.Default
    double overcommitWarning = DEFAULT_OVERCOMMIT_WARNING;

    @Positive
    @Builder.Default
    double overcommitCritical = DEFAULT_OVERCOMMIT_CRITICAL;

    // Recommendations

    @Builder.Default
    boolean includeRecommendations = true;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("100.0")
    @Builder.Default
    double percentile = DEFAULT_PERCENTILE;

    @Min(1)
    @Builder.Default
    int minimumSamples = DEFAULT_MINIMUM_SAMPLES;

    @NotNull
    @DurationMin(seconds = 0)
    @Builder.Default
    Duration minimumDataSpan = DEFAULT_MINIMUM_DATA_SPAN;

    @Min(1)
    @Builder.Default
    long cpuGranularityMillicores = ResourceKind.CPU.getDefaultGranularity();

    @Min(1)
    @Builder.Default
    long memoryGranularityBytes = ResourceKind.MEMORY.getDefaultGranularity();

    @PositiveOrZero
    @Builder.Default
    double seasonalityThreshold = DEFAULT_SEASONALITY_THRESHOLD;

    @Min(2)
    @Builder.Default
    int seasonalityWindows = DEFAULT_SEASONALITY_WINDOWS;

    @Positive
    @Builder.Default
    double overProvisionedRatio = DEFAULT_OVER_PROVISIONED_RATIO;

    @Positive
    @Builder.Default
    double underProvisionedRatio = DEFAULT_UNDER_PROVISIONED_RATIO;

    // Query planning and execution

    @Min(2)
    @Builder.Default
    int targetSamplesPerSeries = DEFAULT_TARGET_SAMPLES;

    @Min(2)
    @Builder.Default
    int maxSamplesPerSeries = DEFAULT_MAX_SAMPLES;

    @NotNull
    @DurationMin(seconds = 1)
    @Builder.Default
    Duration minimumStep = DEFAULT_MINIMUM_STEP;

    @Min(1)
    @Max(256)
    @Builder.Default
    int maxConcurrentQueries = DEFAULT_MAX_CONCURRENT_QUERIES;

    @NotNull
    @DurationMin(millis = 1)
    @Builder.Default
    Duration queryTimeout = DEFAULT_QUERY_TIMEOUT;

    @Min(0)
    @Max(5)
    @Builder.Default
    int queryRetryAttempts = DEFAULT_QUERY_RETRY_ATTEMPTS;

    @NotNull
    @DurationMin(millis = 1)
    @Builder.Default
    Duration batchDeadline = DEFAULT_BATCH_DEADLINE;

    public static GovernanceOptions defaults() {
        return builder().build();
    }

    public double limitRatio(ResourceKind kind) {
        return kind == ResourceKind.CPU ? cpuLimitRatio : memoryLimitRatio;
    }

    public long minimumRequest(ResourceKind kind) {
        return kind == ResourceKind.CPU ? minimumCpuMillicores : minimumMemoryBytes;
    }

    public long granularity(ResourceKind kind) {
        return kind == ResourceKind.CPU ? cpuGranularityMillicores : memoryGranularityBytes;
    }

    public boolean isSystemNamespace(String namespace) {
        return systemNamespaces.contains(namespace)
                || systemNamespacePrefixes.stream().anyMatch(namespace::startsWith);
    }
}
