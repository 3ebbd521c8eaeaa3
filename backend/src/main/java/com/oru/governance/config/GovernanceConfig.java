package com.oru.governance.config;

import com.oru.governance.domain.model.GovernanceOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * Binds {@code governance.*} properties into the default {@link GovernanceOptions}.
 *
 * Every property is optional; inline defaults match the constants on
 * {@link GovernanceOptions}. The bean is validated at startup so a bad
 * application.yml fails fast instead of on the first report.
 */
@Configuration
@Slf4j
public class GovernanceConfig {

    // Validation

    @Value("${governance.validation.cpu-limit-ratio:3.0}")
    private double cpuLimitRatio;

    @Value("${governance.validation.memory-limit-ratio:3.0}")
    private double memoryLimitRatio;

    @Value("${governance.validation.ratio-tolerance:2.0}")
    private double ratioTolerance;

    @Value("${governance.validation.minimum-cpu-millicores:10}")
    private long minimumCpuMillicores;

    @Value("${governance.validation.minimum-memory-bytes:33554432}")
    private long minimumMemoryBytes;

    @Value("${governance.validation.new-workload-age:7d}")
    private Duration newWorkloadAge;

    @Value("${governance.namespaces.include-system:false}")
    private boolean includeSystemNamespaces;

    @Value("${governance.namespaces.system-prefixes:kube-,openshift-}")
    private List<String> systemNamespacePrefixes;

    @Value("${governance.namespaces.system-names:default,kube-system,kube-public,kube-node-lease}")
    private List<String> systemNamespaces;

    // Overcommit

    @Value("${governance.overcommit.warning:0.75}")
    private double overcommitWarning;

    @Value("${governance.overcommit.critical:0.9}")
    private double overcommitCritical;

    // Recommendations

    @Value("${governance.recommendations.enabled:true}")
    private boolean includeRecommendations;

    @Value("${governance.recommendations.percentile:95.0}")
    private double percentile;

    @Value("${governance.recommendations.minimum-samples:10}")
    private int minimumSamples;

    @Value("${governance.recommendations.minimum-data-span:1h}")
    private Duration minimumDataSpan;

    @Value("${governance.recommendations.cpu-granularity-millicores:1}")
    private long cpuGranularityMillicores;

    @Value("${governance.recommendations.memory-granularity-bytes:1048576}")
    private long memoryGranularityBytes;

    @Value("${governance.recommendations.seasonality-threshold:0.5}")
    private double seasonalityThreshold;

    @Value("${governance.recommendations.seasonality-windows:4}")
    private int seasonalityWindows;

    @Value("${governance.recommendations.over-provisioned-ratio:0.5}")
    private double overProvisionedRatio;

    @Value("${governance.recommendations.under-provisioned-ratio:0.8}")
    private double underProvisionedRatio;

    // Metrics

    @Value("${governance.metrics.target-samples-per-series:120}")
    private int targetSamplesPerSeries;

    @Value("${governance.metrics.max-samples-per-series:11000}")
    private int maxSamplesPerSeries;

    @Value("${governance.metrics.minimum-step:15s}")
    private Duration minimumStep;

    @Value("${governance.metrics.max-concurrent-queries:8}")
    private int maxConcurrentQueries;

    @Value("${governance.metrics.query-timeout:30s}")
    private Duration queryTimeout;

    @Value("${governance.metrics.query-retry-attempts:1}")
    private int queryRetryAttempts;

    @Value("${governance.metrics.batch-deadline:2m}")
    private Duration batchDeadline;

    @Bean
    public GovernanceOptions defaultGovernanceOptions(GovernanceOptionsValidator validator) {
        GovernanceOptions options = GovernanceOptions.builder()
                .cpuLimitRatio(cpuLimitRatio)
                .memoryLimitRatio(memoryLimitRatio)
                .ratioTolerance(ratioTolerance)
                .minimumCpuMillicores(minimumCpuMillicores)
                .minimumMemoryBytes(minimumMemoryBytes)
                .newWorkloadAge(newWorkloadAge)
                .includeSystemNamespaces(includeSystemNamespaces)
                .systemNamespacePrefixes(List.copyOf(systemNamespacePrefixes))
                .systemNamespaces(List.copyOf(systemNamespaces))
                .overcommitWarning(overcommitWarning)
                .overcommitCritical(overcommitCritical)
                .includeRecommendations(includeRecommendations)
                .percentile(percentile)
                .minimumSamples(minimumSamples)
                .minimumDataSpan(minimumDataSpan)
                .cpuGranularityMillicores(cpuGranularityMillicores)
                .memoryGranularityBytes(memoryGranularityBytes)
                .seasonalityThreshold(seasonalityThreshold)
                .seasonalityWindows(seasonalityWindows)
                .overProvisionedRatio(overProvisionedRatio)
                .underProvisionedRatio(underProvisionedRatio)
                .targetSamplesPerSeries(targetSamplesPerSeries)
                .maxSamplesPerSeries(maxSamplesPerSeries)
                .minimumStep(minimumStep)
                .maxConcurrentQueries(maxConcurrentQueries)
                .queryTimeout(queryTimeout)
                .queryRetryAttempts(queryRetryAttempts)
                .batchDeadline(batchDeadline)
                .build();
        validator.validate(options);
        log.info("Governance defaults: limit ratio cpu={} memory={}, p{}, {} concurrent queries, deadline {}",
                cpuLimitRatio, memoryLimitRatio, percentile, maxConcurrentQueries, batchDeadline);
        return options;
    }
}
