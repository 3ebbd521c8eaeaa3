package com.oru.governance.config;

import com.oru.governance.adapters.InventoryAdapter;
import com.oru.governance.adapters.MetricsAdapter;
import com.oru.governance.domain.exception.InventoryUnavailableException;
import com.oru.governance.domain.model.GovernanceScope;
import com.oru.governance.domain.model.MetricQuerySpec;
import com.oru.governance.domain.model.MetricSample;
import com.oru.governance.domain.model.MetricSampleSeries;
import com.oru.governance.domain.model.ResourceKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Local development configuration.
 *
 * ENABLED WHEN: app.env=local (the default)
 *
 * Provides mock inventory and metrics adapters with deterministic data so
 * the engine can run without a cluster or a Prometheus server. The mock
 * cluster deliberately contains every kind of misconfiguration the rules
 * look for.
 *
 * NO CLUSTER CREDENTIALS REQUIRED!
 */
@Configuration
@ConditionalOnProperty(name = "app.env", havingValue = "local", matchIfMissing = true)
@Slf4j
public class LocalDevConfig {

    @Bean
    public InventoryAdapter mockInventoryAdapter(Clock clock) {
        log.info("LOCAL MODE: using MockInventoryAdapter");
        return new MockInventoryAdapter(clock);
    }

    @Bean
    public MetricsAdapter mockMetricsAdapter() {
        log.info("LOCAL MODE: using MockMetricsAdapter");
        return new MockMetricsAdapter();
    }

    /**
     * Fixed mock cluster: three namespaces, one of them a system namespace.
     */
    static class MockInventoryAdapter implements InventoryAdapter {

        private static final long MEBI = 1L << 20;

        private final Clock clock;

        MockInventoryAdapter(Clock clock) {
            this.clock = clock;
        }

        @Override
        public WorkloadInventory listWorkloadResourceSpecs(GovernanceScope scope) {
            List<RawWorkloadSpec> all = cluster(clock.instant());
            List<RawWorkloadSpec> selected = all.stream()
                    .filter(w -> switch (scope.type()) {
                        case CLUSTER -> true;
                        case NAMESPACE -> w.namespace().equals(scope.namespace());
                        case WORKLOAD -> w.namespace().equals(scope.namespace())
                                && w.name().equals(scope.workloadName());
                    })
                    .toList();
            if (selected.isEmpty() && scope.type() != GovernanceScope.Type.CLUSTER) {
                throw new InventoryUnavailableException("MOCK: nothing found for " + scope.id());
            }
            log.debug("MOCK: listed {} workloads for {}", selected.size(), scope.id());
            return WorkloadInventory.of(selected);
        }

        @Override
        public Optional<ClusterCapacity> getClusterCapacity(GovernanceScope scope) {
            return Optional.of(new ClusterCapacity(12_000L, 48 * 1024 * MEBI, 3));
        }

        private List<RawWorkloadSpec> cluster(Instant now) {
            Instant established = now.minus(Duration.ofDays(45));
            return List.of(
                    workload("payments", "checkout-api", "Deployment", established, 2,
                            container("app", "200m", "256Mi", "600m", "768Mi"),
                            container("istio-proxy", "10m", "64Mi", null, null)),
                    workload("payments", "ledger-worker", "Deployment", established, 1,
                            container("worker", "500m", "1Gi", "4", "2Gi")),
                    workload("payments", "fraud-scorer", "StatefulSet", established, 1,
                            container("scorer", null, null, null, null)),
                    workload("storefront", "web", "Deployment", established, 3,
                            container("nginx", "100m", "128Mi", "1000m", "256Mi")),
                    workload("storefront", "batch-report", "CronJob", established, 1,
                            container("report", "5m", "1.5Gi", "50m", "3Gi")),
                    workload("storefront", "legacy-cron", "CronJob", established, 1,
                            container("job", "100m", "12Q", "300m", "256Mi")),
                    workload("storefront", "promo-banner", "Deployment", now.minus(Duration.ofDays(2)), 1,
                            container("banner", "50m", "64Mi", "150m", "192Mi")),
                    workload("kube-system", "coredns", "Deployment", established, 2,
                            container("coredns", "100m", "70Mi", null, "170Mi"))
            );
        }

        private static RawWorkloadSpec workload(String namespace, String name, String kind, Instant created,
                                                int replicas, RawContainerSpec... containers) {
            List<RawPodSpec> pods = new ArrayList<>();
            for (int i = 0; i < replicas; i++) {
                pods.add(new RawPodSpec(name + "-7d9f8c6b5-" + (char) ('a' + i) + "x2kq", List.of(containers)));
            }
            return new RawWorkloadSpec(namespace, name, kind, created, pods);
        }

        private static RawContainerSpec container(String name, String cpuRequest, String memoryRequest,
                                                  String cpuLimit, String memoryLimit) {
            return new RawContainerSpec(name, quantities(cpuRequest, memoryRequest), quantities(cpuLimit, memoryLimit));
        }

        private static Map<String, String> quantities(String cpu, String memory) {
            if (cpu == null && memory == null) {
                return Map.of();
            }
            if (cpu == null) {
                return Map.of("memory", memory);
            }
            if (memory == null) {
                return Map.of("cpu", cpu);
            }
            return Map.of("cpu", cpu, "memory", memory);
        }
    }

    /**
     * Synthetic usage shaped per workload: steady, idle, weekday-heavy or absent.
     * Seeded per (target, kind) so repeated runs give identical series.
     */
    static class MockMetricsAdapter implements MetricsAdapter {

        private static final double MEBI = 1 << 20;

        @Override
        public MetricSampleSeries query(MetricQuerySpec spec) {
            String workload = spec.target().workloadName();
            if (workload.equals("legacy-cron")) {
                log.debug("MOCK: no data for {}", spec.target());
                return MetricSampleSeries.empty();
            }

            Random random = new Random((spec.target().toString() + spec.resourceKind()).hashCode());
            double base = baseline(workload, spec.resourceKind());
            List<MetricSample> samples = new ArrayList<>();
            Instant t = spec.range().start();
            while (t.isBefore(spec.range().end())) {
                double value = base * (0.8 + random.nextDouble() * 0.4);
                if (workload.equals("batch-report") && isWeekday(t)) {
                    value *= 6;
                }
                samples.add(new MetricSample(t, value));
                t = t.plus(spec.step());
            }
            log.debug("MOCK: {} samples for {} {}", samples.size(), spec.target(), spec.resourceKind());
            return new MetricSampleSeries(samples);
        }

        private static double baseline(String workload, ResourceKind kind) {
            boolean cpu = kind == ResourceKind.CPU;
            return switch (workload) {
                case "checkout-api" -> cpu ? 180 : 230 * MEBI;
                case "ledger-worker" -> cpu ? 40 : 300 * MEBI;
                case "web" -> cpu ? 90 : 110 * MEBI;
                case "batch-report" -> cpu ? 20 : 900 * MEBI;
                default -> cpu ? 25 : 40 * MEBI;
            };
        }

        private static boolean isWeekday(Instant instant) {
            DayOfWeek day = instant.atOffset(ZoneOffset.UTC).getDayOfWeek();
            return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
        }
    }
}
