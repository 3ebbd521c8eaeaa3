package com.oru.governance.metrics;

import com.oru.governance.adapters.MetricsAdapter;
import com.oru.governance.domain.exception.MetricsQueryException;
import com.oru.governance.domain.model.GovernanceOptions;
import com.oru.governance.domain.model.MetricQuerySpec;
import com.oru.governance.domain.model.MetricSampleSeries;
import com.oru.governance.domain.model.ResourceKind;
import com.oru.governance.domain.model.TimeRange;
import com.oru.governance.domain.model.WorkloadTarget;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Plans and runs historical metric queries with bounded concurrency.
 *
 * PLANNING:
 * One query per (target, kind), step chosen from {@link #STEP_LADDER} so
 * every series holds roughly {@code targetSamplesPerSeries} points.
 *
 * EXECUTION:
 * 1. A per-batch semaphore of {@code maxConcurrentQueries} permits is taken
 *    before each submission to the shared executor and released when the
 *    backend call returns
 * 2. Every query has its own timeout; backend failures are retried through a
 *    resilience4j {@link Retry}, timeouts are not
 * 3. The whole batch has a deadline; queries still PENDING then become TIMED_OUT
 *    and any later completion is ignored
 *
 * A single failing query never aborts the batch.
 */
@Slf4j
@Service
public class MetricQueryPlanner {

    static final Duration RETRY_WAIT = Duration.ofMillis(100);

    static final List<Duration> STEP_LADDER = List.of(
            Duration.ofSeconds(15),
            Duration.ofSeconds(30),
            Duration.ofMinutes(1),
            Duration.ofMinutes(2),
            Duration.ofMinutes(5),
            Duration.ofMinutes(10),
            Duration.ofMinutes(15),
            Duration.ofMinutes(30),
            Duration.ofHours(1),
            Duration.ofHours(2),
            Duration.ofHours(3),
            Duration.ofHours(6),
            Duration.ofHours(12),
            Duration.ofDays(1)
    );

    private final MetricsAdapter metricsAdapter;
    private final Executor executor;
    private final Clock clock;

    public MetricQueryPlanner(
            MetricsAdapter metricsAdapter,
            @Qualifier("metricQueryExecutor") Executor executor,
            Clock clock
    ) {
        this.metricsAdapter = metricsAdapter;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * Builds the minimal query set: duplicate targets collapse and each
     * remaining target gets one query per kind. A window ending in the
     * future is clamped to now.
     */
    public List<MetricQuerySpec> plan(
            Collection<WorkloadTarget> targets,
            List<ResourceKind> kinds,
            TimeRange timeRange,
            GovernanceOptions options
    ) {
        Map<WorkloadTarget, String> unknownControllers = new LinkedHashMap<>();
        targets.forEach(target -> unknownControllers.put(target, null));
        return plan(unknownControllers, kinds, timeRange, options);
    }

    /**
     * As {@link #plan(Collection, List, TimeRange, GovernanceOptions)}, with
     * each target's controller kind so backends can match its pod names exactly.
     */
    public List<MetricQuerySpec> plan(
            Map<WorkloadTarget, String> controllerKinds,
            List<ResourceKind> kinds,
            TimeRange timeRange,
            GovernanceOptions options
    ) {
        Instant issuedAt = clock.instant();
        TimeRange window = timeRange.clampEnd(issuedAt);
        Duration step = resolveStep(window, options);

        List<MetricQuerySpec> specs = new ArrayList<>();
        controllerKinds.forEach((target, controllerKind) -> {
            for (ResourceKind kind : kinds) {
                specs.add(MetricQuerySpec.create(target, controllerKind, kind, window, step, issuedAt,
                        options.getMaxSamplesPerSeries()));
            }
        });
        log.debug("Planned {} queries over {} with step {}", specs.size(), window, step);
        return specs;
    }

    /**
     * Smallest ladder step that keeps the series at or below the target
     * sample count, never below {@code minimumStep}.
     */
    public Duration resolveStep(TimeRange range, GovernanceOptions options) {
        long idealMillis = (long) Math.ceil((double) range.duration().toMillis() / options.getTargetSamplesPerSeries());
        Duration ideal = Duration.ofMillis(Math.max(idealMillis, options.getMinimumStep().toMillis()));
        for (Duration rung : STEP_LADDER) {
            if (rung.compareTo(ideal) >= 0) {
                return rung;
            }
        }
        // Ranges beyond the ladder scale linearly in whole days.
        long days = (long) Math.ceil((double) ideal.toMillis() / Duration.ofDays(1).toMillis());
        return Duration.ofDays(days);
    }

    /**
     * Runs the batch and returns one result per target, in plan order.
     * Every outcome in the result is terminal.
     */
    public Map<WorkloadTarget, WorkloadMetricResult> execute(List<MetricQuerySpec> specs, GovernanceOptions options) {
        if (specs.isEmpty()) {
            return Map.of();
        }
        QueryTracker tracker = new QueryTracker(specs);
        Semaphore permits = new Semaphore(options.getMaxConcurrentQueries());
        Retry retry = retryFor(options);
        long deadline = System.nanoTime() + options.getBatchDeadline().toNanos();
        List<CompletableFuture<Void>> inFlight = new ArrayList<>();

        for (MetricQuerySpec spec : specs) {
            if (!acquire(permits, deadline)) {
                log.warn("Batch deadline of {} reached before all {} queries were issued",
                        options.getBatchDeadline(), specs.size());
                break;
            }
            inFlight.add(submit(spec, retry, permits, tracker, options));
        }

        awaitBatch(inFlight, deadline);
        int expired = tracker.expirePending("batch deadline of " + options.getBatchDeadline() + " exceeded");
        if (expired > 0) {
            log.warn("{} of {} queries were still pending at the batch deadline", expired, specs.size());
        }
        return tracker.resultsByTarget();
    }

    private boolean acquire(Semaphore permits, long deadline) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
            return false;
        }
        try {
            return permits.tryAcquire(remaining, TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private CompletableFuture<Void> submit(MetricQuerySpec spec, Retry retry, Semaphore permits,
                                           QueryTracker tracker, GovernanceOptions options) {
        CompletableFuture<QueryOutcome> call;
        try {
            call = CompletableFuture.supplyAsync(() -> runWithRetries(spec, retry, permits), executor);
        } catch (RejectedExecutionException e) {
            permits.release();
            log.warn("Executor rejected query for {} {}: {}", spec.target(), spec.resourceKind(), e.getMessage());
            tracker.complete(QueryOutcome.failed(spec, "query executor saturated", 0));
            return CompletableFuture.completedFuture(null);
        }

        long timeoutMillis = options.getQueryTimeout().toMillis();
        return call
                .orTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .handle((outcome, error) -> {
                    tracker.complete(error == null ? outcome : toOutcome(spec, error, options));
                    return null;
                });
    }

    private QueryOutcome runWithRetries(MetricQuerySpec spec, Retry retry, Semaphore permits) {
        AtomicInteger attempts = new AtomicInteger();
        Supplier<MetricSampleSeries> call = Retry.decorateSupplier(retry, () -> {
            attempts.incrementAndGet();
            return metricsAdapter.query(spec);
        });
        try {
            MetricSampleSeries series = call.get();
            log.debug("Query {} {} returned {} samples (attempt {})",
                    spec.target(), spec.resourceKind(), series == null ? 0 : series.size(), attempts.get());
            return QueryOutcome.completed(spec, series, attempts.get());
        } catch (MetricsQueryException e) {
            log.warn("Query {} {} failed after {} attempts: {}",
                    spec.target(), spec.resourceKind(), attempts.get(), e.getMessage());
            return QueryOutcome.failed(spec, e.getMessage(), attempts.get());
        } catch (RuntimeException e) {
            log.error("Unexpected error querying {} {}", spec.target(), spec.resourceKind(), e);
            return QueryOutcome.failed(spec, "unexpected error: " + e.getMessage(), attempts.get());
        } finally {
            permits.release();
        }
    }

    /**
     * One retry policy per batch: backend failures only, never timeouts or
     * unexpected errors.
     */
    static Retry retryFor(GovernanceOptions options) {
        Retry retry = Retry.of("metric-query", RetryConfig.custom()
                .maxAttempts(options.getQueryRetryAttempts() + 1)
                .waitDuration(RETRY_WAIT)
                .retryExceptions(MetricsQueryException.class)
                .build());
        retry.getEventPublisher().onRetry(event -> log.debug("Retrying metric query (attempt {}): {}",
                event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
        return retry;
    }

    private QueryOutcome toOutcome(MetricQuerySpec spec, Throwable error, GovernanceOptions options) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TimeoutException) {
            log.warn("Query {} {} timed out after {}", spec.target(), spec.resourceKind(), options.getQueryTimeout());
            return QueryOutcome.timedOut(spec, "query exceeded timeout of " + options.getQueryTimeout());
        }
        log.warn("Query {} {} failed: {}", spec.target(), spec.resourceKind(), cause.toString());
        return QueryOutcome.failed(spec, cause.toString(), 0);
    }

    private void awaitBatch(List<CompletableFuture<Void>> inFlight, long deadline) {
        long remaining = deadline - System.nanoTime();
        if (inFlight.isEmpty() || remaining <= 0) {
            return;
        }
        try {
            CompletableFuture.allOf(inFlight.toArray(new CompletableFuture[0])).get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            log.debug("Batch deadline reached with queries in flight");
        } catch (ExecutionException e) {
            // handle() already turned every failure into an outcome
            log.error("Unexpected batch failure", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for metric queries");
        }
    }

    /**
     * Per-batch outcome table. Only PENDING entries are ever replaced, so a
     * completion arriving after expiry cannot change the result.
     */
    private static final class QueryTracker {

        private final List<MetricQuerySpec> specs;
        private final Map<QueryKey, QueryOutcome> outcomes = new ConcurrentHashMap<>();

        QueryTracker(List<MetricQuerySpec> specs) {
            this.specs = specs;
            specs.forEach(spec -> outcomes.put(QueryKey.of(spec), QueryOutcome.pending(spec)));
        }

        void complete(QueryOutcome outcome) {
            outcomes.computeIfPresent(QueryKey.of(outcome.spec()),
                    (key, current) -> current.isResolved() ? current : outcome);
        }

        int expirePending(String reason) {
            int[] expired = {0};
            outcomes.replaceAll((key, current) -> {
                if (current.isResolved()) {
                    return current;
                }
                expired[0]++;
                return QueryOutcome.timedOut(current.spec(), reason);
            });
            return expired[0];
        }

        Map<WorkloadTarget, WorkloadMetricResult> resultsByTarget() {
            Map<WorkloadTarget, Map<ResourceKind, QueryOutcome>> grouped = new LinkedHashMap<>();
            for (MetricQuerySpec spec : specs) {
                grouped.computeIfAbsent(spec.target(), t -> new LinkedHashMap<>())
                        .put(spec.resourceKind(), outcomes.get(QueryKey.of(spec)));
            }
            Map<WorkloadTarget, WorkloadMetricResult> results = new LinkedHashMap<>();
            grouped.forEach((target, byKind) -> results.put(target, new WorkloadMetricResult(target, byKind)));
            return results;
        }
    }

    private record QueryKey(WorkloadTarget target, ResourceKind kind) {
        static QueryKey of(MetricQuerySpec spec) {
            return new QueryKey(spec.target(), spec.resourceKind());
        }
    }
}
