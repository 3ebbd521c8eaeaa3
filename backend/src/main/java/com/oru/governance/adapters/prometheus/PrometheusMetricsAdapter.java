package com.oru.governance.adapters.prometheus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.oru.governance.adapters.MetricsAdapter;
import com.oru.governance.domain.exception.MetricsQueryException;
import com.oru.governance.domain.model.MetricAggregation;
import com.oru.governance.domain.model.MetricQuerySpec;
import com.oru.governance.domain.model.MetricSample;
import com.oru.governance.domain.model.MetricSampleSeries;
import com.oru.governance.domain.model.ResourceKind;
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
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Prometheus HTTP API metrics adapter.
 *
 * API ENDPOINT USED:
 * GET /api/v1/query_range?query=...&start=...&end=...&step=...
 *
 * QUERIES (cAdvisor series, reduced to the busiest pod at each step):
 * - CPU: {@code max(sum by (pod) (rate(container_cpu_usage_seconds_total{...}[window])))}, cores -> millicores
 * - Memory: {@code max(max by (pod) (max_over_time(container_memory_working_set_bytes{...}[window])))}, bytes
 *
 * Pods are selected by the naming scheme of the workload's controller, so a
 * workload whose name prefixes another's ("api" and "api-gateway") does not
 * pick up the other's pods.
 *
 * Thread-safe; RestTemplate and ObjectMapper are shared.
 */
@Component
@ConditionalOnProperty(name = "app.env", havingValue = "cluster")
@Slf4j
public class PrometheusMetricsAdapter implements MetricsAdapter {

    private static final Duration MINIMUM_RATE_WINDOW = Duration.ofMinutes(1);
    private static final String SUFFIX = "[bcdfghjklmnpqrstvwxz2456789]";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Value("${prometheus.url:http://prometheus-server.monitoring.svc:9090}")
    private String prometheusUrl;

    @Value("${prometheus.token:}")
    private String token;

    public PrometheusMetricsAdapter(
            @Qualifier("prometheusRestTemplate") RestTemplate restTemplate,
            ObjectMapper objectMapper
    ) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public MetricSampleSeries query(MetricQuerySpec spec) {
        String promQl = buildQuery(spec);
        URI uri = UriComponentsBuilder.fromHttpUrl(prometheusUrl)
                .path("/api/v1/query_range")
                .queryParam("query", promQl)
                .queryParam("start", spec.range().start().getEpochSecond())
                .queryParam("end", spec.range().end().getEpochSecond())
                .queryParam("step", spec.step().toSeconds() + "s")
                .build()
                .encode()
                .toUri();

        HttpHeaders headers = new HttpHeaders();
        if (token != null && !token.isBlank()) {
            headers.setBearerAuth(token);
        }

        String body;
        try {
            body = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), String.class).getBody();
        } catch (RestClientException e) {
            throw new MetricsQueryException("Prometheus request failed for " + spec.target() + ": " + e.getMessage(), e);
        }
        log.debug("Prometheus query for {} {}: {}", spec.target(), spec.resourceKind(), promQl);
        return parseResponse(body, spec.resourceKind());
    }

    /**
     * PromQL for one spec.
     */
    static String buildQuery(MetricQuerySpec spec) {
        String selector = String.format("namespace=\"%s\", pod=~\"%s\", container=\"%s\"",
                escape(spec.target().namespace()),
                escape(podPattern(spec.target().workloadName(), spec.controllerKind())),
                escape(spec.target().containerName()));
        Duration window = spec.step().compareTo(MINIMUM_RATE_WINDOW) < 0 ? MINIMUM_RATE_WINDOW : spec.step();
        String range = window.toSeconds() + "s";

        if (spec.aggregation() == MetricAggregation.AVERAGE_RATE) {
            return "max(sum by (pod) (rate(container_cpu_usage_seconds_total{" + selector + "}[" + range + "])))";
        }
        return "max(max by (pod) (max_over_time(container_memory_working_set_bytes{" + selector + "}[" + range + "])))";
    }

    /**
     * Regex matching the pod names a controller of the given kind generates
     * for {@code workloadName}. Generated suffixes only use the Kubernetes
     * safe alphabet; an unknown kind accepts any of the known shapes.
     */
    static String podPattern(String workloadName, String controllerKind) {
        String name = quoteRegex(workloadName);
        if (controllerKind == null) {
            return name + "(-" + SUFFIX + "{5,10}-" + SUFFIX + "{5}|-" + SUFFIX + "{5}|-[0-9]+)?";
        }
        switch (controllerKind) {
            case "Deployment":
                return name + "-" + SUFFIX + "{5,10}-" + SUFFIX + "{5}";
            case "StatefulSet":
                return name + "-[0-9]+";
            case "CronJob":
                return name + "-[0-9]+-" + SUFFIX + "{5}";
            case "Pod":
                return name;
            default:
                return name + "-" + SUFFIX + "{5}";
        }
    }

    MetricSampleSeries parseResponse(String body, ResourceKind kind) {
        if (body == null || body.isBlank()) {
            throw new MetricsQueryException("Empty response body from Prometheus");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MetricsQueryException("Unreadable Prometheus response: " + e.getOriginalMessage(), e);
        }
        if (!"success".equals(root.path("status").asText())) {
            throw new MetricsQueryException("Prometheus error " + root.path("errorType").asText("unknown")
                    + ": " + root.path("error").asText("no message"));
        }

        double scale = kind == ResourceKind.CPU ? 1000.0 : 1.0;
        // several series can still arrive (older servers, recording rules); keep the busiest per timestamp
        Map<Instant, Double> busiest = new TreeMap<>();
        for (JsonNode series : root.path("data").path("result")) {
            for (JsonNode point : series.path("values")) {
                Instant timestamp = Instant.ofEpochMilli(Math.round(point.get(0).asDouble() * 1000));
                busiest.merge(timestamp, parseValue(point.get(1).asText()) * scale, PrometheusMetricsAdapter::busier);
            }
        }
        List<MetricSample> samples = new ArrayList<>();
        busiest.forEach((timestamp, value) -> samples.add(new MetricSample(timestamp, value)));
        return samples.isEmpty() ? MetricSampleSeries.empty() : new MetricSampleSeries(samples);
    }

    private static Double busier(Double a, Double b) {
        if (a.isNaN()) {
            return b;
        }
        return b.isNaN() ? a : Math.max(a, b);
    }

    private static double parseValue(String raw) {
        if (raw == null || raw.endsWith("Inf")) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            log.debug("Unparseable sample value {}", raw);
            return Double.NaN;
        }
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private static String quoteRegex(String value) {
        return value.replace(".", "\\.");
    }
}
