package com.oru.governance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Resource Governance Engine
 *
 * Audits CPU/memory requests and limits across a Kubernetes cluster and
 * produces percentile-based sizing recommendations from Prometheus history.
 * The engine is a library-style boundary: callers obtain
 * {@link com.oru.governance.service.ResourceGovernanceEngine} from the context.
 */
@SpringBootApplication
public class ResourceGovernanceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResourceGovernanceApplication.class, args);
    }
}
