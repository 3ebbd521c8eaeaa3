package com.oru.governance.domain.model;

public record OvercommitResult(String scopeId, ResourceOvercommit cpu, ResourceOvercommit memory) {

    public ResourceOvercommit forKind(ResourceKind kind) {
        return kind == ResourceKind.CPU ? cpu : memory;
    }

    public boolean capacityKnown() {
        return cpu.status() != OvercommitStatus.CAPACITY_UNKNOWN
                && memory.status() != OvercommitStatus.CAPACITY_UNKNOWN;
    }
}
