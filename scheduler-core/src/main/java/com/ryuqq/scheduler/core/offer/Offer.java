package com.ryuqq.scheduler.core.offer;

import java.util.Collection;
import java.util.List;

/**
 * 한 클러스터 노드가 한 매칭 라운드 동안 제공하는 리소스 스냅샷.
 *
 * <p>Offer는 불변 값이며, {@link #consume(Collection)}은 차감된 새 Offer를 반환합니다.
 * 따라서 여러 스레드에서 잠금 없이 공유할 수 있습니다.</p>
 *
 * @param id Offer ID
 * @param agentId Offer를 제공한 Agent
 * @param hostname Agent 호스트명
 * @param resources 리소스 목록 (순서 유지, 불변 복사본)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Offer(
    OfferId id,
    AgentId agentId,
    String hostname,
    List<Resource> resources
) {

    public Offer {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (agentId == null) {
            throw new IllegalArgumentException("agentId cannot be null");
        }
        if (hostname == null || hostname.isBlank()) {
            throw new IllegalArgumentException("hostname cannot be null or blank");
        }
        resources = resources == null ? List.of() : List.copyOf(resources);
    }

    /**
     * 사용된 리소스를 차감한 새 Offer 반환.
     *
     * @param usedResources 사용된 리소스
     * @return 차감된 Offer
     * @see Resources#consume(List, Collection)
     */
    public Offer consume(Collection<Resource> usedResources) {
        return new Offer(id, agentId, hostname, Resources.consume(resources, usedResources));
    }

    public boolean isOvercommitted() {
        return Resources.isOvercommitted(resources);
    }

    public double matchingScalarSum(Resource requested) {
        return Resources.matchingScalarSum(resources, requested);
    }

    public double scalarSum(String name) {
        return Resources.scalarSum(resources, name);
    }
}
