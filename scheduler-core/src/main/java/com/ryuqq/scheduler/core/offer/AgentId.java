package com.ryuqq.scheduler.core.offer;

/**
 * Offer를 제공한 클러스터 노드(Agent) 식별자.
 *
 * @param value Agent ID 값
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AgentId(String value) {

    public AgentId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("AgentId cannot be null or blank");
        }
    }

    public static AgentId of(String value) {
        return new AgentId(value);
    }
}
