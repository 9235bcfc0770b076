package com.ryuqq.scheduler.core.instance;

import com.ryuqq.scheduler.core.offer.AgentId;
import com.ryuqq.scheduler.core.offer.Offer;

/**
 * 인스턴스가 배치된 Agent 정보.
 *
 * @param host 호스트명
 * @param agentId Agent ID (null 허용, 아직 배치되지 않은 경우)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AgentInfo(
    String host,
    AgentId agentId
) {

    public AgentInfo {
        if (host == null) {
            throw new IllegalArgumentException("host cannot be null");
        }
    }

    public static AgentInfo of(Offer offer) {
        return new AgentInfo(offer.hostname(), offer.agentId());
    }
}
