package com.ryuqq.scheduler.core.launch;

import com.ryuqq.scheduler.core.offer.AgentId;
import com.ryuqq.scheduler.core.offer.Resource;

import java.util.List;

/**
 * 클러스터 매니저에 전달되는 단일 Task 실행 명세.
 *
 * <p>taskId는 클러스터 매니저 측 Task ID 문자열입니다. 권위 있는 Task 상태의
 * {@code TaskId.idString()}과 독립적으로 만들어지므로, Operation 생성 시 둘이 같은지 교차 검증합니다.</p>
 *
 * @param taskId 클러스터 매니저 Task ID
 * @param name Task 이름
 * @param agentId 실행할 Agent
 * @param resources Task가 사용하는 리소스
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TaskInfo(
    String taskId,
    String name,
    AgentId agentId,
    List<Resource> resources
) {

    public TaskInfo {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (agentId == null) {
            throw new IllegalArgumentException("agentId cannot be null");
        }
        resources = resources == null ? List.of() : List.copyOf(resources);
    }
}
