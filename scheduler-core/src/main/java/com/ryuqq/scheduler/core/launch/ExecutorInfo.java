package com.ryuqq.scheduler.core.launch;

import com.ryuqq.scheduler.core.offer.Resource;

import java.util.List;

/**
 * Pod Task 그룹을 실행하는 executor 명세.
 *
 * @param executorId 클러스터 매니저 executor ID
 * @param resources executor 자체가 사용하는 리소스
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ExecutorInfo(
    String executorId,
    List<Resource> resources
) {

    public ExecutorInfo {
        if (executorId == null || executorId.isBlank()) {
            throw new IllegalArgumentException("executorId cannot be null or blank");
        }
        resources = resources == null ? List.of() : List.copyOf(resources);
    }
}
