package com.ryuqq.scheduler.core.operation;

import com.ryuqq.scheduler.core.launch.ExecutorInfo;
import com.ryuqq.scheduler.core.launch.TaskGroupInfo;
import com.ryuqq.scheduler.core.offer.Resource;

import java.util.ArrayList;
import java.util.List;

/**
 * Task 그룹(Pod) 원자적 실행 연산.
 *
 * @param executorInfo 그룹을 실행할 executor
 * @param taskGroup 실행할 Task 묶음
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record LaunchGroupOperation(
    ExecutorInfo executorInfo,
    TaskGroupInfo taskGroup
) implements OfferOperation {

    public LaunchGroupOperation {
        if (executorInfo == null) {
            throw new IllegalArgumentException("executorInfo cannot be null");
        }
        if (taskGroup == null) {
            throw new IllegalArgumentException("taskGroup cannot be null");
        }
    }

    @Override
    public List<Resource> resources() {
        List<Resource> resources = new ArrayList<>(executorInfo.resources());
        resources.addAll(taskGroup.resources());
        return List.copyOf(resources);
    }
}
