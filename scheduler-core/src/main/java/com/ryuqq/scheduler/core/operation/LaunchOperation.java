package com.ryuqq.scheduler.core.operation;

import com.ryuqq.scheduler.core.launch.TaskInfo;
import com.ryuqq.scheduler.core.offer.Resource;

import java.util.List;

/**
 * 단일 Task 실행 연산.
 *
 * @param taskInfo 실행할 Task 명세
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record LaunchOperation(TaskInfo taskInfo) implements OfferOperation {

    public LaunchOperation {
        if (taskInfo == null) {
            throw new IllegalArgumentException("taskInfo cannot be null");
        }
    }

    @Override
    public List<Resource> resources() {
        return taskInfo.resources();
    }
}
