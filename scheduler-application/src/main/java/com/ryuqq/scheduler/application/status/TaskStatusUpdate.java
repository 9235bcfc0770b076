package com.ryuqq.scheduler.application.status;

import com.ryuqq.scheduler.core.instance.InstanceStatus;
import com.ryuqq.scheduler.core.instance.TaskId;

import java.time.Instant;

/**
 * 클러스터 매니저가 보고한 Task 상태 변경 이벤트.
 *
 * @param taskId 대상 Task
 * @param status 새 상태
 * @param timestamp 이벤트 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TaskStatusUpdate(
    TaskId taskId,
    InstanceStatus status,
    Instant timestamp
) {

    public TaskStatusUpdate {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
    }
}
