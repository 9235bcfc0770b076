package com.ryuqq.scheduler.application.status;

import com.ryuqq.scheduler.core.instance.Instance;

import java.util.Optional;

/**
 * Task 상태 이벤트 처리 포트.
 *
 * <p>Task 상태를 소속 인스턴스에 반영하고 인스턴스 상태를 재집계하여 저장합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface TaskStatusProcessor {

    /**
     * 상태 이벤트 처리.
     *
     * @param update Task 상태 이벤트
     * @return 갱신된 인스턴스 (알 수 없는 Task이면 빈 값)
     * @throws IllegalArgumentException update가 null인 경우
     */
    Optional<Instance> process(TaskStatusUpdate update);
}
