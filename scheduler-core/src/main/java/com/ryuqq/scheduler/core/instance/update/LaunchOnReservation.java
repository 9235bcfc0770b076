package com.ryuqq.scheduler.core.instance.update;

import com.ryuqq.scheduler.core.instance.Instance;
import com.ryuqq.scheduler.core.instance.Task;

/**
 * 예약된 리소스 위에서 인스턴스를 실행하는 전이.
 *
 * @param instance 전이 후 인스턴스
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record LaunchOnReservation(Instance instance) implements InstanceUpdateOperation {

    public LaunchOnReservation {
        if (instance == null) {
            throw new IllegalArgumentException("instance cannot be null");
        }
        if (!instance.tasks().values().stream().allMatch(Task::isReserved)) {
            throw new IllegalArgumentException("LaunchOnReservation requires reserved tasks (instance: " + instance.instanceId() + ")");
        }
    }
}
