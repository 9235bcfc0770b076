package com.ryuqq.scheduler.core.instance.update;

import com.ryuqq.scheduler.core.instance.Instance;
import com.ryuqq.scheduler.core.instance.Task;

/**
 * 리소스를 예약하고 로컬 볼륨을 생성하는 전이.
 *
 * @param instance 전이 후 인스턴스
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Reserve(Instance instance) implements InstanceUpdateOperation {

    public Reserve {
        if (instance == null) {
            throw new IllegalArgumentException("instance cannot be null");
        }
        if (!instance.tasks().values().stream().allMatch(Task::isReserved)) {
            throw new IllegalArgumentException("Reserve requires reserved tasks (instance: " + instance.instanceId() + ")");
        }
    }
}
