package com.ryuqq.scheduler.core.instance.update;

import com.ryuqq.scheduler.core.instance.Instance;

/**
 * 예약 없이 새 인스턴스를 실행하는 전이.
 *
 * @param instance 전이 후 인스턴스
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record LaunchEphemeral(Instance instance) implements InstanceUpdateOperation {

    public LaunchEphemeral {
        if (instance == null) {
            throw new IllegalArgumentException("instance cannot be null");
        }
    }
}
