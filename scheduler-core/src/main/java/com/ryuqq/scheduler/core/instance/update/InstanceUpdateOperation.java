package com.ryuqq.scheduler.core.instance.update;

import com.ryuqq.scheduler.core.instance.Instance;
import com.ryuqq.scheduler.core.instance.InstanceId;

/**
 * 권위 있는 상태 저장소에 반영할 인스턴스 전이.
 *
 * <p>Task Operation이 클러스터 매니저에 수락되면, 이 값이 저장소로 전달되어
 * 인스턴스 상태를 갱신합니다.</p>
 *
 * <ul>
 *   <li>{@link LaunchEphemeral}: 예약 없이 새 인스턴스 실행</li>
 *   <li>{@link LaunchOnReservation}: 이전 라운드에서 예약한 리소스 위에서 실행</li>
 *   <li>{@link Reserve}: 리소스 예약 및 볼륨 생성 (실행은 다음 단계)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface InstanceUpdateOperation permits LaunchEphemeral, LaunchOnReservation, Reserve {

    /**
     * 전이 후 인스턴스.
     *
     * @return 새 Instance
     */
    Instance instance();

    default InstanceId instanceId() {
        return instance().instanceId();
    }
}
