package com.ryuqq.scheduler.core.operation;

import com.ryuqq.scheduler.core.instance.Instance;
import com.ryuqq.scheduler.core.instance.Task;
import com.ryuqq.scheduler.core.instance.TaskId;
import com.ryuqq.scheduler.core.instance.update.InstanceUpdateOperation;
import com.ryuqq.scheduler.core.offer.Offer;

import java.util.List;
import java.util.Optional;

/**
 * 클러스터 매니저에 제출되고, 수락되면 권위 있는 상태를 바꾸는 Task 단위 작업.
 *
 * <p>TaskOp은 세 가지 변형을 가집니다:</p>
 * <ul>
 *   <li>{@link LaunchTask}: 이미 가용한 리소스 위에서 단일 Task 실행</li>
 *   <li>{@link LaunchTaskGroup}: Pod 인스턴스의 모든 컨테이너를 원자적으로 실행</li>
 *   <li>{@link ReserveAndCreateVolumes}: 리소스 예약 + 영구 볼륨 생성 (실행은 다음 라운드)</li>
 * </ul>
 *
 * <p>모든 변형은 (a) 영향받는 Task ID, (b) 이 작업 적용 후의 Offer 모습,
 * (c) 제출할 저수준 연산 목록을 제공합니다. (b)는 한 Offer에 여러 작업을 연쇄 적용할 때 사용합니다.</p>
 *
 * <p>생성 시 교차 검증(Task ID, executor ID)에 실패하면 {@link IllegalStateException}이 발생합니다.
 * 이는 호출자(Factory)의 버그이며 복구 대상이 아닙니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface TaskOp permits LaunchTask, LaunchTaskGroup, ReserveAndCreateVolumes {

    /**
     * 영향받는 Task ID.
     *
     * @return Task ID
     */
    TaskId taskId();

    /**
     * 이 작업 적용 전의 인스턴스.
     *
     * @return 이전 인스턴스 (새 인스턴스인 경우 empty)
     */
    Optional<Instance> oldState();

    /**
     * 수락 시 저장소에 반영할 인스턴스 전이.
     *
     * @return 인스턴스 전이
     */
    InstanceUpdateOperation newState();

    /**
     * 클러스터 매니저가 이 작업을 실행했을 때 Offer가 어떻게 바뀌는지 계산.
     *
     * @param offer 현재 Offer
     * @return 이 작업의 리소스가 차감된 Offer
     */
    Offer applyToOffer(Offer offer);

    /**
     * 제출할 저수준 연산 (순서 유지).
     *
     * @return 저수준 연산 목록
     */
    List<OfferOperation> lowLevelOperations();

    default Instance newInstance() {
        return newState().instance();
    }

    /**
     * 이 작업 적용 후의 Task 상태.
     *
     * @return {@link #taskId()}에 해당하는 새 Task
     */
    default Task newTask() {
        return newInstance().task(taskId())
            .orElseThrow(() -> new IllegalStateException(taskId() + " is not part of " + newInstance().instanceId()));
    }
}
