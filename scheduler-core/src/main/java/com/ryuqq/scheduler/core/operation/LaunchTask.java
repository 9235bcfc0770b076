package com.ryuqq.scheduler.core.operation;

import com.ryuqq.scheduler.core.instance.Instance;
import com.ryuqq.scheduler.core.instance.TaskId;
import com.ryuqq.scheduler.core.instance.update.InstanceUpdateOperation;
import com.ryuqq.scheduler.core.instance.update.Reserve;
import com.ryuqq.scheduler.core.launch.TaskInfo;
import com.ryuqq.scheduler.core.offer.Offer;

import java.util.List;
import java.util.Optional;

/**
 * 단일 Task 실행 작업.
 *
 * <p><strong>전제 조건:</strong> taskInfo의 클러스터 매니저 Task ID는 새 인스턴스 상태에
 * 포함된 Task ID와 같아야 합니다. 다르면 생성 즉시 {@link IllegalStateException}이 발생합니다.</p>
 *
 * @param taskInfo 실행할 Task 명세
 * @param newState 수락 시 반영할 전이 (LaunchEphemeral 또는 LaunchOnReservation)
 * @param oldInstance 대체되는 이전 인스턴스 (새 인스턴스인 경우 null)
 * @param lowLevelOperations 제출할 저수준 연산
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record LaunchTask(
    TaskInfo taskInfo,
    InstanceUpdateOperation newState,
    Instance oldInstance,
    List<OfferOperation> lowLevelOperations
) implements TaskOp {

    public LaunchTask {
        if (taskInfo == null) {
            throw new IllegalArgumentException("taskInfo cannot be null");
        }
        if (newState == null) {
            throw new IllegalArgumentException("newState cannot be null");
        }
        if (newState instanceof Reserve) {
            throw new IllegalArgumentException("LaunchTask cannot carry a Reserve transition");
        }
        boolean taskIdsMatch = newState.instance().tasks().keySet().stream()
            .anyMatch(taskId -> taskId.idString().equals(taskInfo.taskId()));
        if (!taskIdsMatch) {
            throw new IllegalStateException(String.format(
                "task id of the new task state and cluster manager task id must be equal (taskInfo: %s, instance: %s)",
                taskInfo.taskId(), newState.instance().tasks().keySet()));
        }
        lowLevelOperations = lowLevelOperations == null || lowLevelOperations.isEmpty()
            ? List.of(new LaunchOperation(taskInfo))
            : List.copyOf(lowLevelOperations);
    }

    /**
     * 새 인스턴스에 대한 실행 작업 생성 (기본 저수준 연산 사용).
     *
     * @param taskInfo Task 명세
     * @param newState 인스턴스 전이
     * @return LaunchTask
     */
    public static LaunchTask of(TaskInfo taskInfo, InstanceUpdateOperation newState) {
        return new LaunchTask(taskInfo, newState, null, null);
    }

    @Override
    public TaskId taskId() {
        return newState.instance().tasks().keySet().stream()
            .filter(taskId -> taskId.idString().equals(taskInfo.taskId()))
            .findFirst()
            .orElseThrow();
    }

    @Override
    public Optional<Instance> oldState() {
        return Optional.ofNullable(oldInstance);
    }

    @Override
    public Offer applyToOffer(Offer offer) {
        return offer.consume(taskInfo.resources());
    }
}
