package com.ryuqq.scheduler.core.operation;

import com.ryuqq.scheduler.core.instance.Instance;
import com.ryuqq.scheduler.core.instance.TaskId;
import com.ryuqq.scheduler.core.instance.update.InstanceUpdateOperation;
import com.ryuqq.scheduler.core.instance.update.Reserve;
import com.ryuqq.scheduler.core.launch.ExecutorInfo;
import com.ryuqq.scheduler.core.launch.TaskGroupInfo;
import com.ryuqq.scheduler.core.launch.TaskInfo;
import com.ryuqq.scheduler.core.offer.Offer;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Pod 인스턴스의 모든 컨테이너를 하나의 연산으로 원자적으로 실행하는 작업.
 *
 * <p><strong>전제 조건:</strong></p>
 * <ul>
 *   <li>executor ID는 인스턴스 ID에서 유도한 {@code executorIdString()}과 같아야 함</li>
 *   <li>그룹의 모든 Task는 새 인스턴스의 Task여야 함</li>
 * </ul>
 *
 * <p>{@link #taskId()}는 그룹의 첫 번째 Task ID를 반환합니다.</p>
 *
 * @param executorInfo executor 명세
 * @param taskGroup Task 묶음
 * @param newState 수락 시 반영할 전이
 * @param oldInstance 이전 인스턴스 (null 허용)
 * @param lowLevelOperations 제출할 저수준 연산
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record LaunchTaskGroup(
    ExecutorInfo executorInfo,
    TaskGroupInfo taskGroup,
    InstanceUpdateOperation newState,
    Instance oldInstance,
    List<OfferOperation> lowLevelOperations
) implements TaskOp {

    public LaunchTaskGroup {
        if (executorInfo == null) {
            throw new IllegalArgumentException("executorInfo cannot be null");
        }
        if (taskGroup == null) {
            throw new IllegalArgumentException("taskGroup cannot be null");
        }
        if (newState == null) {
            throw new IllegalArgumentException("newState cannot be null");
        }
        if (newState instanceof Reserve) {
            throw new IllegalArgumentException("LaunchTaskGroup cannot carry a Reserve transition");
        }

        String expectedExecutorId = newState.instanceId().executorIdString();
        if (!expectedExecutorId.equals(executorInfo.executorId())) {
            throw new IllegalStateException(String.format(
                "pod instance id and cluster manager executor id must be equal (expected: %s, actual: %s)",
                expectedExecutorId, executorInfo.executorId()));
        }

        Map<String, TaskId> instanceTasks = taskIdsByIdString(newState.instance());
        for (TaskInfo taskInfo : taskGroup.tasks()) {
            if (!instanceTasks.containsKey(taskInfo.taskId())) {
                throw new IllegalStateException(
                    "task group member " + taskInfo.taskId() + " is not a task of " + newState.instanceId());
            }
        }

        lowLevelOperations = lowLevelOperations == null || lowLevelOperations.isEmpty()
            ? List.of(new LaunchGroupOperation(executorInfo, taskGroup))
            : List.copyOf(lowLevelOperations);
    }

    @Override
    public TaskId taskId() {
        String firstTaskId = taskGroup.tasks().get(0).taskId();
        return taskIdsByIdString(newState.instance()).get(firstTaskId);
    }

    @Override
    public Optional<Instance> oldState() {
        return Optional.ofNullable(oldInstance);
    }

    @Override
    public Offer applyToOffer(Offer offer) {
        return offer
            .consume(executorInfo.resources())
            .consume(taskGroup.resources());
    }

    private static Map<String, TaskId> taskIdsByIdString(Instance instance) {
        return instance.tasks().keySet().stream()
            .collect(Collectors.toMap(TaskId::idString, Function.identity()));
    }
}
