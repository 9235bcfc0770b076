package com.ryuqq.scheduler.core.instance;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 하나 이상의 Task로 구성된 논리 워크로드 단위.
 *
 * <p>인스턴스 상태({@link InstanceState})는 항상 소속 Task 상태들을
 * {@link InstanceStatusAggregator}로 집계한 결과입니다. Task 상태를 바꾸는 메서드는
 * 새 Instance를 반환하며 상태를 함께 재계산합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>Task는 1개 이상</li>
 *   <li>모든 Task의 instanceId는 이 인스턴스의 ID와 같음</li>
 * </ul>
 *
 * @param instanceId 인스턴스 ID
 * @param agentInfo 배치된 Agent
 * @param state 집계된 인스턴스 상태
 * @param tasks Task 목록 (삽입 순서 유지, 불변)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Instance(
    InstanceId instanceId,
    AgentInfo agentInfo,
    InstanceState state,
    Map<TaskId, Task> tasks
) {

    public Instance {
        if (instanceId == null) {
            throw new IllegalArgumentException("instanceId cannot be null");
        }
        if (agentInfo == null) {
            throw new IllegalArgumentException("agentInfo cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (tasks == null || tasks.isEmpty()) {
            throw new IllegalArgumentException("tasks cannot be null or empty");
        }
        for (TaskId taskId : tasks.keySet()) {
            if (!instanceId.equals(taskId.instanceId())) {
                throw new IllegalArgumentException(taskId + " does not belong to " + instanceId);
            }
        }
        tasks = Collections.unmodifiableMap(new LinkedHashMap<>(tasks));
    }

    /**
     * 새 Task 하나로 구성된 인스턴스를 유도.
     *
     * @param task 새 Task
     * @param now 현재 시각
     * @return 새 Instance
     */
    public static Instance fromTask(Task task, Instant now) {
        return of(task.taskId().instanceId(), task.agentInfo(), List.of(task), now, task.runSpecVersion());
    }

    /**
     * Task 목록으로 새 인스턴스 생성 (상태는 집계로 계산).
     *
     * @param instanceId 인스턴스 ID
     * @param agentInfo Agent 정보
     * @param tasks Task 목록
     * @param now 현재 시각
     * @param runSpecVersion 워크로드 정의 버전
     * @return 새 Instance
     */
    public static Instance of(InstanceId instanceId, AgentInfo agentInfo, Collection<Task> tasks, Instant now, Instant runSpecVersion) {
        if (tasks == null) {
            throw new IllegalArgumentException("tasks cannot be null");
        }
        Map<TaskId, Task> taskMap = new LinkedHashMap<>();
        for (Task task : tasks) {
            taskMap.put(task.taskId(), task);
        }
        InstanceState state = InstanceStatusAggregator.aggregate(null, statusesOf(taskMap), now, runSpecVersion);
        return new Instance(instanceId, agentInfo, state, taskMap);
    }

    public Optional<Task> task(TaskId taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    /**
     * 첫 번째 Task (단일 Task 인스턴스의 Task).
     *
     * @return 첫 Task
     */
    public Task firstTask() {
        return tasks.values().iterator().next();
    }

    /**
     * Task 하나의 상태를 바꾸고 인스턴스 상태를 재계산.
     *
     * @param taskId 대상 Task
     * @param status 새 상태
     * @param now 현재 시각
     * @return 갱신된 Instance
     * @throws IllegalArgumentException taskId가 이 인스턴스에 없는 경우
     */
    public Instance withTaskStatus(TaskId taskId, InstanceStatus status, Instant now) {
        Task task = tasks.get(taskId);
        if (task == null) {
            throw new IllegalArgumentException(taskId + " is not a task of " + instanceId);
        }
        return withTask(task.withStatus(status), now);
    }

    /**
     * Task를 추가하거나 교체하고 인스턴스 상태를 재계산.
     *
     * @param task 새 Task 상태
     * @param now 현재 시각
     * @return 갱신된 Instance
     */
    public Instance withTask(Task task, Instant now) {
        Map<TaskId, Task> updated = new LinkedHashMap<>(tasks);
        updated.put(task.taskId(), task);
        InstanceState newState = InstanceStatusAggregator.aggregate(
            state, statusesOf(updated), now, state.runSpecVersion());
        return new Instance(instanceId, agentInfo, newState, updated);
    }

    public boolean isTerminal() {
        return tasks.values().stream().allMatch(task -> task.status().isTerminal());
    }

    private static List<InstanceStatus> statusesOf(Map<TaskId, Task> tasks) {
        return tasks.values().stream().map(Task::status).collect(Collectors.toList());
    }

    /**
     * Pod 인스턴스 실행 요청.
     *
     * @param instance 실행할 인스턴스 (모든 Task 포함)
     */
    public record LaunchRequest(Instance instance) {

        public LaunchRequest {
            if (instance == null) {
                throw new IllegalArgumentException("instance cannot be null");
            }
        }
    }
}
