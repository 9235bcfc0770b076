package com.ryuqq.scheduler.core.instance;

/**
 * Task 식별자.
 *
 * <p>Task ID는 소속 인스턴스 ID와 (Pod인 경우) 컨테이너 이름으로 구성되며 전역적으로 유일합니다.
 * 단일 Task 인스턴스는 컨테이너 이름이 없습니다.</p>
 *
 * @param instanceId 소속 인스턴스 ID
 * @param containerName 컨테이너 이름 (단일 Task인 경우 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TaskId(
    InstanceId instanceId,
    String containerName
) {

    public TaskId {
        if (instanceId == null) {
            throw new IllegalArgumentException("instanceId cannot be null");
        }
        if (containerName != null && containerName.isBlank()) {
            throw new IllegalArgumentException("containerName cannot be blank");
        }
    }

    /**
     * 새 단일 Task 인스턴스를 위한 Task ID 생성.
     *
     * @param runSpecId 워크로드 정의 경로
     * @return 새 인스턴스에 속한 TaskId
     */
    public static TaskId forRunSpec(String runSpecId) {
        return new TaskId(InstanceId.forRunSpec(runSpecId), null);
    }

    public static TaskId forInstance(InstanceId instanceId) {
        return new TaskId(instanceId, null);
    }

    public static TaskId forContainer(InstanceId instanceId, String containerName) {
        if (containerName == null) {
            throw new IllegalArgumentException("containerName cannot be null");
        }
        return new TaskId(instanceId, containerName);
    }

    /**
     * 클러스터 매니저에 전달되는 Task ID 문자열.
     *
     * @return ID 문자열
     */
    public String idString() {
        return containerName == null ? instanceId.idString() : instanceId.idString() + "." + containerName;
    }

    public String runSpecId() {
        return instanceId.runSpecId();
    }

    @Override
    public String toString() {
        return "TaskId{" + idString() + '}';
    }
}
