package com.ryuqq.scheduler.core.instance;

import com.ryuqq.scheduler.core.volume.LocalVolumeId;

import java.time.Instant;
import java.util.List;

/**
 * 인스턴스에 속한 개별 Task의 권위 있는 상태.
 *
 * <p>Task는 인스턴스가 소유하며, 인스턴스가 유지되는 동안 개별적으로 교체(재시작)될 수 있습니다.
 * reservation이 있으면 리소스를 예약해 둔 Task입니다 (영구 볼륨을 가진 워크로드).</p>
 *
 * @param taskId Task ID
 * @param agentInfo 배치된 Agent
 * @param status 마지막으로 보고된 상태
 * @param runSpecVersion 워크로드 정의 버전
 * @param reservation 예약 정보 (null 허용)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Task(
    TaskId taskId,
    AgentInfo agentInfo,
    InstanceStatus status,
    Instant runSpecVersion,
    Reservation reservation
) {

    public Task {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (agentInfo == null) {
            throw new IllegalArgumentException("agentInfo cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (runSpecVersion == null) {
            throw new IllegalArgumentException("runSpecVersion cannot be null");
        }
    }

    /**
     * 예약 없이 바로 실행되는 Task 생성.
     */
    public static Task launchedEphemeral(TaskId taskId, AgentInfo agentInfo, Instant runSpecVersion) {
        return new Task(taskId, agentInfo, InstanceStatus.CREATED, runSpecVersion, null);
    }

    /**
     * 리소스와 볼륨을 예약만 해 둔 Task 생성 (아직 실행 전).
     */
    public static Task reserved(TaskId taskId, AgentInfo agentInfo, Instant runSpecVersion, List<LocalVolumeId> volumeIds) {
        return new Task(taskId, agentInfo, InstanceStatus.CREATED, runSpecVersion, new Reservation(volumeIds));
    }

    public boolean isReserved() {
        return reservation != null;
    }

    public Task withStatus(InstanceStatus status) {
        return new Task(taskId, agentInfo, status, runSpecVersion, reservation);
    }

    /**
     * 예약된 리소스 위에서 실행되는 Task로 전환.
     *
     * @param runSpecVersion 실행할 워크로드 정의 버전
     * @return 예약 정보를 유지한 채 CREATED 상태인 Task
     */
    public Task launchedOnReservation(Instant runSpecVersion) {
        return new Task(taskId, agentInfo, InstanceStatus.CREATED, runSpecVersion, reservation);
    }

    /**
     * Task가 예약해 둔 로컬 볼륨 목록.
     *
     * @param volumeIds 볼륨 ID 목록
     */
    public record Reservation(List<LocalVolumeId> volumeIds) {

        public Reservation {
            volumeIds = volumeIds == null ? List.of() : List.copyOf(volumeIds);
        }
    }
}
