package com.ryuqq.scheduler.core.instance;

/**
 * 인스턴스 및 Task의 생명주기 상태.
 *
 * <p>Task는 클러스터 매니저가 보고한 상태를 그대로 가지며, 인스턴스 상태는
 * {@link InstanceStatusAggregator}가 소속 Task 상태들로부터 유도합니다.</p>
 *
 * <p><strong>상태 흐름:</strong></p>
 * <pre>
 * CREATED → STAGING → STARTING → RUNNING → FINISHED
 *                                    │
 *                                    ├─► KILLING → KILLED
 *                                    ├─► FAILED / ERROR
 *                                    └─► UNREACHABLE → GONE / DROPPED
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum InstanceStatus {

    /**
     * 생성됨 (아직 클러스터 매니저에 제출 전).
     */
    CREATED,

    /**
     * Agent가 Task를 준비하는 중.
     */
    STAGING,

    /**
     * Task 프로세스 시작 중.
     */
    STARTING,

    /**
     * 실행 중.
     */
    RUNNING,

    /**
     * 종료 요청됨.
     */
    KILLING,

    /**
     * 요청에 의해 종료됨.
     */
    KILLED,

    /**
     * 정상 완료.
     */
    FINISHED,

    /**
     * 실패.
     */
    FAILED,

    /**
     * 잘못된 Task 정의 등으로 실행 불가.
     */
    ERROR,

    /**
     * Agent와 함께 사라짐.
     */
    GONE,

    /**
     * 클러스터 매니저가 Task를 알지 못함 (유실로 간주).
     */
    DROPPED,

    /**
     * Agent와 일시적으로 통신 불가.
     */
    UNREACHABLE;

    /**
     * 종료 상태인지 확인.
     *
     * @return 더 이상 실행 중이 아닌 상태이면 true
     */
    public boolean isTerminal() {
        return switch (this) {
            case KILLED, FINISHED, FAILED, ERROR, GONE, DROPPED -> true;
            case CREATED, STAGING, STARTING, RUNNING, KILLING, UNREACHABLE -> false;
        };
    }

    /**
     * Agent에서 리소스를 점유 중인 상태인지 확인.
     *
     * @return STAGING, STARTING, RUNNING, KILLING이면 true
     */
    public boolean isActive() {
        return this == STAGING || this == STARTING || this == RUNNING || this == KILLING;
    }
}
