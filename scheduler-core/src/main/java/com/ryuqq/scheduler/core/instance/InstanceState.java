package com.ryuqq.scheduler.core.instance;

import java.time.Instant;

/**
 * 인스턴스의 권위 있는(authoritative) 생명주기 상태.
 *
 * <p>이 값은 {@link InstanceStatusAggregator}의 출력으로만 만들어집니다.
 * 다른 컴포넌트는 갱신된 Task 상태를 전달하여 전이를 요청할 뿐 직접 수정하지 않습니다.</p>
 *
 * @param status 집계된 상태
 * @param since 마지막 상태 전이 시각
 * @param activeSince 처음 Running이 된 시각 (null 허용)
 * @param healthy 헬스 체크 결과 (null 허용, 알 수 없음)
 * @param runSpecVersion 인스턴스가 실행 중인 워크로드 정의 버전
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record InstanceState(
    InstanceStatus status,
    Instant since,
    Instant activeSince,
    Boolean healthy,
    Instant runSpecVersion
) {

    public InstanceState {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (since == null) {
            throw new IllegalArgumentException("since cannot be null");
        }
        if (runSpecVersion == null) {
            throw new IllegalArgumentException("runSpecVersion cannot be null");
        }
    }

    public InstanceState withHealthy(Boolean healthy) {
        return new InstanceState(status, since, activeSince, healthy, runSpecVersion);
    }
}
