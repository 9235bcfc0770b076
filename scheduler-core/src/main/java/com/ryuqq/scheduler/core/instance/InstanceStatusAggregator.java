package com.ryuqq.scheduler.core.instance;

import java.time.Instant;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static com.ryuqq.scheduler.core.instance.InstanceStatus.*;

/**
 * 소속 Task 상태들로부터 인스턴스 상태를 유도하는 순수 함수.
 *
 * <p><strong>집계 규칙:</strong></p>
 * <ol>
 *   <li>FINISHED를 제외한 상태들만 비교 대상</li>
 *   <li>비교 대상이 없으면 (모든 Task가 FINISHED) → FINISHED</li>
 *   <li>아니면 심각도 순서상 가장 앞에 있는 상태를 선택</li>
 *   <li>상태가 바뀐 경우에만 since를 now로 갱신</li>
 * </ol>
 *
 * <p><strong>심각도 순서 (가장 심각한 것부터):</strong></p>
 * <pre>
 * ERROR > FAILED > GONE > DROPPED > UNREACHABLE > KILLING > KILLED > STAGING > STARTING > RUNNING > CREATED
 * </pre>
 *
 * <p>FINISHED Task는 아직 실행 중인 형제 Task를 가리지 않아야 하므로 순서에서 제외됩니다.
 * STAGING, KILLING 같은 과도 상태는 RUNNING보다 앞서므로, 일부 Task가 안정 상태라도
 * 제어 루프가 진행 중인 작업에 반응할 수 있습니다.</p>
 *
 * <p><strong>동시성:</strong> 상태가 없으므로 어떤 스레드에서든 잠금 없이 호출 가능합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InstanceStatusAggregator {

    /**
     * 가장 심각한 상태부터 나열한 순서. FINISHED는 포함하지 않습니다.
     */
    public static final List<InstanceStatus> SEVERITY_ORDER = List.of(
        ERROR, FAILED, GONE, DROPPED, UNREACHABLE, KILLING, KILLED, STAGING, STARTING, RUNNING, CREATED
    );

    // Utility class - prevent instantiation
    private InstanceStatusAggregator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 새 인스턴스 상태 계산.
     *
     * <p>taskStatuses가 비어 있으면 previous를 그대로 반환합니다.
     * 정상 상태의 인스턴스는 항상 하나 이상의 Task를 가지므로 이 경우는 변경 없음으로 취급합니다.</p>
     *
     * <p>RUNNING이 아닌 상태로 집계되면 healthy는 지워지고, 처음 RUNNING이 되는 시점에
     * activeSince가 기록됩니다. 그 외 필드는 previous에서 그대로 이어받습니다.</p>
     *
     * @param previous 이전 인스턴스 상태 (새 인스턴스인 경우 null)
     * @param taskStatuses 소속 Task들의 현재 상태
     * @param now 현재 시각
     * @param runSpecVersion 인스턴스가 실행 중인 워크로드 정의 버전
     * @return 새 인스턴스 상태
     * @throws IllegalArgumentException 인자가 null이거나, previous 없이 빈 상태 집합이 주어진 경우
     */
    public static InstanceState aggregate(
        InstanceState previous,
        Collection<InstanceStatus> taskStatuses,
        Instant now,
        Instant runSpecVersion
    ) {
        if (taskStatuses == null) {
            throw new IllegalArgumentException("taskStatuses cannot be null");
        }
        if (now == null || runSpecVersion == null) {
            throw new IllegalArgumentException("Timestamps cannot be null (now: " + now + ", runSpecVersion: " + runSpecVersion + ")");
        }

        if (taskStatuses.isEmpty()) {
            if (previous == null) {
                throw new IllegalArgumentException("Cannot aggregate an instance without tasks and without previous state");
            }
            return previous;
        }

        InstanceStatus status = aggregateStatus(taskStatuses);

        boolean changed = previous == null || previous.status() != status;
        Instant since = changed ? now : previous.since();

        Instant activeSince = previous == null ? null : previous.activeSince();
        if (activeSince == null && status == RUNNING) {
            activeSince = now;
        }

        Boolean healthy = previous == null ? null : previous.healthy();
        if (status != RUNNING) {
            healthy = null;
        }

        return new InstanceState(status, since, activeSince, healthy, runSpecVersion);
    }

    /**
     * Task 상태 집합에서 인스턴스 상태만 계산.
     *
     * @param taskStatuses 비어 있지 않은 Task 상태 집합
     * @return 집계된 상태
     * @throws IllegalArgumentException 비어 있거나 null 원소가 있는 경우
     */
    public static InstanceStatus aggregateStatus(Collection<InstanceStatus> taskStatuses) {
        if (taskStatuses == null || taskStatuses.isEmpty()) {
            throw new IllegalArgumentException("taskStatuses cannot be null or empty");
        }
        if (taskStatuses.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("taskStatuses cannot contain null");
        }

        Set<InstanceStatus> informative = EnumSet.copyOf(taskStatuses);
        informative.remove(FINISHED);

        if (informative.isEmpty()) {
            return FINISHED;
        }

        for (InstanceStatus candidate : SEVERITY_ORDER) {
            if (informative.contains(candidate)) {
                return candidate;
            }
        }
        // SEVERITY_ORDER는 FINISHED를 제외한 모든 상태를 포함
        throw new IllegalStateException("Status not covered by severity order: " + informative);
    }
}
