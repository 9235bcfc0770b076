package com.ryuqq.scheduler.application.matcher;

import com.ryuqq.scheduler.core.offer.Offer;
import com.ryuqq.scheduler.core.offer.Resource;
import com.ryuqq.scheduler.core.offer.ResourceType;

import java.time.Instant;
import java.util.List;

/**
 * 실행 대기 중인 워크로드 요청.
 *
 * @param runSpecId 워크로드 정의 경로
 * @param name Task 이름
 * @param resources 필요한 미예약 스칼라 리소스
 * @param runSpecVersion 실행할 워크로드 정의 버전
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PendingLaunch(
    String runSpecId,
    String name,
    List<Resource> resources,
    Instant runSpecVersion
) {

    public PendingLaunch {
        if (runSpecId == null || runSpecId.isBlank()) {
            throw new IllegalArgumentException("runSpecId cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (runSpecVersion == null) {
            throw new IllegalArgumentException("runSpecVersion cannot be null");
        }
        resources = resources == null ? List.of() : List.copyOf(resources);
        for (Resource resource : resources) {
            if (resource.type() != ResourceType.SCALAR || resource.isReserved()) {
                throw new IllegalArgumentException("Only unreserved scalar resources can be requested: " + resource);
            }
        }
    }

    /**
     * Offer의 리소스로 요청을 충족할 수 있는지 확인.
     *
     * <p>요청 리소스와 같은 역할의 항목만 셉니다. 다른 역할의 리소스는 실행 시 차감되지 않으므로
     * 충족 여부에 포함하지 않습니다.</p>
     *
     * @param offer 검사할 Offer
     * @return 모든 스칼라 요구량이 매칭되는 Offer 리소스 합계 이하이면 true
     */
    public boolean fits(Offer offer) {
        return resources.stream()
            .allMatch(resource -> offer.matchingScalarSum(resource) >= resource.scalar());
    }
}
