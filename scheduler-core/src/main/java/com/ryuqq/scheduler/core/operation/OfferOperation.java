package com.ryuqq.scheduler.core.operation;

import com.ryuqq.scheduler.core.offer.Resource;

import java.util.List;

/**
 * 클러스터 매니저에 제출되는 저수준(low-level) Offer 연산.
 *
 * <p>한 Offer에 대한 연산들은 하나의 accept-offer 배치로 원자적으로 제출됩니다.</p>
 *
 * <ul>
 *   <li>{@link LaunchOperation}: 단일 Task 실행</li>
 *   <li>{@link LaunchGroupOperation}: Task 그룹(Pod) 원자적 실행</li>
 *   <li>{@link ReserveOperation}: 리소스 예약</li>
 *   <li>{@link CreateVolumeOperation}: 예약된 디스크 위에 영구 볼륨 생성</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface OfferOperation
    permits LaunchOperation, LaunchGroupOperation, ReserveOperation, CreateVolumeOperation {

    /**
     * 이 연산이 다루는 리소스.
     *
     * @return 리소스 목록
     */
    List<Resource> resources();
}
