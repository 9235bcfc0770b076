package com.ryuqq.scheduler.application.offer;

import com.ryuqq.scheduler.core.matcher.MatchedTaskOps;
import com.ryuqq.scheduler.core.offer.Offer;

/**
 * Offer 처리 포트.
 *
 * <p>한 라운드에서 Offer 하나를 매칭하고, 결과 연산을 클러스터 매니저에 제출합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>라운드 deadline 계산</li>
 *   <li>OfferMatcher 호출 및 deadline까지 대기</li>
 *   <li>연산을 Offer에 순서대로 적용하여 과다 할당 검사</li>
 *   <li>저수준 연산 배치 제출 (연산이 없으면 Offer 거절)</li>
 *   <li>제출 결과를 각 연산의 source에 정확히 한 번 통지</li>
 * </ol>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface OfferProcessor {

    /**
     * Offer 처리.
     *
     * @param offer 처리할 Offer
     * @return 매칭 결과 (resendThisOffer가 true이면 다음 라운드에 다시 제공해야 함)
     * @throws IllegalArgumentException offer가 null인 경우
     * @throws IllegalStateException 매칭된 연산이 Offer를 과다 할당하는 경우
     */
    MatchedTaskOps processOffer(Offer offer);
}
