package com.ryuqq.scheduler.core.matcher;

import com.ryuqq.scheduler.core.offer.Offer;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Offer를 대기 중인 실행 요청과 매칭하는 스케줄링 전략.
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>Offer 하나에 대해 한 번만 호출되며, 결정이 끝나는 즉시 Future를 완료합니다 (deadline까지 붙잡지 않음)</li>
 *   <li>호출 스레드를 블로킹하지 않습니다. 내부적으로 다른 서브시스템을 기다릴 수 있습니다</li>
 *   <li>deadline은 호출자가 강제합니다. 완료되지 않는 Future는 작업 없는 매칭으로 취급됩니다</li>
 *   <li>반환한 작업마다 정확히 한 번 {@link TaskOpSource} 콜백을 받습니다</li>
 *   <li>매칭 실패는 빈 {@link MatchedTaskOps}로 표현합니다</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Instant deadline = clock.instant().plusMillis(1000);
 * matcher.matchOffer(deadline, offer)
 *     .orTimeout(1000, TimeUnit.MILLISECONDS)
 *     .thenAccept(matched -&gt; submit(offer, matched));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface OfferMatcher {

    /**
     * Offer를 처리하고 이 Matcher가 실행하려는 작업을 반환.
     *
     * @param deadline 매칭을 끝내야 하는 시각
     * @param offer 평가할 Offer
     * @return 매칭 결과 Future
     */
    CompletableFuture<MatchedTaskOps> matchOffer(Instant deadline, Offer offer);
}
