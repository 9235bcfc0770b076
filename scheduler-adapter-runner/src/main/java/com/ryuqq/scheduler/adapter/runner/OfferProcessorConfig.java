package com.ryuqq.scheduler.adapter.runner;

/**
 * DeadlineOfferProcessor 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>matchingTimeoutMs: Offer 하나의 매칭 라운드 제한 시간 (기본 1000ms)</li>
 *   <li>declineEmptyOffers: 매칭된 연산이 없는 Offer를 거절할지 여부 (기본 true)</li>
 * </ul>
 *
 * <p>매칭 제한 시간이 짧을수록 Offer가 빨리 반환되지만, 느린 매처는 resend로 끝나는 비율이 높아집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param matchingTimeoutMs 매칭 제한 시간 (밀리초, 양수여야 함)
 * @param declineEmptyOffers 빈 매칭 결과의 Offer 거절 여부
 */
public record OfferProcessorConfig(
    long matchingTimeoutMs,
    boolean declineEmptyOffers
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: matchingTimeoutMs=1000ms, declineEmptyOffers=true</p>
     */
    public OfferProcessorConfig() {
        this(1000, true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public OfferProcessorConfig {
        if (matchingTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "matchingTimeoutMs must be positive (current: " + matchingTimeoutMs + ")"
            );
        }
    }

    /**
     * matchingTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public OfferProcessorConfig withMatchingTimeoutMs(long matchingTimeoutMs) {
        return new OfferProcessorConfig(matchingTimeoutMs, declineEmptyOffers);
    }

    /**
     * declineEmptyOffers만 변경한 새 인스턴스 생성.
     */
    public OfferProcessorConfig withDeclineEmptyOffers(boolean declineEmptyOffers) {
        return new OfferProcessorConfig(matchingTimeoutMs, declineEmptyOffers);
    }
}
