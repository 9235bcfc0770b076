package com.ryuqq.scheduler.core.offer;

/**
 * 클러스터 매니저가 발급한 Offer 식별자.
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong> null 또는 빈 문자열 불가</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OfferId {

    private final String value;

    private OfferId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("OfferId cannot be null or blank");
        }
        this.value = value;
    }

    /**
     * OfferId 생성.
     *
     * @param value OfferId 값
     * @return OfferId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static OfferId of(String value) {
        return new OfferId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OfferId offerId = (OfferId) o;
        return value.equals(offerId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "OfferId{" + value + '}';
    }
}
