package com.ryuqq.scheduler.application.launcher;

/**
 * 클러스터 매니저에 등록된 스케줄러 프레임워크 식별자.
 *
 * <p>예약 리소스의 라벨에 기록되어, 어떤 프레임워크가 예약했는지 식별하는 데 사용됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FrameworkId {

    private final String value;

    private FrameworkId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("FrameworkId cannot be null or blank");
        }
        this.value = value;
    }

    public static FrameworkId of(String value) {
        return new FrameworkId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FrameworkId that = (FrameworkId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "FrameworkId{" + value + '}';
    }
}
