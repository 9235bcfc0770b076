package com.ryuqq.scheduler.core.offer;

import java.util.Map;

/**
 * 예약(reserve)된 리소스에 붙는 예약 정보.
 *
 * <p>labels에는 예약을 만든 프레임워크와 인스턴스를 식별하는 값이 들어갑니다.
 * 같은 리소스라도 예약 정보가 다르면 소비 시 서로 다른 리소스로 취급됩니다.</p>
 *
 * @param principal 예약 주체 (principal)
 * @param labels 예약 레이블 (불변 복사본)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Reservation(
    String principal,
    Map<String, String> labels
) {

    public static final String FRAMEWORK_ID_LABEL = "framework_id";
    public static final String INSTANCE_ID_LABEL = "instance_id";

    public Reservation {
        if (principal == null || principal.isBlank()) {
            throw new IllegalArgumentException("principal cannot be null or blank");
        }
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }
}
