package com.ryuqq.scheduler.application.launcher;

import java.util.Optional;

/**
 * 예약 태깅에 사용하는 프레임워크 신원 설정 (불변 record).
 *
 * <p>principal과 role은 모두 선택 사항입니다. 임시(ephemeral) 실행만 하는 스케줄러는
 * 둘 다 없이 동작할 수 있지만, 리소스 예약과 볼륨 생성에는 둘 다 필요합니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>principal: 예약 소유자로 기록되는 인증 주체 (기본 없음)</li>
 *   <li>role: 예약 리소스에 부여할 역할 (기본 없음)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param principal 인증 주체 (null 허용, 빈 문자열 불가)
 * @param role 예약 역할 (null 허용, 빈 문자열 불가)
 */
public record FrameworkIdentity(
    String principal,
    String role
) {

    /**
     * 기본 설정 생성자 (principal, role 모두 없음).
     */
    public FrameworkIdentity() {
        this(null, null);
    }

    public FrameworkIdentity {
        if (principal != null && principal.isBlank()) {
            throw new IllegalArgumentException("principal cannot be blank");
        }
        if (role != null && role.isBlank()) {
            throw new IllegalArgumentException("role cannot be blank");
        }
    }

    public Optional<String> principalOpt() {
        return Optional.ofNullable(principal);
    }

    public Optional<String> roleOpt() {
        return Optional.ofNullable(role);
    }

    /**
     * principal만 변경한 새 인스턴스 생성.
     */
    public FrameworkIdentity withPrincipal(String principal) {
        return new FrameworkIdentity(principal, role);
    }

    /**
     * role만 변경한 새 인스턴스 생성.
     */
    public FrameworkIdentity withRole(String role) {
        return new FrameworkIdentity(principal, role);
    }
}
