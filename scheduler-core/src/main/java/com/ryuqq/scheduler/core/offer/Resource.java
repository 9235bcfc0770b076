package com.ryuqq.scheduler.core.offer;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Offer에 포함된 하나의 리소스 항목.
 *
 * <p>리소스는 이름(cpus, mem, disk, gpus, ports)과 역할(role), 선택적인 예약 정보 및
 * 디스크 정보를 가지며, 값은 {@link ResourceType}에 따라 스칼라 또는 집합입니다.</p>
 *
 * <p><strong>매칭 키:</strong> (name, role, reservation, disk)가 모두 같은 리소스끼리만
 * 소비(차감)가 일어납니다. 예를 들어 예약된 cpus는 예약되지 않은 cpus 요청으로 차감되지 않습니다.</p>
 *
 * <p><strong>고정 소수점:</strong> 스칼라 값은 소수점 셋째 자리로 반올림되어 저장되고,
 * 차감 결과도 같은 방식으로 반올림됩니다. 따라서 차감 순서와 무관하게 같은 결과가 나옵니다.</p>
 *
 * @param name 리소스 이름
 * @param type 값 형태
 * @param scalar 스칼라 값 (SET인 경우 0)
 * @param values 집합 값 (SCALAR인 경우 빈 집합)
 * @param role 역할 ("*"는 미예약 기본 역할)
 * @param reservation 예약 정보 (null 허용)
 * @param disk 디스크 정보 (null 허용)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Resource(
    String name,
    ResourceType type,
    double scalar,
    Set<Long> values,
    String role,
    Reservation reservation,
    DiskInfo disk
) {

    public static final String CPUS = "cpus";
    public static final String MEM = "mem";
    public static final String DISK = "disk";
    public static final String GPUS = "gpus";
    public static final String PORTS = "ports";

    public static final String DEFAULT_ROLE = "*";

    public Resource {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (role == null || role.isBlank()) {
            role = DEFAULT_ROLE;
        }
        if (type == ResourceType.SCALAR) {
            scalar = fixedPoint(scalar);
            values = Set.of();
        } else {
            scalar = 0;
            values = values == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(values));
        }
    }

    /**
     * 미예약 스칼라 리소스 생성.
     *
     * @param name 리소스 이름
     * @param value 수량
     * @return Resource
     */
    public static Resource scalar(String name, double value) {
        return new Resource(name, ResourceType.SCALAR, value, null, DEFAULT_ROLE, null, null);
    }

    public static Resource scalar(String name, double value, String role) {
        return new Resource(name, ResourceType.SCALAR, value, null, role, null, null);
    }

    /**
     * 미예약 집합 리소스 생성 (예: ports).
     *
     * @param name 리소스 이름
     * @param values 값 집합
     * @return Resource
     */
    public static Resource set(String name, Set<Long> values) {
        return new Resource(name, ResourceType.SET, 0, values, DEFAULT_ROLE, null, null);
    }

    public Resource withRole(String role) {
        return new Resource(name, type, scalar, values, role, reservation, disk);
    }

    public Resource withReservation(Reservation reservation) {
        return new Resource(name, type, scalar, values, role, reservation, disk);
    }

    public Resource withDisk(DiskInfo disk) {
        return new Resource(name, type, scalar, values, role, reservation, disk);
    }

    public Resource withScalar(double scalar) {
        return new Resource(name, type, scalar, values, role, reservation, disk);
    }

    public boolean isReserved() {
        return reservation != null;
    }

    /**
     * 같은 매칭 키를 가지는지 확인.
     *
     * @param other 비교 대상
     * @return name, role, reservation, disk가 모두 같으면 true
     */
    public boolean matches(Resource other) {
        return name.equals(other.name)
            && role.equals(other.role)
            && Objects.equals(reservation, other.reservation)
            && Objects.equals(disk, other.disk);
    }

    /**
     * 사용된 리소스만큼 차감한 새 리소스 반환.
     *
     * <p>스칼라 결과는 음수가 될 수 있습니다 (클램프하지 않음).</p>
     *
     * @param used 사용된 리소스 (매칭 키와 type이 같아야 함)
     * @return 차감된 리소스
     * @throws IllegalArgumentException 매칭되지 않거나 type이 다른 경우
     */
    public Resource minus(Resource used) {
        if (!matches(used) || type != used.type) {
            throw new IllegalArgumentException("Cannot subtract " + used + " from " + this);
        }
        if (type == ResourceType.SCALAR) {
            return withScalar(scalar - used.scalar);
        }
        Set<Long> remaining = new TreeSet<>(values);
        remaining.removeAll(used.values);
        return new Resource(name, type, 0, remaining, role, reservation, disk);
    }

    static double fixedPoint(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
