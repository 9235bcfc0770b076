package com.ryuqq.scheduler.core.offer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 리소스 목록 연산 유틸리티.
 *
 * <p><strong>consume 규칙:</strong></p>
 * <ul>
 *   <li>각 가용 리소스에서 매칭 키가 같은 모든 사용 리소스를 차례로 차감</li>
 *   <li>가용 목록에 없는 사용 리소스는 무시 (예외 없음)</li>
 *   <li>결과가 0 또는 음수여도 항목을 제거하지 않음</li>
 * </ul>
 *
 * <p>항목을 제거하지 않고 음수를 허용하기 때문에 consume은 결합법칙과 교환법칙을 만족합니다:</p>
 * <pre>
 * consume(consume(O, A), B) == consume(consume(O, B), A) == consume(O, A ∪ B)
 * </pre>
 *
 * <p>음수 잔량(과다 할당)은 이 클래스가 막지 않습니다. 제출 계층이
 * {@link #isOvercommitted(Collection)}로 검출하여 치명적 결함으로 처리합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Resources {

    private static final Logger log = LoggerFactory.getLogger(Resources.class);

    private Resources() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 가용 리소스에서 사용 리소스를 차감.
     *
     * @param available 가용 리소스 목록 (순서 유지)
     * @param used 사용 리소스 목록
     * @return 차감된 새 리소스 목록 (불변)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static List<Resource> consume(List<Resource> available, Collection<Resource> used) {
        if (available == null || used == null) {
            throw new IllegalArgumentException("Resources cannot be null (available: " + available + ", used: " + used + ")");
        }

        List<Resource> remaining = new ArrayList<>(available.size());
        for (Resource resource : available) {
            Resource current = resource;
            for (Resource usedResource : used) {
                if (!current.matches(usedResource)) {
                    continue;
                }
                if (current.type() != usedResource.type()) {
                    log.warn("Different resource types for resource {}: {} and {}",
                        current.name(), current.type(), usedResource.type());
                    continue;
                }
                current = current.minus(usedResource);
            }
            remaining.add(current);
        }
        return List.copyOf(remaining);
    }

    /**
     * 음수가 된 스칼라 리소스가 있는지 확인.
     *
     * @param resources 검사할 리소스 목록
     * @return 하나라도 0 미만이면 true
     */
    public static boolean isOvercommitted(Collection<Resource> resources) {
        return resources.stream()
            .anyMatch(resource -> resource.type() == ResourceType.SCALAR && resource.scalar() < 0);
    }

    /**
     * 요청 리소스와 매칭 키가 같은 스칼라 리소스의 합계.
     *
     * <p>{@link #consume(List, Collection)}가 실제로 차감할 수 있는 양입니다. 역할이나 예약이
     * 다른 항목은 포함하지 않습니다.</p>
     *
     * @param resources 리소스 목록
     * @param requested 요청 리소스
     * @return 합계 (없으면 0)
     */
    public static double matchingScalarSum(Collection<Resource> resources, Resource requested) {
        double sum = resources.stream()
            .filter(resource -> resource.type() == ResourceType.SCALAR && resource.matches(requested))
            .mapToDouble(Resource::scalar)
            .sum();
        return Resource.fixedPoint(sum);
    }

    /**
     * 이름이 같은 미예약 스칼라 리소스의 합계 (역할 무관).
     *
     * @param resources 리소스 목록
     * @param name 리소스 이름
     * @return 합계 (없으면 0)
     */
    public static double scalarSum(Collection<Resource> resources, String name) {
        double sum = resources.stream()
            .filter(resource -> resource.type() == ResourceType.SCALAR)
            .filter(resource -> resource.name().equals(name) && !resource.isReserved())
            .mapToDouble(Resource::scalar)
            .sum();
        return Resource.fixedPoint(sum);
    }
}
