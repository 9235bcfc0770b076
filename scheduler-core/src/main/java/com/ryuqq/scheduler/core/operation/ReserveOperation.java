package com.ryuqq.scheduler.core.operation;

import com.ryuqq.scheduler.core.offer.Resource;

import java.util.List;

/**
 * 리소스 예약 연산.
 *
 * @param resources 예약 정보가 붙은 리소스 (1개 이상)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ReserveOperation(List<Resource> resources) implements OfferOperation {

    public ReserveOperation {
        if (resources == null || resources.isEmpty()) {
            throw new IllegalArgumentException("resources cannot be null or empty");
        }
        for (Resource resource : resources) {
            if (!resource.isReserved()) {
                throw new IllegalArgumentException("Resource to reserve has no reservation: " + resource);
            }
        }
        resources = List.copyOf(resources);
    }
}
