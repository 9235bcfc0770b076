package com.ryuqq.scheduler.core.offer;

/**
 * 리소스 값의 형태.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ResourceType {

    /**
     * 스칼라 수량 (cpus, mem, disk, gpus).
     */
    SCALAR,

    /**
     * 개별 값의 집합 (ports).
     */
    SET
}
