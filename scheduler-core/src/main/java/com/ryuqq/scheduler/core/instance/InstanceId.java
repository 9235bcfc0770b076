package com.ryuqq.scheduler.core.instance;

import java.util.UUID;

/**
 * 인스턴스 식별자.
 *
 * <p>하나의 인스턴스는 하나 이상의 Task(예: Pod 컨테이너)를 묶는 논리 단위입니다.
 * 인스턴스 ID는 워크로드 정의(run spec) 경로와 UUID로 구성됩니다.</p>
 *
 * <p>Pod 인스턴스를 실행하는 executor의 ID는 {@link #executorIdString()}으로 유도되며,
 * 클러스터 매니저에 전달되는 executor ID와 반드시 같아야 합니다.</p>
 *
 * @param runSpecId 워크로드 정의 경로 (예: /prod/web)
 * @param uuid 인스턴스 고유 값
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record InstanceId(
    String runSpecId,
    String uuid
) {

    private static final String EXECUTOR_PREFIX = "instance-";

    public InstanceId {
        if (runSpecId == null || runSpecId.isBlank()) {
            throw new IllegalArgumentException("runSpecId cannot be null or blank");
        }
        if (uuid == null || uuid.isBlank()) {
            throw new IllegalArgumentException("uuid cannot be null or blank");
        }
    }

    /**
     * 워크로드 정의에 대한 새 인스턴스 ID 생성.
     *
     * @param runSpecId 워크로드 정의 경로
     * @return 새 InstanceId
     */
    public static InstanceId forRunSpec(String runSpecId) {
        return new InstanceId(runSpecId, UUID.randomUUID().toString());
    }

    /**
     * 문자열 표현 (예: prod_web.8f2c...).
     *
     * @return ID 문자열
     */
    public String idString() {
        return safeRunSpecId() + "." + uuid;
    }

    public String executorIdString() {
        return EXECUTOR_PREFIX + idString();
    }

    private String safeRunSpecId() {
        String trimmed = runSpecId.startsWith("/") ? runSpecId.substring(1) : runSpecId;
        return trimmed.replace('/', '_');
    }

    @Override
    public String toString() {
        return "InstanceId{" + idString() + '}';
    }
}
