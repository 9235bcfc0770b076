package com.ryuqq.scheduler.core.volume;

import java.util.UUID;

/**
 * Agent 로컬 영구 볼륨 식별자.
 *
 * <p>볼륨 ID 문자열은 클러스터 매니저의 persistence ID로 사용됩니다.</p>
 *
 * @param runSpecId 워크로드 정의 경로
 * @param containerPath 컨테이너 내 마운트 경로
 * @param uuid 고유 값
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record LocalVolumeId(
    String runSpecId,
    String containerPath,
    String uuid
) {

    private static final String DELIMITER = "#";

    public LocalVolumeId {
        if (runSpecId == null || runSpecId.isBlank()) {
            throw new IllegalArgumentException("runSpecId cannot be null or blank");
        }
        if (containerPath == null || containerPath.isBlank()) {
            throw new IllegalArgumentException("containerPath cannot be null or blank");
        }
        if (uuid == null || uuid.isBlank()) {
            throw new IllegalArgumentException("uuid cannot be null or blank");
        }
    }

    public static LocalVolumeId forVolume(String runSpecId, PersistentVolume volume) {
        return new LocalVolumeId(runSpecId, volume.containerPath(), UUID.randomUUID().toString());
    }

    public String idString() {
        String safeRunSpecId = (runSpecId.startsWith("/") ? runSpecId.substring(1) : runSpecId).replace('/', '_');
        return safeRunSpecId + DELIMITER + containerPath + DELIMITER + uuid;
    }
}
