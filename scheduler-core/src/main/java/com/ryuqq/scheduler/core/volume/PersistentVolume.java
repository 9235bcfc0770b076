package com.ryuqq.scheduler.core.volume;

/**
 * 워크로드 정의에 선언된 영구 볼륨 요구사항.
 *
 * @param containerPath 컨테이너 내 마운트 경로 (상대 경로)
 * @param sizeMb 크기 (MiB, 양수)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PersistentVolume(
    String containerPath,
    long sizeMb
) {

    public PersistentVolume {
        if (containerPath == null || containerPath.isBlank()) {
            throw new IllegalArgumentException("containerPath cannot be null or blank");
        }
        if (containerPath.startsWith("/")) {
            throw new IllegalArgumentException("containerPath must be relative (current: " + containerPath + ")");
        }
        if (sizeMb <= 0) {
            throw new IllegalArgumentException("sizeMb must be positive (current: " + sizeMb + ")");
        }
    }
}
