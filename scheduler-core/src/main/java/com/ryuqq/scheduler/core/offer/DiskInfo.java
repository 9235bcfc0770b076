package com.ryuqq.scheduler.core.offer;

/**
 * 디스크 리소스의 부가 정보.
 *
 * <p>persistenceId가 있으면 영구 볼륨(persistent volume)으로 생성된 디스크입니다.</p>
 *
 * @param persistenceId 영구 볼륨 ID (null 허용)
 * @param containerPath 컨테이너 내 마운트 경로 (null 허용)
 * @param source 디스크 출처 (null이면 ROOT)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DiskInfo(
    String persistenceId,
    String containerPath,
    DiskSource source
) {

    public DiskInfo {
        if (source == null) {
            source = DiskSource.ROOT;
        }
    }

    public static DiskInfo of(DiskSource source) {
        return new DiskInfo(null, null, source);
    }

    public boolean isPersistent() {
        return persistenceId != null;
    }
}
