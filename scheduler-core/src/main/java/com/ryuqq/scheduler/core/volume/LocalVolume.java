package com.ryuqq.scheduler.core.volume;

import com.ryuqq.scheduler.core.offer.DiskSource;

/**
 * 특정 디스크에 생성할 로컬 영구 볼륨.
 *
 * @param id 볼륨 ID
 * @param volume 볼륨 요구사항
 * @param diskSource 볼륨을 생성할 디스크 (배치 결정 시 선택됨)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record LocalVolume(
    LocalVolumeId id,
    PersistentVolume volume,
    DiskSource diskSource
) {

    public LocalVolume {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (volume == null) {
            throw new IllegalArgumentException("volume cannot be null");
        }
        if (diskSource == null) {
            diskSource = DiskSource.ROOT;
        }
    }
}
