package com.ryuqq.scheduler.core.operation;

import com.ryuqq.scheduler.core.offer.Resource;

import java.util.List;

/**
 * 로컬 영구 볼륨 생성 연산 (볼륨 1개당 1개).
 *
 * @param volume persistence ID가 있는 예약된 disk 리소스
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CreateVolumeOperation(Resource volume) implements OfferOperation {

    public CreateVolumeOperation {
        if (volume == null) {
            throw new IllegalArgumentException("volume cannot be null");
        }
        if (volume.disk() == null || !volume.disk().isPersistent()) {
            throw new IllegalArgumentException("volume must carry a persistence id: " + volume);
        }
    }

    @Override
    public List<Resource> resources() {
        return List.of(volume);
    }
}
