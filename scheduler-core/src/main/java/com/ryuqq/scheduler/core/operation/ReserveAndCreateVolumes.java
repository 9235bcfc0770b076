package com.ryuqq.scheduler.core.operation;

import com.ryuqq.scheduler.core.instance.Instance;
import com.ryuqq.scheduler.core.instance.TaskId;
import com.ryuqq.scheduler.core.instance.update.Reserve;
import com.ryuqq.scheduler.core.offer.Offer;
import com.ryuqq.scheduler.core.offer.Resource;

import java.util.List;
import java.util.Optional;

/**
 * Task에 필요한 모든 리소스를 예약하고 로컬 영구 볼륨을 생성하는 작업.
 *
 * <p>Task를 같은 단계에서 실행하지 않습니다. 볼륨이 먼저 존재해야 하는 워크로드를 위한
 * 2단계 배치의 첫 단계이며, 실행은 이후 라운드에서 {@link LaunchTask}로 이루어집니다.</p>
 *
 * <p><strong>저수준 연산 순서:</strong> 예약 1개 다음에 선언 순서대로 볼륨당 생성 1개.
 * 클러스터 매니저는 이를 하나의 배치로 처리하므로 순서는 로깅에만 의미가 있습니다.</p>
 *
 * <p>{@link #applyToOffer(Offer)}는 Task 리소스를 먼저 차감하고, 각 볼륨 리소스를 이어서 차감합니다.
 * 예약 전 리소스로 Offer를 돌려보내므로 같은 라운드에서 바로 실행하지는 않습니다.</p>
 *
 * <p><strong>주의:</strong> 볼륨 리소스는 역할, 예약 정보, 영구 디스크 정보를 가지므로 미예약 Offer
 * 항목과 매칭되지 않고, 볼륨 차감은 사실상 아무것도 줄이지 않습니다. 볼륨이 사용할 디스크는
 * {@code resources}에 포함되어야 Offer에서 차감됩니다.</p>
 *
 * @param newState 수락 시 반영할 예약 전이
 * @param resources 예약할 Task 리소스 (볼륨 생성용 리소스 제외, Offer 원본 형태)
 * @param lowLevelOperations ReserveOperation 1개 + CreateVolumeOperation 0개 이상
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ReserveAndCreateVolumes(
    Reserve newState,
    List<Resource> resources,
    List<OfferOperation> lowLevelOperations
) implements TaskOp {

    public ReserveAndCreateVolumes {
        if (newState == null) {
            throw new IllegalArgumentException("newState cannot be null");
        }
        if (resources == null) {
            throw new IllegalArgumentException("resources cannot be null");
        }
        if (lowLevelOperations == null || lowLevelOperations.isEmpty()) {
            throw new IllegalArgumentException("lowLevelOperations cannot be null or empty");
        }
        if (!(lowLevelOperations.get(0) instanceof ReserveOperation)) {
            throw new IllegalStateException("first operation must be a reserve operation: " + lowLevelOperations.get(0));
        }
        for (OfferOperation operation : lowLevelOperations.subList(1, lowLevelOperations.size())) {
            if (!(operation instanceof CreateVolumeOperation)) {
                throw new IllegalStateException("only create-volume operations may follow the reservation: " + operation);
            }
        }
        resources = List.copyOf(resources);
        lowLevelOperations = List.copyOf(lowLevelOperations);
    }

    @Override
    public TaskId taskId() {
        return newState.instance().firstTask().taskId();
    }

    @Override
    public Optional<Instance> oldState() {
        return Optional.empty();
    }

    /**
     * Task 리소스와 볼륨 리소스를 차례로 차감.
     *
     * <p>볼륨 리소스는 예약된 영구 디스크 형태라서 예약 전 Offer의 디스크와 매칭 키가 다릅니다.
     * 따라서 볼륨 차감 단계는 Offer를 바꾸지 않으며, 디스크는 {@code resources}로만 차감됩니다.</p>
     *
     * @param offer 대상 Offer
     * @return 차감된 Offer
     */
    @Override
    public Offer applyToOffer(Offer offer) {
        Offer withoutTaskResources = offer.consume(resources);
        Offer remaining = withoutTaskResources;
        for (CreateVolumeOperation volume : createVolumeOperations()) {
            remaining = remaining.consume(volume.resources());
        }
        return remaining;
    }

    public ReserveOperation reserveOperation() {
        return (ReserveOperation) lowLevelOperations.get(0);
    }

    public List<CreateVolumeOperation> createVolumeOperations() {
        return lowLevelOperations.stream()
            .skip(1)
            .map(CreateVolumeOperation.class::cast)
            .toList();
    }
}
