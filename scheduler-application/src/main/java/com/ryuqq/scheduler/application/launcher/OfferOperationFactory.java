package com.ryuqq.scheduler.application.launcher;

import com.ryuqq.scheduler.core.instance.InstanceId;
import com.ryuqq.scheduler.core.launch.ExecutorInfo;
import com.ryuqq.scheduler.core.launch.TaskGroupInfo;
import com.ryuqq.scheduler.core.launch.TaskInfo;
import com.ryuqq.scheduler.core.offer.DiskInfo;
import com.ryuqq.scheduler.core.offer.Reservation;
import com.ryuqq.scheduler.core.offer.Resource;
import com.ryuqq.scheduler.core.operation.CreateVolumeOperation;
import com.ryuqq.scheduler.core.operation.LaunchGroupOperation;
import com.ryuqq.scheduler.core.operation.LaunchOperation;
import com.ryuqq.scheduler.core.operation.ReserveOperation;
import com.ryuqq.scheduler.core.volume.LocalVolume;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 저수준 Offer 연산 생성기.
 *
 * <p>launch 계열 연산은 payload를 그대로 감싸고, reserve와 create-volume 연산은
 * 리소스에 프레임워크 role과 {@link Reservation}(principal + 프레임워크/인스턴스 라벨)을 부여합니다.</p>
 *
 * <p><strong>예외:</strong> 예약 연산을 만들 때 principal 또는 role이 설정되어 있지 않으면
 * 설정 오류로 보고 {@link IllegalStateException}을 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OfferOperationFactory {

    private final FrameworkIdentity identity;

    public OfferOperationFactory(FrameworkIdentity identity) {
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
        this.identity = identity;
    }

    public LaunchOperation launch(TaskInfo taskInfo) {
        return new LaunchOperation(taskInfo);
    }

    public LaunchGroupOperation launch(ExecutorInfo executorInfo, TaskGroupInfo groupInfo) {
        return new LaunchGroupOperation(executorInfo, groupInfo);
    }

    /**
     * 리소스 예약 연산 생성.
     *
     * @param frameworkId 예약하는 프레임워크
     * @param instanceId 예약 대상 인스턴스
     * @param resources 예약할 리소스 (미예약 상태)
     * @return role과 예약 정보가 부여된 리소스의 예약 연산
     * @throws IllegalStateException principal 또는 role이 설정되지 않은 경우
     */
    public ReserveOperation reserve(FrameworkId frameworkId, InstanceId instanceId, Collection<Resource> resources) {
        Reservation reservation = reservation(frameworkId, instanceId);
        String role = requireRole();
        List<Resource> reserved = resources.stream()
            .map(resource -> resource.withRole(role).withReservation(reservation))
            .toList();
        return new ReserveOperation(reserved);
    }

    /**
     * 로컬 볼륨마다 하나의 create-volume 연산 생성.
     *
     * <p>볼륨의 디스크 리소스는 예약과 같은 role/예약 정보를 가지며,
     * persistence id로 {@code LocalVolumeId#idString()}을 사용합니다.</p>
     *
     * @param frameworkId 예약하는 프레임워크
     * @param instanceId 볼륨 소유 인스턴스
     * @param localVolumes 생성할 볼륨 목록
     * @return 볼륨 순서대로의 create-volume 연산
     * @throws IllegalStateException principal 또는 role이 설정되지 않은 경우
     */
    public List<CreateVolumeOperation> createVolumes(FrameworkId frameworkId, InstanceId instanceId, Collection<LocalVolume> localVolumes) {
        Reservation reservation = reservation(frameworkId, instanceId);
        String role = requireRole();
        return localVolumes.stream()
            .map(volume -> new CreateVolumeOperation(
                Resource.scalar(Resource.DISK, volume.volume().sizeMb(), role)
                    .withReservation(reservation)
                    .withDisk(new DiskInfo(volume.id().idString(), volume.volume().containerPath(), volume.diskSource()))))
            .toList();
    }

    private Reservation reservation(FrameworkId frameworkId, InstanceId instanceId) {
        if (frameworkId == null || instanceId == null) {
            throw new IllegalArgumentException("frameworkId and instanceId cannot be null (frameworkId: " + frameworkId + ", instanceId: " + instanceId + ")");
        }
        String principal = identity.principalOpt()
            .orElseThrow(() -> new IllegalStateException("No principal configured: reservations require a framework principal"));
        return new Reservation(principal, Map.of(
            Reservation.FRAMEWORK_ID_LABEL, frameworkId.getValue(),
            Reservation.INSTANCE_ID_LABEL, instanceId.idString()
        ));
    }

    private String requireRole() {
        return identity.roleOpt()
            .orElseThrow(() -> new IllegalStateException("No role configured: reservations require a framework role"));
    }
}
