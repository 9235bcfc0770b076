package com.ryuqq.scheduler.application.launcher;

import com.ryuqq.scheduler.core.instance.InstanceId;
import com.ryuqq.scheduler.core.offer.DiskSource;
import com.ryuqq.scheduler.core.offer.Reservation;
import com.ryuqq.scheduler.core.offer.Resource;
import com.ryuqq.scheduler.core.operation.CreateVolumeOperation;
import com.ryuqq.scheduler.core.operation.ReserveOperation;
import com.ryuqq.scheduler.core.volume.LocalVolume;
import com.ryuqq.scheduler.core.volume.LocalVolumeId;
import com.ryuqq.scheduler.core.volume.PersistentVolume;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * OfferOperationFactory 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class OfferOperationFactoryTest {

    private static final FrameworkId FRAMEWORK_ID = FrameworkId.of("framework-1");

    private final InstanceId instanceId = new InstanceId("/prod/db", "1234");
    private final OfferOperationFactory factory = new OfferOperationFactory(new FrameworkIdentity("scheduler", "db"));

    @Test
    void reserve_TagsResourcesWithRoleAndReservationLabels() {
        // Given
        List<Resource> resources = List.of(Resource.scalar(Resource.CPUS, 1.0), Resource.scalar(Resource.MEM, 256.0));

        // When
        ReserveOperation operation = factory.reserve(FRAMEWORK_ID, instanceId, resources);

        // Then
        assertThat(operation.resources()).hasSize(2).allSatisfy(resource -> {
            assertThat(resource.role()).isEqualTo("db");
            assertThat(resource.reservation().principal()).isEqualTo("scheduler");
            assertThat(resource.reservation().labels())
                .containsEntry(Reservation.FRAMEWORK_ID_LABEL, "framework-1")
                .containsEntry(Reservation.INSTANCE_ID_LABEL, "prod_db.1234");
        });
        assertThat(operation.resources().get(1).scalar()).isEqualTo(256.0);
    }

    @Test
    void createVolumes_OneOperationPerVolume() {
        // Given
        LocalVolume data = new LocalVolume(
            new LocalVolumeId("/prod/db", "data", "v1"), new PersistentVolume("data", 512), null);
        LocalVolume logs = new LocalVolume(
            new LocalVolumeId("/prod/db", "logs", "v2"), new PersistentVolume("logs", 64), DiskSource.mount("/mnt/disk1"));

        // When
        List<CreateVolumeOperation> operations = factory.createVolumes(FRAMEWORK_ID, instanceId, List.of(data, logs));

        // Then
        assertThat(operations).hasSize(2);
        Resource first = operations.get(0).volume();
        assertThat(first.name()).isEqualTo(Resource.DISK);
        assertThat(first.scalar()).isEqualTo(512.0);
        assertThat(first.role()).isEqualTo("db");
        assertThat(first.disk().persistenceId()).isEqualTo("prod_db#data#v1");
        assertThat(first.disk().containerPath()).isEqualTo("data");
        assertThat(first.disk().source()).isEqualTo(DiskSource.ROOT);
        assertThat(operations.get(1).volume().disk().source()).isEqualTo(DiskSource.mount("/mnt/disk1"));
    }

    @Test
    void reserve_WithoutPrincipal_ThrowsIllegalStateException() {
        // Given
        OfferOperationFactory noPrincipal = new OfferOperationFactory(new FrameworkIdentity().withRole("db"));

        // When & Then
        assertThatThrownBy(() -> noPrincipal.reserve(FRAMEWORK_ID, instanceId, List.of(Resource.scalar(Resource.CPUS, 1.0))))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("principal");
    }

    @Test
    void createVolumes_WithoutRole_ThrowsIllegalStateException() {
        // Given
        OfferOperationFactory noRole = new OfferOperationFactory(new FrameworkIdentity().withPrincipal("scheduler"));

        // When & Then
        assertThatThrownBy(() -> noRole.createVolumes(FRAMEWORK_ID, instanceId, List.of()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("role");
    }

    @Test
    void frameworkIdentity_BlankRole_ThrowsException() {
        assertThatThrownBy(() -> new FrameworkIdentity("scheduler", " "))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
