package com.ryuqq.scheduler.adapter.inmemory.store;

import com.ryuqq.scheduler.core.instance.AgentInfo;
import com.ryuqq.scheduler.core.instance.Instance;
import com.ryuqq.scheduler.core.instance.InstanceStatus;
import com.ryuqq.scheduler.core.instance.Task;
import com.ryuqq.scheduler.core.instance.TaskId;
import com.ryuqq.scheduler.core.instance.update.LaunchEphemeral;
import com.ryuqq.scheduler.core.offer.AgentId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryInstanceStore 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryInstanceStoreTest {

    private static final Instant NOW = Instant.parse("2024-01-01T10:00:00Z");
    private static final AgentInfo AGENT = new AgentInfo("host-1", AgentId.of("agent-1"));

    private InMemoryInstanceStore store;
    private Instance instance;

    @BeforeEach
    void setUp() {
        store = new InMemoryInstanceStore();
        instance = Instance.fromTask(Task.launchedEphemeral(TaskId.forRunSpec("/web"), AGENT, NOW), NOW);
    }

    @Test
    void process_StoresResultingInstance() {
        // When
        store.process(new LaunchEphemeral(instance));

        // Then
        assertThat(store.get(instance.instanceId())).contains(instance);
        assertThat(store.findByTaskId(instance.firstTask().taskId())).contains(instance);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void store_LastWriteWins() {
        // Given
        store.store(instance);
        Instance running = instance.withTaskStatus(instance.firstTask().taskId(), InstanceStatus.RUNNING, NOW.plusSeconds(1));

        // When
        store.store(running);

        // Then
        assertThat(store.get(instance.instanceId())).get()
            .extracting(stored -> stored.state().status())
            .isEqualTo(InstanceStatus.RUNNING);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void findByTaskId_UnknownTask_ReturnsEmpty() {
        // Given
        store.store(instance);

        // When & Then
        assertThat(store.findByTaskId(TaskId.forRunSpec("/web"))).isEmpty();
        assertThat(store.findByTaskId(TaskId.forContainer(instance.instanceId(), "sidecar"))).isEmpty();
    }

    @Test
    void clear_RemovesAllInstances() {
        // Given
        store.store(instance);

        // When
        store.clear();

        // Then
        assertThat(store.get(instance.instanceId())).isEmpty();
    }

    @Test
    void update_ReplacesWithUpdaterResult() {
        // Given
        store.store(instance);
        TaskId taskId = instance.firstTask().taskId();

        // When
        Optional<Instance> updated = store.update(instance.instanceId(),
            current -> current.withTaskStatus(taskId, InstanceStatus.RUNNING, NOW.plusSeconds(1)));

        // Then
        assertThat(updated).get()
            .extracting(stored -> stored.state().status())
            .isEqualTo(InstanceStatus.RUNNING);
        assertThat(store.get(instance.instanceId())).isEqualTo(updated);
    }

    @Test
    void update_UnknownInstance_ReturnsEmptyWithoutCallingUpdater() {
        // When
        Optional<Instance> updated = store.update(instance.instanceId(), current -> {
            throw new AssertionError("updater must not run");
        });

        // Then
        assertThat(updated).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    void update_UpdaterChangingInstanceId_ThrowsException() {
        // Given
        store.store(instance);
        Instance other = Instance.fromTask(Task.launchedEphemeral(TaskId.forRunSpec("/api"), AGENT, NOW), NOW);

        // When & Then
        assertThatThrownBy(() -> store.update(instance.instanceId(), current -> other))
            .isInstanceOf(IllegalStateException.class);
        assertThat(store.get(instance.instanceId())).contains(instance);
    }

    @Test
    void remove_DeletesInstance() {
        // Given
        store.store(instance);

        // When
        store.remove(instance.instanceId());
        store.remove(instance.instanceId());

        // Then
        assertThat(store.get(instance.instanceId())).isEmpty();
    }

    @Test
    void process_Null_ThrowsException() {
        assertThatThrownBy(() -> store.process(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
