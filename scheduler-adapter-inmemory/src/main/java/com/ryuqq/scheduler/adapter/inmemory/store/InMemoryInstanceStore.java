package com.ryuqq.scheduler.adapter.inmemory.store;

import com.ryuqq.scheduler.core.instance.Instance;
import com.ryuqq.scheduler.core.instance.InstanceId;
import com.ryuqq.scheduler.core.instance.TaskId;
import com.ryuqq.scheduler.core.instance.update.InstanceUpdateOperation;
import com.ryuqq.scheduler.core.spi.InstanceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * In-memory implementation of {@link InstanceStore} SPI for testing and reference purposes.
 *
 * <p>Instances are kept in a {@link ConcurrentHashMap} keyed by instance id. Task lookups
 * resolve the owning instance directly from {@link TaskId#instanceId()}.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>No history of transitions, only the latest state per instance</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryInstanceStore implements InstanceStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryInstanceStore.class);

    private final ConcurrentHashMap<InstanceId, Instance> instances = new ConcurrentHashMap<>();

    @Override
    public Optional<Instance> get(InstanceId instanceId) {
        if (instanceId == null) {
            throw new IllegalArgumentException("instanceId cannot be null");
        }
        return Optional.ofNullable(instances.get(instanceId));
    }

    @Override
    public Optional<Instance> findByTaskId(TaskId taskId) {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        return get(taskId.instanceId())
            .filter(instance -> instance.tasks().containsKey(taskId));
    }

    @Override
    public void store(Instance instance) {
        if (instance == null) {
            throw new IllegalArgumentException("instance cannot be null");
        }
        instances.put(instance.instanceId(), instance);
    }

    /**
     * {@inheritDoc}
     *
     * <p>The resulting instance of the transition replaces any stored state.</p>
     */
    @Override
    public void process(InstanceUpdateOperation update) {
        if (update == null) {
            throw new IllegalArgumentException("update cannot be null");
        }
        Instance previous = instances.put(update.instanceId(), update.instance());
        log.debug("Processed {} for {} (previous status: {})",
            update.getClass().getSimpleName(), update.instanceId(),
            previous == null ? "none" : previous.state().status());
    }

    /**
     * {@inheritDoc}
     *
     * <p>Backed by {@link ConcurrentHashMap#computeIfPresent}, which runs the updater
     * while holding the entry's lock.</p>
     */
    @Override
    public Optional<Instance> update(InstanceId instanceId, UnaryOperator<Instance> updater) {
        if (instanceId == null || updater == null) {
            throw new IllegalArgumentException("instanceId and updater cannot be null");
        }
        return Optional.ofNullable(instances.computeIfPresent(instanceId, (id, current) -> {
            Instance updated = updater.apply(current);
            if (updated == null || !updated.instanceId().equals(id)) {
                throw new IllegalStateException("Updater must return an instance with id " + id);
            }
            return updated;
        }));
    }

    @Override
    public void remove(InstanceId instanceId) {
        if (instanceId == null) {
            throw new IllegalArgumentException("instanceId cannot be null");
        }
        if (instances.remove(instanceId) != null) {
            log.debug("Removed {}", instanceId);
        }
    }

    public int size() {
        return instances.size();
    }

    /**
     * Removes all instances. Intended for test isolation.
     */
    public void clear() {
        instances.clear();
    }
}
