package com.ryuqq.scheduler.core.spi;

import com.ryuqq.scheduler.core.instance.Instance;
import com.ryuqq.scheduler.core.instance.InstanceId;
import com.ryuqq.scheduler.core.instance.TaskId;
import com.ryuqq.scheduler.core.instance.update.InstanceUpdateOperation;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Authoritative State Store SPI for instances.
 *
 * <p>This interface is the only writer-facing boundary for instance state. Matched
 * task operations are persisted through {@link #process(InstanceUpdateOperation)} before
 * they are submitted, and status changes are folded in through
 * {@link #update(InstanceId, UnaryOperator)}.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods may be called concurrently</li>
 *   <li>Last write wins per instance id</li>
 *   <li>Encoding and schema are the implementation's concern</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface InstanceStore {

    /**
     * Retrieves an instance by id.
     *
     * @param instanceId the instance id
     * @return the instance, or empty if unknown
     * @throws IllegalArgumentException if instanceId is null
     */
    Optional<Instance> get(InstanceId instanceId);

    /**
     * Retrieves the instance owning the given task.
     *
     * @param taskId the task id
     * @return the owning instance, or empty if unknown
     * @throws IllegalArgumentException if taskId is null
     */
    Optional<Instance> findByTaskId(TaskId taskId);

    /**
     * Stores (inserts or replaces) an instance.
     *
     * @param instance the instance to persist
     * @throws IllegalArgumentException if instance is null
     */
    void store(Instance instance);

    /**
     * Applies the state transition of an accepted task operation.
     *
     * @param update the transition to persist
     * @throws IllegalArgumentException if update is null
     */
    void process(InstanceUpdateOperation update);

    /**
     * Atomically replaces a stored instance with the result of the given function.
     *
     * <p>The function receives the latest stored state and must not block. Concurrent
     * updates of the same instance are serialized, so no update is lost.</p>
     *
     * @param instanceId the instance id
     * @param updater maps the current instance to its new state
     * @return the new instance, or empty if the instance is unknown
     * @throws IllegalArgumentException if an argument is null
     */
    Optional<Instance> update(InstanceId instanceId, UnaryOperator<Instance> updater);

    /**
     * Removes an instance. Unknown ids are ignored.
     *
     * @param instanceId the instance id
     * @throws IllegalArgumentException if instanceId is null
     */
    void remove(InstanceId instanceId);
}
