/**
 * Service Provider Interfaces for the cluster manager and the authoritative state store.
 *
 * <h2>Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.scheduler.core.spi.SchedulerDriver} - Accept/decline offers</li>
 *   <li>{@link com.ryuqq.scheduler.core.spi.InstanceStore} - Persist instance transitions</li>
 * </ul>
 *
 * <p>Reference implementations live in the {@code scheduler-adapter-inmemory} module.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.scheduler.core.spi;
