/**
 * Inbound port for task status events reported by the cluster manager.
 *
 * <p>Each event updates one task of one instance; the instance status is then
 * recomputed with {@link com.ryuqq.scheduler.core.instance.InstanceStatusAggregator}.</p>
 */
package com.ryuqq.scheduler.application.status;
