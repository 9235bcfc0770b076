/**
 * Instance and task model with the instance status aggregation rules.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.scheduler.core.instance.InstanceStatus} - Lifecycle status (enum)</li>
 *   <li>{@link com.ryuqq.scheduler.core.instance.InstanceState} - Authoritative instance state</li>
 *   <li>{@link com.ryuqq.scheduler.core.instance.Instance} - Instance owning one or more tasks</li>
 *   <li>{@link com.ryuqq.scheduler.core.instance.InstanceStatusAggregator} - Pure status aggregation</li>
 * </ul>
 *
 * <h2>Severity Order</h2>
 * <pre>
 * ERROR > FAILED > GONE > DROPPED > UNREACHABLE > KILLING > KILLED > STAGING > STARTING > RUNNING > CREATED
 *
 * FINISHED is excluded: an instance is FINISHED only when all of its tasks are.
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.scheduler.core.instance;
