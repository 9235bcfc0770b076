/**
 * Resource offer model.
 *
 * <p>Immutable snapshots of the resources one cluster node offers for one matching round,
 * and the pure arithmetic used to compute "offer minus consumed resources".</p>
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.scheduler.core.offer.Offer} - Offer snapshot (id, agent, resources)</li>
 *   <li>{@link com.ryuqq.scheduler.core.offer.Resource} - Scalar or set resource with role, reservation and disk info</li>
 *   <li>{@link com.ryuqq.scheduler.core.offer.Reservation} - Reservation tag (principal + labels)</li>
 *   <li>{@link com.ryuqq.scheduler.core.offer.DiskInfo} - Disk source and persistence id</li>
 * </ul>
 *
 * <h2>Consumption</h2>
 * <pre>
 * Offer remaining = offer.consume(taskInfo.resources());
 *
 * // associative and commutative
 * offer.consume(a).consume(b).equals(offer.consume(b).consume(a));
 * </pre>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> consume returns a new value, so offers are shared without locking</li>
 *   <li><strong>No clamping:</strong> overcommitment shows up as negative scalars and is detected by the submitter</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.scheduler.core.offer;
