/**
 * Task operation model.
 *
 * <p>This package defines two sealed hierarchies:</p>
 *
 * <h2>Task Operations</h2>
 * <ul>
 *   <li>{@link com.ryuqq.scheduler.core.operation.TaskOp} - Sealed interface (permits LaunchTask, LaunchTaskGroup, ReserveAndCreateVolumes)</li>
 *   <li>Each pairs a launch/reservation payload with an authoritative instance transition</li>
 * </ul>
 *
 * <h2>Low-level Offer Operations</h2>
 * <ul>
 *   <li>{@link com.ryuqq.scheduler.core.operation.OfferOperation} - Sealed interface (permits Launch, LaunchGroup, Reserve, CreateVolume)</li>
 *   <li>Submitted to the cluster manager as one atomic batch per offer</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * Offer remaining = offer;
 * for (TaskOp op : ops) {
 *     remaining = op.applyToOffer(remaining);
 *     batch.addAll(op.lowLevelOperations());
 * }
 * </pre>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Fail-Fast:</strong> Inconsistent identifiers abort construction with IllegalStateException</li>
 *   <li><strong>Exhaustiveness:</strong> Sealed types make every variant known at the submission boundary</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.scheduler.core.operation;
