/**
 * Operation factory: turns placement decisions into task operations.
 *
 * <p>{@link com.ryuqq.scheduler.application.launcher.TaskOpFactory} builds the high-level
 * operations, {@link com.ryuqq.scheduler.application.launcher.OfferOperationFactory} the
 * low-level ones. Reservations are tagged with the configured
 * {@link com.ryuqq.scheduler.application.launcher.FrameworkIdentity}.</p>
 */
package com.ryuqq.scheduler.application.launcher;
