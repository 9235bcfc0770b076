/**
 * Offer matcher protocol.
 *
 * <p>A matcher receives an offer and a deadline, asynchronously returns the task operations it
 * wants to run on that offer, and later learns through {@link com.ryuqq.scheduler.core.matcher.TaskOpSource}
 * whether each operation was submitted.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.scheduler.core.matcher;
