/**
 * Port implementations for offer rounds and task status processing.
 *
 * <p>{@link com.ryuqq.scheduler.adapter.runner.DeadlineOfferProcessor} enforces the matching
 * deadline and is the single submission boundary: it checks the matched operations against the
 * offer, persists each transition, submits the low-level batch through the
 * {@link com.ryuqq.scheduler.core.spi.SchedulerDriver} and notifies every operation source
 * exactly once, including sources of operations matched after the deadline.</p>
 *
 * <p>{@link com.ryuqq.scheduler.adapter.runner.AggregatingTaskStatusProcessor} folds task
 * status events into instance state through atomic store updates.</p>
 */
package com.ryuqq.scheduler.adapter.runner;
