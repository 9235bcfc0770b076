/**
 * Cluster-manager facing launch payloads (task, executor, task group).
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.scheduler.core.launch;
