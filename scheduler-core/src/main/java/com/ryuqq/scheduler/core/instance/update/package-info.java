/**
 * Instance state transitions carried by task operations and persisted once accepted.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.scheduler.core.instance.update;
