/**
 * Test fixtures shared across modules.
 */
package com.ryuqq.scheduler.testkit.fixture;
