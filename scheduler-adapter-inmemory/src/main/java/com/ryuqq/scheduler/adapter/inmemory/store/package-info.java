/**
 * In-memory implementation of the instance store SPI.
 *
 * <p>Thread-safe, non-persistent; intended for tests and local development.</p>
 */
package com.ryuqq.scheduler.adapter.inmemory.store;
