/**
 * Recording scheduler driver for tests.
 */
package com.ryuqq.scheduler.adapter.inmemory.driver;
