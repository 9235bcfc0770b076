/**
 * Reference {@link com.ryuqq.scheduler.core.matcher.OfferMatcher} backed by a FIFO of pending launches.
 */
package com.ryuqq.scheduler.application.matcher;
