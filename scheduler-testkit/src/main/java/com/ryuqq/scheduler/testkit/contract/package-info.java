/**
 * Contract tests for {@link com.ryuqq.scheduler.core.matcher.OfferMatcher} implementations.
 *
 * <p>Extend {@link com.ryuqq.scheduler.testkit.contract.AbstractOfferMatcherContractTest}
 * from a test source set to verify a matcher against the matching protocol.</p>
 */
package com.ryuqq.scheduler.testkit.contract;
