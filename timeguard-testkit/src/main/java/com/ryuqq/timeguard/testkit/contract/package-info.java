/**
 * Coordinator contract suite.
 *
 * <p>{@link com.ryuqq.timeguard.testkit.contract.AbstractCoordinatorContractTest} is extended by the
 * test of each coordinator implementation.</p>
 */
package com.ryuqq.timeguard.testkit.contract;
