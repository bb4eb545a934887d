package com.ryuqq.timeguard.adapter.runner;

import com.ryuqq.timeguard.application.coordinator.Coordinator;
import com.ryuqq.timeguard.testkit.contract.AbstractCoordinatorContractTest;
import com.ryuqq.timeguard.testkit.work.ScriptedWork;

/**
 * InlineCoordinator 계약 테스트.
 *
 * @author Timeguard Team
 * @since 1.0.0
 */
class InlineCoordinatorContractTest extends AbstractCoordinatorContractTest {

    @Override
    protected Coordinator createCoordinator() {
        return new InlineCoordinator(new ScriptedWork());
    }
}
