/**
 * Contract test kit for registration orchestrators.
 *
 * <p>Provides {@link com.ryuqq.registration.testkit.contract.AbstractRegistrationContractTest}
 * and {@link com.ryuqq.registration.testkit.contract.RecordingCallback} so adapters can verify
 * cleanup, cancellation, exactly-once delivery and run isolation against a real child process.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.registration.testkit.contract;
