/**
 * Application Layer - Registration orchestration contract.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registration.application.orchestrator.RegistrationOrchestrator} - submit / cancel / observe a run</li>
 *   <li>{@link com.ryuqq.registration.application.orchestrator.RegistrationCallback} - one-shot completion callback</li>
 * </ul>
 *
 * <h2>Architecture Position</h2>
 * <pre>
 * adapter-runner (DefaultRegistrationOrchestrator)
 *   ↓ implements
 * application (RegistrationOrchestrator)
 *   ↓ depends on
 * core (RegistrationRequest, RegistrationResult, RunState, spi)
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.registration.application.orchestrator;
