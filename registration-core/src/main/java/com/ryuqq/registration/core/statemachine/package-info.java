/**
 * Registration run state machine package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registration.core.statemachine.RunState} - Run lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.registration.core.statemachine.RunStateTransition} - Transition validation</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * IDLE → PREPARING (submit)
 * PREPARING → RUNNING (engine started) | FAILED (validation, configuration, export)
 * RUNNING → COMPLETED | FAILED | CANCELLED
 * COMPLETED | FAILED | CANCELLED → IDLE (after cleanup, before the callback)
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.registration.core.statemachine;
