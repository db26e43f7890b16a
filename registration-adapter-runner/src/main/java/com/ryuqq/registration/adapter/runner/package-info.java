/**
 * External engine runner adapter.
 *
 * <p>Runs the registration engine as a child process and observes it from the caller loop
 * with non-blocking fixed-interval polls.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registration.adapter.runner.DefaultRegistrationOrchestrator} - Prepare, run, collect, clean up</li>
 *   <li>{@link com.ryuqq.registration.adapter.runner.ExternalProcessRunner} - Child process with output drain and graceful/forced stop</li>
 *   <li>{@link com.ryuqq.registration.adapter.runner.CompletionWatch} - Fires once when a condition becomes true</li>
 *   <li>{@link com.ryuqq.registration.adapter.runner.WorkingDirectory} - Per-run temp directory, deleted on close</li>
 *   <li>{@link com.ryuqq.registration.adapter.runner.OutputArtifactLocator} - Picks the result transform file</li>
 *   <li>{@link com.ryuqq.registration.adapter.runner.EngineLocator} / {@link com.ryuqq.registration.adapter.runner.ConfigurationResolver} - Resolve executable and configuration</li>
 *   <li>{@link com.ryuqq.registration.adapter.runner.WorkerThreadIntensityEvaluator} - MI on a worker thread</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.registration.adapter.runner;
