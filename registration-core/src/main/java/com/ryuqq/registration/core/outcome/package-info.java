/**
 * Registration outcome package.
 *
 * <p>Sealed result hierarchy delivered once per run through the completion callback.</p>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registration.core.outcome.Ok} - Artifact found, transform loaded and copied into the output slot</li>
 *   <li>{@link com.ryuqq.registration.core.outcome.Fail} - Any failure, including cancellation, classified by
 *       {@link com.ryuqq.registration.core.outcome.ErrorCode}</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * orchestrator.lastResult().ifPresent(result -&gt; {
 *     if (result instanceof Fail fail &amp;&amp; fail.errorCode() == ErrorCode.MISSING_OUTPUT) {
 *         // engine exited 0 without writing a transform
 *     }
 * });
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.registration.core.outcome;
