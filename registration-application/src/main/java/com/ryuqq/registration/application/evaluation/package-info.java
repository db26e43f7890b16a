/**
 * Application Layer - Asynchronous registration quality evaluation.
 *
 * <p>{@link com.ryuqq.registration.application.evaluation.IntensityAgreementEvaluator} wraps the slow
 * mutual-information computation. The synchronous TRE statistic lives in
 * {@code com.ryuqq.registration.core.evaluation}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.registration.application.evaluation;
