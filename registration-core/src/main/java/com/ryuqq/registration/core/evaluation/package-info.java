/**
 * Registration quality metrics.
 *
 * <ul>
 *   <li>{@link com.ryuqq.registration.core.evaluation.PointPairErrorEvaluator} - Synchronous target registration error</li>
 *   <li>{@link com.ryuqq.registration.core.evaluation.MiResult} - Result type of the asynchronous mutual-information evaluation</li>
 *   <li>{@link com.ryuqq.registration.core.evaluation.EvaluationReport} - Metric/value table combining both</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.registration.core.evaluation;
