/**
 * Registration data model package.
 *
 * <p>Value types shared by the orchestrator, the process runner and the evaluators.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registration.core.model.NodeRef} - Opaque reference to a caller-owned scene node</li>
 *   <li>{@link com.ryuqq.registration.core.model.RegistrationRequest} - Immutable run request</li>
 *   <li>{@link com.ryuqq.registration.core.model.ConfigSelection} - Strategy, sampling fraction and init mode</li>
 *   <li>{@link com.ryuqq.registration.core.model.TransformSlot} - Caller-owned output slot (content copy only)</li>
 *   <li>{@link com.ryuqq.registration.core.model.AffineTransform3D} - 4x4 homogeneous transform</li>
 *   <li>{@link com.ryuqq.registration.core.model.Point3} / {@link com.ryuqq.registration.core.model.PointPair} - Landmark coordinates</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.registration.core.model;
