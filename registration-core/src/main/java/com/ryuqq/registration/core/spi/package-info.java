/**
 * Service Provider Interfaces for the registration orchestrator.
 *
 * <p>Narrow interfaces to the external collaborators and to the caller's event loop.</p>
 *
 * <h2>SPI Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registration.core.spi.VolumeExporter} - Writes volumes, masks and transforms to files</li>
 *   <li>{@link com.ryuqq.registration.core.spi.TransformImporter} - Reads the engine's transform artifact</li>
 *   <li>{@link com.ryuqq.registration.core.spi.IntensityAgreementEngine} - Slow, synchronous MI computation</li>
 *   <li>{@link com.ryuqq.registration.core.spi.CallerLoop} - Single-threaded cooperative loop owning caller state</li>
 * </ul>
 *
 * <h2>Threading Contract</h2>
 * <ul>
 *   <li>Exporter and importer are invoked on the caller loop</li>
 *   <li>The MI engine is invoked on a dedicated worker thread and may throw</li>
 *   <li>Completion is observed only by fixed-interval polls scheduled on the caller loop</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.registration.core.spi;
