/**
 * In-Memory scene adapter.
 *
 * <p>{@link com.ryuqq.registration.adapter.inmemory.scene.InMemoryScene} implements both the
 * {@code VolumeExporter} and {@code TransformImporter} SPIs for development and testing.
 * Not intended for production imaging pipelines.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.registration.adapter.inmemory.scene;
