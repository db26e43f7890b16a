/**
 * Scripted stand-in for the external registration engine.
 *
 * <p>Generates POSIX shell scripts that follow the engine's argument convention
 * (output directory last) so runner and orchestrator tests can exercise real process
 * spawning without the imaging toolkit installed.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.registration.adapter.inmemory.engine;
