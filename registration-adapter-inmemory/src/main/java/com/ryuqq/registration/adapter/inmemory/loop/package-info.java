/**
 * Caller loop implementations.
 *
 * <ul>
 *   <li>{@link com.ryuqq.registration.adapter.inmemory.loop.SingleThreadCallerLoop} - Daemon single-thread scheduler</li>
 *   <li>{@link com.ryuqq.registration.adapter.inmemory.loop.ManualCallerLoop} - Driven by the test thread</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.registration.adapter.inmemory.loop;
