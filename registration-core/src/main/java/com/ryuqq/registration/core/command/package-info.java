/**
 * Typed command descriptors for external process invocation.
 *
 * <p>Arguments are kept as an ordered list of {@link com.ryuqq.registration.core.command.ArgumentSpec}
 * and expanded to an argv list only when the process is started. No shell is involved, so paths
 * containing spaces or non-ASCII characters need no quoting.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.registration.core.command;
