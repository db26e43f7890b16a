package com.ryuqq.registration.testkit.contract;

import com.ryuqq.registration.application.orchestrator.RegistrationCallback;
import com.ryuqq.registration.core.model.TransformSlot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Registration callback that records every invocation.
 *
 * <p>Records the success flag, the delivered slot and the invoking thread so contract tests
 * can verify the exactly-once and caller-loop delivery guarantees.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RecordingCallback implements RegistrationCallback {

    private final List<Invocation> invocations = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void onComplete(boolean success, TransformSlot outputSlot) {
        invocations.add(new Invocation(success, outputSlot, Thread.currentThread()));
    }

    public int count() {
        return invocations.size();
    }

    public boolean isCalled() {
        return !invocations.isEmpty();
    }

    /**
     * Returns the only invocation.
     *
     * @return the single recorded invocation
     * @throws AssertionError if the callback was not invoked exactly once
     */
    public Invocation single() {
        synchronized (invocations) {
            if (invocations.size() != 1) {
                throw new AssertionError("Expected exactly one callback but got " + invocations.size());
            }
            return invocations.get(0);
        }
    }

    public List<Invocation> invocations() {
        synchronized (invocations) {
            return List.copyOf(invocations);
        }
    }

    /**
     * One recorded callback invocation.
     *
     * @param success success flag
     * @param outputSlot delivered slot (null on failure)
     * @param thread invoking thread
     */
    public record Invocation(boolean success, TransformSlot outputSlot, Thread thread) {
    }
}
