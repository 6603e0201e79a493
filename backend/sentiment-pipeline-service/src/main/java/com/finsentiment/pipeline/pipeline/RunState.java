package com.finsentiment.pipeline.pipeline;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Process-wide holder of the current run snapshot.
 *
 * Reads never block. Only {@link PipelineEngine} mutates the state.
 */
@Component
public class RunState {

    private final AtomicReference<RunSnapshot> current = new AtomicReference<>(RunSnapshot.idle());

    public RunSnapshot snapshot() {
        return current.get();
    }

    /**
     * Installs a running snapshot unless a run is already in progress.
     */
    boolean tryBegin(RunSnapshot running) {
        while (true) {
            RunSnapshot existing = current.get();
            if (existing.running()) {
                return false;
            }
            if (current.compareAndSet(existing, running)) {
                return true;
            }
        }
    }

    RunSnapshot update(UnaryOperator<RunSnapshot> change) {
        return current.updateAndGet(change);
    }

    /**
     * @return false when no run is in progress
     */
    boolean requestCancel() {
        while (true) {
            RunSnapshot existing = current.get();
            if (!existing.running()) {
                return false;
            }
            RunSnapshot cancelling = existing.toBuilder()
                    .cancelRequested(true)
                    .statusMessage("Stopping...")
                    .build();
            if (current.compareAndSet(existing, cancelling)) {
                return true;
            }
        }
    }
}
