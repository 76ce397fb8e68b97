package me.internalizable.proxyfleet.manager.reconcile;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one reconciliation pass.
 *
 * @param started instances whose daemon was started
 * @param markedStopped instances whose stale status was corrected to stopped
 * @param failed instances that could not be started, with the reason
 */
public record ReconcileReport(
        @Nonnull List<String> started,
        @Nonnull List<String> markedStopped,
        @Nonnull Map<String, String> failed
) {

    public ReconcileReport {
        started = List.copyOf(started);
        markedStopped = List.copyOf(markedStopped);
        failed = Map.copyOf(failed);
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }
}
