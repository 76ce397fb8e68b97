package me.internalizable.proxyfleet.manager.reconcile;

import me.internalizable.proxyfleet.api.DesiredState;
import me.internalizable.proxyfleet.api.InstanceStatus;
import me.internalizable.proxyfleet.api.error.FleetException;
import me.internalizable.proxyfleet.manager.registry.InstanceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Brings the process fleet back to the persisted desired states, typically
 * right after the manager starts.
 *
 * <p>Deciding and doing are separate: {@link #plan} is a pure function from
 * records to actions, and {@link #reconcile} hands each action to an
 * {@link ActionExecutor}. A failed action is reported and does not stop the
 * remaining instances from being processed.</p>
 */
public class DesiredStateReconciler {

    private static final Logger LOGGER = LoggerFactory.getLogger(DesiredStateReconciler.class);

    /**
     * Carries out reconcile actions.
     */
    public interface ActionExecutor {

        /**
         * Start an instance's daemon. Failures are expected to leave the
         * instance with {@code status=error} before the exception propagates.
         *
         * @param name instance name
         */
        void start(@Nonnull String name);

        /**
         * Record that an instance is not running.
         *
         * @param name instance name
         */
        void markStopped(@Nonnull String name);
    }

    private final ActionExecutor executor;

    public DesiredStateReconciler(@Nonnull ActionExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Decide what to do for each record.
     *
     * @param records persisted records
     * @param isRunning whether a live process is tracked for a name
     * @return one action per record, in record order
     */
    @Nonnull
    public static List<ReconcileAction> plan(
            @Nonnull Collection<InstanceRecord> records,
            @Nonnull Predicate<String> isRunning) {
        List<ReconcileAction> actions = new ArrayList<>(records.size());
        for (InstanceRecord record : records) {
            String name = record.name();
            boolean running = isRunning.test(name);

            if (record.desiredState() == DesiredState.RUNNING) {
                actions.add(running
                        ? new ReconcileAction(ReconcileAction.Type.NONE, name, "already running")
                        : new ReconcileAction(ReconcileAction.Type.START, name, "desired running, no process"));
            } else if (!running && (record.status() == InstanceStatus.RUNNING
                    || record.status() == InstanceStatus.INITIALIZING)) {
                actions.add(new ReconcileAction(ReconcileAction.Type.MARK_STOPPED, name,
                        "desired stopped, stale status " + record.status()));
            } else {
                actions.add(new ReconcileAction(ReconcileAction.Type.NONE, name, "desired stopped"));
            }
        }
        return actions;
    }

    /**
     * Plan and execute.
     *
     * @param records persisted records
     * @param isRunning whether a live process is tracked for a name
     * @return what happened
     */
    @Nonnull
    public ReconcileReport reconcile(
            @Nonnull Collection<InstanceRecord> records,
            @Nonnull Predicate<String> isRunning) {
        List<ReconcileAction> actions = plan(records, isRunning);

        List<String> started = new ArrayList<>();
        List<String> markedStopped = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();

        for (ReconcileAction action : actions) {
            switch (action.type()) {
                case START -> {
                    try {
                        executor.start(action.name());
                        started.add(action.name());
                    } catch (FleetException e) {
                        LOGGER.error("Failed to restore instance '{}': {}", action.name(), e.getMessage());
                        failed.put(action.name(), e.getMessage());
                    } catch (RuntimeException e) {
                        LOGGER.error("Failed to restore instance '{}'", action.name(), e);
                        failed.put(action.name(), String.valueOf(e.getMessage()));
                    }
                }
                case MARK_STOPPED -> {
                    try {
                        executor.markStopped(action.name());
                        markedStopped.add(action.name());
                    } catch (RuntimeException e) {
                        LOGGER.error("Failed to correct status of '{}'", action.name(), e);
                        failed.put(action.name(), String.valueOf(e.getMessage()));
                    }
                }
                case NONE -> LOGGER.debug("Instance '{}': {}", action.name(), action.reason());
            }
        }

        LOGGER.info("Reconciled {} instance(s): {} started, {} marked stopped, {} failed",
                actions.size(), started.size(), markedStopped.size(), failed.size());
        return new ReconcileReport(started, markedStopped, failed);
    }
}
