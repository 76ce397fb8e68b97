package me.internalizable.proxyfleet.manager.reconcile;

import me.internalizable.proxyfleet.api.DesiredState;
import me.internalizable.proxyfleet.api.InstanceStatus;
import me.internalizable.proxyfleet.api.error.ProcessException;
import me.internalizable.proxyfleet.manager.registry.InstanceRecord;
import me.internalizable.proxyfleet.manager.testing.TestRecords;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

@ExtendWith(MockitoExtension.class)
class DesiredStateReconcilerTest {

    @Mock
    private DesiredStateReconciler.ActionExecutor executor;

    private static InstanceRecord record(String name, int port, DesiredState desired, InstanceStatus status) {
        return TestRecords.forwardProxy(name, port).withDesiredState(desired).withStatus(status, null);
    }

    @Test
    void planStartsOnlyMissingDesiredRunningInstances() {
        List<InstanceRecord> records = List.of(
                record("a", 3001, DesiredState.RUNNING, InstanceStatus.RUNNING),
                record("b", 3002, DesiredState.RUNNING, InstanceStatus.ERROR),
                record("c", 3003, DesiredState.STOPPED, InstanceStatus.STOPPED),
                record("d", 3004, DesiredState.STOPPED, InstanceStatus.RUNNING),
                record("e", 3005, DesiredState.STOPPED, InstanceStatus.ERROR));
        Set<String> running = Set.of("a");

        List<ReconcileAction> actions = DesiredStateReconciler.plan(records, running::contains);

        assertThat(actions).extracting(ReconcileAction::type).containsExactly(
                ReconcileAction.Type.NONE,
                ReconcileAction.Type.START,
                ReconcileAction.Type.NONE,
                ReconcileAction.Type.MARK_STOPPED,
                ReconcileAction.Type.NONE);
    }

    @Test
    void planIsIdempotentOnceConverged() {
        List<InstanceRecord> records = List.of(
                record("a", 3001, DesiredState.RUNNING, InstanceStatus.RUNNING),
                record("c", 3003, DesiredState.STOPPED, InstanceStatus.STOPPED));

        assertThat(DesiredStateReconciler.plan(records, Set.of("a")::contains))
                .allMatch(action -> action.type() == ReconcileAction.Type.NONE);
    }

    @Test
    void reconcileExecutesPlan() {
        List<InstanceRecord> records = List.of(
                record("a", 3001, DesiredState.RUNNING, InstanceStatus.STOPPED),
                record("d", 3004, DesiredState.STOPPED, InstanceStatus.RUNNING));

        ReconcileReport report = new DesiredStateReconciler(executor).reconcile(records, name -> false);

        verify(executor).start("a");
        verify(executor).markStopped("d");
        verifyNoMoreInteractions(executor);
        assertThat(report.started()).containsExactly("a");
        assertThat(report.markedStopped()).containsExactly("d");
        assertThat(report.hasFailures()).isFalse();
    }

    @Test
    void failedStartDoesNotBlockOthers() {
        List<InstanceRecord> records = List.of(
                record("a", 3001, DesiredState.RUNNING, InstanceStatus.RUNNING),
                record("b", 3002, DesiredState.RUNNING, InstanceStatus.RUNNING));
        doThrow(new ProcessException("port 3001 is already bound by another process"))
                .when(executor).start("a");

        ReconcileReport report = new DesiredStateReconciler(executor).reconcile(records, name -> false);

        verify(executor).start("b");
        verify(executor, never()).markStopped("a");
        assertThat(report.started()).containsExactly("b");
        assertThat(report.failed()).containsEntry("a", "port 3001 is already bound by another process");
        assertThat(report.hasFailures()).isTrue();
    }

    @Test
    void unexpectedFailureDoesNotAbortRestore() {
        List<InstanceRecord> records = List.of(
                record("a", 3001, DesiredState.RUNNING, InstanceStatus.RUNNING),
                record("b", 3002, DesiredState.STOPPED, InstanceStatus.RUNNING),
                record("c", 3003, DesiredState.RUNNING, InstanceStatus.STOPPED));
        doThrow(new IllegalArgumentException("IP Address is invalid")).when(executor).start("a");
        doThrow(new IllegalStateException("disk gone")).when(executor).markStopped("b");

        ReconcileReport report = new DesiredStateReconciler(executor).reconcile(records, name -> false);

        verify(executor).start("c");
        assertThat(report.started()).containsExactly("c");
        assertThat(report.markedStopped()).isEmpty();
        assertThat(report.failed())
                .containsEntry("a", "IP Address is invalid")
                .containsEntry("b", "disk gone");
    }
}
