package com.phillippitts.multiroomaudio.service.status;

import com.phillippitts.multiroomaudio.config.properties.StatusMonitorProperties;
import com.phillippitts.multiroomaudio.domain.PlayerStatusSnapshot;
import com.phillippitts.multiroomaudio.service.player.PlayerOrchestrator;
import com.phillippitts.multiroomaudio.service.status.event.PlayerProcessExitedEvent;
import com.phillippitts.multiroomaudio.testutil.EventCapturingPublisher;
import com.phillippitts.multiroomaudio.testutil.SyncExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PlayerStatusMonitorTest {

    private PlayerOrchestrator orchestrator;
    private EventCapturingPublisher events;
    private List<PlayerStatusSnapshot> snapshots;
    private PlayerStatusMonitor monitor;

    @BeforeEach
    void setUp() {
        orchestrator = mock(PlayerOrchestrator.class);
        events = new EventCapturingPublisher();
        snapshots = new CopyOnWriteArrayList<>();
        PlayerStatusPublisher publisher = new PlayerStatusPublisher(List.of(snapshots::add), new SyncExecutor());
        monitor = new PlayerStatusMonitor(orchestrator, publisher, events, new StatusMonitorProperties());
    }

    @Test
    void publishesSnapshotOfAllPlayers() {
        Map<String, Boolean> statuses = new LinkedHashMap<>();
        statuses.put("Kitchen", true);
        statuses.put("Patio", false);
        when(orchestrator.cleanupDeadProcesses()).thenReturn(List.of());
        when(orchestrator.getAllStatuses()).thenReturn(statuses);

        monitor.poll();

        assertThat(snapshots).hasSize(1);
        assertThat(snapshots.get(0).statuses()).containsExactlyEntriesOf(statuses);
        assertThat(snapshots.get(0).runningCount()).isEqualTo(1);
        assertThat(events.eventsOfType(PlayerProcessExitedEvent.class)).isEmpty();
    }

    @Test
    void announcesEachReapedPlayer() {
        when(orchestrator.cleanupDeadProcesses()).thenReturn(List.of("Kitchen", "Patio"));
        when(orchestrator.getAllStatuses()).thenReturn(Map.of("Kitchen", false, "Patio", false));

        monitor.poll();

        assertThat(events.eventsOfType(PlayerProcessExitedEvent.class))
                .extracting(PlayerProcessExitedEvent::name)
                .containsExactly("Kitchen", "Patio");
        assertThat(snapshots.get(0).runningCount()).isZero();
    }

    @Test
    void failedPollIsLoggedAndNextPollRuns() {
        when(orchestrator.cleanupDeadProcesses())
                .thenThrow(new IllegalStateException("boom"))
                .thenReturn(List.of());
        when(orchestrator.getAllStatuses()).thenReturn(Map.of("Kitchen", true));

        assertThatCode(monitor::poll).doesNotThrowAnyException();
        assertThat(snapshots).isEmpty();

        monitor.poll();
        assertThat(snapshots).hasSize(1);
    }
}
