package com.easytidal.mirror.service;

import com.easytidal.mirror.cache.Snapshot;
import com.easytidal.mirror.cache.SnapshotCache;
import com.easytidal.mirror.config.MirrorProperties;
import com.easytidal.mirror.graph.DependencyGraphBuilder;
import com.easytidal.mirror.graph.JobGraph;
import com.easytidal.mirror.history.HistoryEntry;
import com.easytidal.mirror.history.HistoryLog;
import com.easytidal.mirror.layout.CyclicGraphException;
import com.easytidal.mirror.layout.HierarchicalLayout;
import com.easytidal.mirror.layout.Point;
import com.easytidal.mirror.model.Job;
import com.easytidal.mirror.model.JobStatus;
import com.easytidal.mirror.model.Trigger;
import com.easytidal.mirror.scheduler.SchedulerException;
import com.easytidal.mirror.scheduler.TidalClient;
import com.easytidal.mirror.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JobGraphService.
 *
 * Only the scheduler client is mocked. Cache and history write to a temp
 * directory and time comes from a hand-driven clock, so TTL behaviour is
 * tested against the real file formats.
 */
@ExtendWith(MockitoExtension.class)
class JobGraphServiceTest {

    static final Instant T0 = Instant.parse("2024-05-01T08:00:00Z");

    static final Job EXTRACT = new Job("1", "extract", JobStatus.SUCCESS);
    static final Job LOAD    = new Job("2", "load", JobStatus.PENDING);
    static final Job REPORT  = new Job("3", "report", JobStatus.PENDING);

    @Mock TidalClient client;

    @TempDir Path dir;

    final MutableClock        clock  = new MutableClock(T0);
    final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    final ObjectMapper        json   = new ObjectMapper().findAndRegisterModules();

    SnapshotCache   cache;
    HistoryLog      history;
    JobGraphService service;

    @AfterEach
    void tearDown() {
        if (history != null) {
            history.close();
        }
    }

    private void createService(boolean captureOutput) {
        MirrorProperties props = new MirrorProperties(
                new MirrorProperties.Scheduler("http://tidal", "svc", "pw", "etl", Duration.ofSeconds(5)),
                new MirrorProperties.Cache(dir.resolve("cache.json"), Duration.ofHours(1)),
                new MirrorProperties.History(dir.resolve("history.json"), 100, captureOutput),
                new MirrorProperties.Layout(200, 100));
        cache   = new SnapshotCache(props, json, clock);
        history = new HistoryLog(props, json);
        service = new JobGraphService(client, new DependencyGraphBuilder(), cache, history,
                new HierarchicalLayout(props), props, clock, meters);
    }

    /** extract -> load -> report, every status lookup answers with the given status. */
    private void stubChain(JobStatus status) {
        when(client.listJobs("etl")).thenReturn(List.of(EXTRACT, LOAD, REPORT));
        Map<String, List<Trigger>> triggers = Map.of(
                "1", List.of(new Trigger("load")),
                "2", List.of(new Trigger("report")),
                "3", List.of());
        when(client.listTriggers(anyString())).thenAnswer(inv -> triggers.get(inv.<String>getArgument(0)));
        when(client.getStatus(anyString())).thenReturn(status);
    }

    // ------------------------------------------------------------------
    // getSnapshot()
    // ------------------------------------------------------------------

    @Test
    void getSnapshot_emptyCache_rebuildsAndRecordsHistory() {
        createService(false);
        stubChain(JobStatus.SUCCESS);

        SnapshotView view = service.getSnapshot();

        assertThat(view.source()).isEqualTo(DataSource.FRESH);
        assertThat(view.createdAt()).isEqualTo(T0);
        assertThat(view.graph().edgeCount()).isEqualTo(2);
        assertThat(cache.isValid()).isTrue();
        assertThat(history.loadAll())
                .extracting(HistoryEntry::jobName)
                .containsExactly("extract", "load", "report");
        assertThat(meters.counter("easytidal.cache.requests", "result", "miss").count()).isEqualTo(1.0);
        verify(client, never()).getOutput(any());
    }

    @Test
    void getSnapshot_freshCache_servedWithoutCallingTidal() {
        createService(false);
        stubChain(JobStatus.SUCCESS);
        service.getSnapshot();
        clearInvocations(client);

        clock.advance(Duration.ofMinutes(59));
        SnapshotView view = service.getSnapshot();

        assertThat(view.source()).isEqualTo(DataSource.CACHE);
        assertThat(view.createdAt()).isEqualTo(T0);
        assertThat(view.jobs()).containsExactly(EXTRACT, LOAD, REPORT);
        verifyNoInteractions(client);
        assertThat(history.loadAll()).hasSize(3);      // cache hits record nothing
        assertThat(meters.counter("easytidal.cache.requests", "result", "hit").count()).isEqualTo(1.0);
    }

    @Test
    void getSnapshot_expiredCache_rebuilds() {
        createService(false);
        stubChain(JobStatus.RUNNING);
        service.getSnapshot();

        clock.advance(Duration.ofMinutes(61));
        SnapshotView view = service.getSnapshot();

        assertThat(view.source()).isEqualTo(DataSource.FRESH);
        assertThat(view.createdAt()).isEqualTo(T0.plus(Duration.ofMinutes(61)));
        verify(client, times(2)).listJobs("etl");
        assertThat(history.loadAll()).hasSize(6);
    }

    @Test
    void freshSnapshotView_graphIsIndependentOfCachedSnapshot() {
        createService(false);
        stubChain(JobStatus.SUCCESS);

        SnapshotView view = service.getSnapshot();
        view.graph().addEdge("report", "extract");

        Snapshot cached = cache.load().orElseThrow();
        assertThat(cached.graph().edgeCount()).isEqualTo(2);
        assertThat(service.getSnapshot().graph().edgeCount()).isEqualTo(2);
    }

    @Test
    void snapshotView_copiesGraph() {
        JobGraph graph = new JobGraph();
        graph.addEdge("A", "B");
        Snapshot snapshot = new Snapshot(List.of(), graph, T0);

        SnapshotView view = SnapshotView.of(snapshot, DataSource.FRESH);
        view.graph().addEdge("B", "C");

        assertThat(graph.edgeCount()).isEqualTo(1);
        assertThat(graph.containsNode("C")).isFalse();
        assertThat(view.graph().edgeCount()).isEqualTo(2);
    }

    // ------------------------------------------------------------------
    // refresh()
    // ------------------------------------------------------------------

    @Test
    void refresh_ignoresFreshCache() {
        createService(false);
        stubChain(JobStatus.SUCCESS);
        service.getSnapshot();
        clock.advance(Duration.ofMinutes(5));

        Snapshot snapshot = service.refresh();

        assertThat(snapshot.createdAt()).isEqualTo(T0.plus(Duration.ofMinutes(5)));
        assertThat(cache.load()).get().extracting(Snapshot::createdAt).isEqualTo(snapshot.createdAt());
        verify(client, times(2)).listJobs("etl");
        assertThat(meters.counter("easytidal.refresh", "outcome", "success").count()).isEqualTo(1.0);
    }

    @Test
    void refresh_schedulerDown_cacheStaysEmpty() {
        createService(false);
        when(client.listJobs("etl"))
                .thenThrow(new SchedulerException(SchedulerException.Kind.CONNECTION, "refused"));

        assertThatThrownBy(() -> service.refresh())
                .isInstanceOf(SchedulerException.class)
                .satisfies(e -> assertThat(((SchedulerException) e).getKind())
                        .isEqualTo(SchedulerException.Kind.CONNECTION));

        assertThat(cache.load()).isEmpty();
        assertThat(meters.counter("easytidal.refresh", "outcome", "failure").count()).isEqualTo(1.0);
    }

    // ------------------------------------------------------------------
    // Failure policy
    // ------------------------------------------------------------------

    @Test
    void triggerLookupFails_nothingCachedOrRecorded() {
        createService(false);
        when(client.listJobs("etl")).thenReturn(List.of(EXTRACT, LOAD));
        when(client.listTriggers("1")).thenReturn(List.of(new Trigger("load")));
        when(client.listTriggers("2"))
                .thenThrow(new SchedulerException(SchedulerException.Kind.TIMEOUT, "slow"));

        assertThatThrownBy(() -> service.getSnapshot()).isInstanceOf(SchedulerException.class);

        assertThat(cache.load()).isEmpty();
        assertThat(history.loadAll()).isEmpty();
        verify(client, never()).getStatus(any());
    }

    @Test
    void statusLookupFails_jobSkippedOthersRecorded() {
        createService(false);
        when(client.listJobs("etl")).thenReturn(List.of(EXTRACT, LOAD, REPORT));
        when(client.listTriggers(anyString())).thenReturn(List.of());
        when(client.getStatus("1")).thenReturn(JobStatus.SUCCESS);
        when(client.getStatus("2"))
                .thenThrow(new SchedulerException(SchedulerException.Kind.NOT_FOUND, "gone"));
        when(client.getStatus("3")).thenReturn(JobStatus.FAILED);

        SnapshotView view = service.getSnapshot();

        assertThat(view.jobs()).hasSize(3);
        assertThat(history.loadAll())
                .extracting(HistoryEntry::jobName, HistoryEntry::status)
                .containsExactly(
                        tuple("extract", JobStatus.SUCCESS),
                        tuple("report", JobStatus.FAILED));
        assertThat(meters.counter("easytidal.status.skipped", "kind", "not_found").count()).isEqualTo(1.0);
    }

    @Test
    void skippedStatusTag_independentOfDefaultLocale() {
        Locale saved = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            createService(false);
            when(client.listJobs("etl")).thenReturn(List.of(EXTRACT));
            when(client.listTriggers("1")).thenReturn(List.of());
            when(client.getStatus("1"))
                    .thenThrow(new SchedulerException(SchedulerException.Kind.TIMEOUT, "slow"));

            service.getSnapshot();

            assertThat(meters.counter("easytidal.status.skipped", "kind", "timeout").count()).isEqualTo(1.0);
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    void historyEntriesCarryTheRebuildTime() {
        createService(false);
        stubChain(JobStatus.SUCCESS);
        clock.advance(Duration.ofSeconds(30));

        service.getSnapshot();

        assertThat(history.loadAll())
                .extracting(HistoryEntry::timestamp)
                .containsOnly(T0.plusSeconds(30));
    }

    // ------------------------------------------------------------------
    // Output capture
    // ------------------------------------------------------------------

    @Test
    void captureOutput_storesOutputAndStderrForFailures() {
        createService(true);
        when(client.listJobs("etl")).thenReturn(List.of(EXTRACT, LOAD));
        when(client.listTriggers(anyString())).thenReturn(List.of());
        when(client.getStatus("1")).thenReturn(JobStatus.SUCCESS);
        when(client.getStatus("2")).thenReturn(JobStatus.FAILED);
        when(client.getOutput("1")).thenReturn("rows=42");
        when(client.getOutput("2"))
                .thenThrow(new SchedulerException(SchedulerException.Kind.TIMEOUT, "slow"));
        when(client.getLog("2", "stderr")).thenReturn("disk full");

        service.getSnapshot();

        List<HistoryEntry> entries = history.loadAll();
        assertThat(entries).hasSize(2);
        assertThat(entries.get(0).output()).isEqualTo("rows=42");
        assertThat(entries.get(0).errorLog()).isNull();
        assertThat(entries.get(1).output()).isNull();
        assertThat(entries.get(1).errorLog()).isEqualTo("disk full");
        verify(client, never()).getLog("1", "stderr");
    }

    // ------------------------------------------------------------------
    // Layout and history delegation
    // ------------------------------------------------------------------

    @Test
    void layout_positionsChainLeftToRight() {
        createService(false);
        stubChain(JobStatus.SUCCESS);
        SnapshotView view = service.getSnapshot();

        assertThat(service.levels(view.graph()))
                .containsOnly(entry("extract", 0), entry("load", 1), entry("report", 2));
        assertThat(service.layout(view.graph()))
                .containsEntry("extract", new Point(0, 0))
                .containsEntry("report", new Point(400, 0));
    }

    @Test
    void cyclicTriggers_snapshotCachedButLayoutRejected() {
        createService(false);
        Job a = new Job("a", "A", JobStatus.SUCCESS);
        Job b = new Job("b", "B", JobStatus.SUCCESS);
        when(client.listJobs("etl")).thenReturn(List.of(a, b));
        when(client.listTriggers("a")).thenReturn(List.of(new Trigger("B")));
        when(client.listTriggers("b")).thenReturn(List.of(new Trigger("A")));
        when(client.getStatus(anyString())).thenReturn(JobStatus.SUCCESS);

        SnapshotView view = service.getSnapshot();

        assertThat(cache.isValid()).isTrue();
        assertThat(view.graph().edgeCount()).isEqualTo(2);
        assertThatThrownBy(() -> service.layout(view.graph()))
                .isInstanceOf(CyclicGraphException.class);
    }

    @Test
    void historyQueries_delegateToLog() {
        createService(false);
        stubChain(JobStatus.SUCCESS);
        service.getSnapshot();
        clock.advance(Duration.ofHours(2));
        service.getSnapshot();

        assertThat(service.historyFor("load", 10)).hasSize(2);
        assertThat(service.historyFor("2", 1))
                .singleElement()
                .extracting(HistoryEntry::timestamp)
                .isEqualTo(T0.plus(Duration.ofHours(2)));
        assertThat(service.recentHistory(4)).hasSize(4);
        assertThat(service.historyJobNames()).containsExactly("extract", "load", "report");
    }
}
