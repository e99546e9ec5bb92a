package com.example.musiccollection.application.job;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.musiccollection.application.service.SyncOrchestrator;
import com.example.musiccollection.domain.enumtype.SyncSourceId;
import com.example.musiccollection.domain.model.RunReport;
import com.example.musiccollection.domain.model.SyncOutcome;
import java.util.EnumSet;
import org.junit.jupiter.api.Test;
import org.springframework.boot.SpringApplication;
import org.springframework.context.support.StaticApplicationContext;

class SyncCommandRunnerTest {

    @Test
    void shouldIgnoreArgumentsWithoutSyncCommand() {
        assertNull(SyncCommandRunner.parse(new String[0]));
        assertNull(SyncCommandRunner.parse(new String[] {"--server.port=9000"}));
    }

    @Test
    void shouldParseSourcesInBothForms() {
        SyncCommandRunner.SyncCommand command = SyncCommandRunner.parse(
                new String[] {"sync", "--source", "discogs-collection", "--source=ROON_TRACKS", "--force"});

        assertEquals(EnumSet.of(SyncSourceId.DISCOGS_COLLECTION, SyncSourceId.ROON_TRACKS), command.sources);
        assertTrue(command.force);
    }

    @Test
    void shouldTreatAllAsEverySource() {
        SyncCommandRunner.SyncCommand command = SyncCommandRunner.parse(
                new String[] {"sync", "--source", "roon_albums", "--all"});

        assertTrue(command.sources.isEmpty());
        assertFalse(command.force);
    }

    @Test
    void shouldRejectUnknownSource() {
        assertThrows(IllegalArgumentException.class,
                () -> SyncCommandRunner.parse(new String[] {"sync", "--source", "spotify"}));
        assertThrows(IllegalArgumentException.class,
                () -> SyncCommandRunner.parse(new String[] {"sync", "--source"}));
    }

    @Test
    void shouldExitNormallyWhenSourcesFailed() {
        SyncOrchestrator orchestrator = mock(SyncOrchestrator.class);
        RunReport report = new RunReport();
        report.getOutcomes().add(SyncOutcome.success(SyncSourceId.DISCOGS_WANTLIST, 4));
        report.getOutcomes().add(SyncOutcome.failed(SyncSourceId.ROON_ALBUMS, "bridge unreachable"));
        when(orchestrator.run(any(), anyBoolean())).thenReturn(report);
        SyncCommandRunner runner = new SyncCommandRunner(orchestrator);

        runner.run(new String[] {"sync", "--source", "discogs_wantlist"});

        verify(orchestrator).run(EnumSet.of(SyncSourceId.DISCOGS_WANTLIST), false);
        assertEquals(1, runner.getLastReport().failedCount());

        StaticApplicationContext context = new StaticApplicationContext();
        context.getBeanFactory().registerSingleton("syncCommandRunner", runner);
        context.refresh();
        assertEquals(0, SpringApplication.exit(context));
    }

    @Test
    void shouldNotRunWithoutCommand() {
        SyncOrchestrator orchestrator = mock(SyncOrchestrator.class);
        SyncCommandRunner runner = new SyncCommandRunner(orchestrator);

        runner.run(new String[] {"--spring.profiles.active=dev"});

        verify(orchestrator, never()).run(any(), anyBoolean());
        assertNull(runner.getLastReport());
    }
}
