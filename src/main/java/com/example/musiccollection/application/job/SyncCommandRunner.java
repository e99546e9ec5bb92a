package com.example.musiccollection.application.job;

import com.example.musiccollection.application.service.SyncOrchestrator;
import com.example.musiccollection.domain.enumtype.SyncSourceId;
import com.example.musiccollection.domain.model.RunReport;
import com.example.musiccollection.domain.model.SyncOutcome;
import java.util.EnumSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Command-line entry: {@code sync [--source <id>]... [--all] [--force]}. Does nothing unless the
 * first argument is {@code sync}. The process exits normally once the run completes; failed sources
 * show up in the log and in the ledger.
 */
@Component
public class SyncCommandRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SyncCommandRunner.class);

    public static final String COMMAND = "sync";

    private final SyncOrchestrator syncOrchestrator;

    private RunReport lastReport;

    public SyncCommandRunner(SyncOrchestrator syncOrchestrator) {
        this.syncOrchestrator = syncOrchestrator;
    }

    @Override
    public void run(ApplicationArguments args) {
        run(args.getSourceArgs());
    }

    void run(String[] args) {
        SyncCommand command = parse(args);
        if (command == null) {
            return;
        }
        log.info("SYNC_COMMAND sources={} force={}", command.sources.isEmpty() ? "all" : command.sources, command.force);
        lastReport = syncOrchestrator.run(command.sources, command.force);
        for (SyncOutcome outcome : lastReport.getOutcomes()) {
            log.info("SYNC_COMMAND_RESULT source={} status={} records={} message={}",
                    outcome.getSource().getLedgerName(), outcome.getStatus(), outcome.getRecordCount(), outcome.getMessage());
        }
        if (lastReport.failedCount() > 0) {
            log.warn("SYNC_COMMAND_FAILED_SOURCES failed={} total={}",
                    lastReport.failedCount(), lastReport.getOutcomes().size());
        }
    }

    RunReport getLastReport() {
        return lastReport;
    }

    /**
     * @return the parsed command, or null when the arguments are not a sync command
     * @throws IllegalArgumentException for an unknown source or a dangling {@code --source}
     */
    static SyncCommand parse(String[] args) {
        if (args == null || args.length == 0 || !COMMAND.equalsIgnoreCase(args[0])) {
            return null;
        }
        SyncCommand command = new SyncCommand();
        boolean all = false;
        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            if ("--force".equals(arg)) {
                command.force = true;
            } else if ("--all".equals(arg)) {
                all = true;
            } else if ("--source".equals(arg)) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--source requires a value");
                }
                command.sources.add(SyncSourceId.fromName(args[++i]));
            } else if (arg.startsWith("--source=")) {
                command.sources.add(SyncSourceId.fromName(arg.substring("--source=".length())));
            } else if (arg.startsWith("--")) {
                // Spring's own options such as --spring.profiles.active pass through
                log.debug("Ignoring option {}", arg);
            } else {
                throw new IllegalArgumentException("Unexpected argument: " + arg);
            }
        }
        if (all) {
            command.sources.clear();
        }
        return command;
    }

    static final class SyncCommand {

        final Set<SyncSourceId> sources = EnumSet.noneOf(SyncSourceId.class);
        boolean force;
    }
}
