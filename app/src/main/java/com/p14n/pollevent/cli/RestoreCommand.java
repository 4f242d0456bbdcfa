package com.p14n.pollevent.cli;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import com.p14n.pollevent.App;
import com.p14n.pollevent.EventMonitor;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(name = "restore", description = "Replace the event store with a snapshot.")
public class RestoreCommand implements Callable<Integer> {

    @ParentCommand
    App app;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "Snapshot file")
    Path file;

    @Option(names = { "-f", "--force" }, description = "Overwrite a store that already holds events")
    boolean force;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (!Files.isRegularFile(file)) {
            err.println("Backup file not found: " + file);
            return 1;
        }
        try (EventMonitor monitor = app.openStore()) {
            long existing = monitor.storedEvents();
            if (existing > 0 && !force) {
                err.println("Store already holds " + existing + " events, use --force to overwrite");
                return 1;
            }
            monitor.restoreFromBackup(file);
            out.println("Restored " + monitor.storedEvents() + " events from " + file);
        }
        return 0;
    }
}
