package com.p14n.pollevent.cli;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

import com.p14n.pollevent.App;
import com.p14n.pollevent.EventMonitor;
import com.p14n.pollevent.data.BackupRecord;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(name = "backup", description = "Create a snapshot of the event store.")
public class BackupCommand implements Callable<Integer> {

    @ParentCommand
    App app;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try (EventMonitor monitor = app.openStore()) {
            BackupRecord backup = monitor.performBackup();
            out.println("Backup created: " + backup.filename());
            out.println("  path:   " + backup.path());
            out.println("  events: " + backup.eventsCount());
            out.println("  size:   " + Formats.bytes(backup.size()));
        }
        return 0;
    }
}
