package com.p14n.pollevent.cli;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

import com.p14n.pollevent.App;
import com.p14n.pollevent.EventMonitor;
import com.p14n.pollevent.data.BackupRecord;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(name = "list", description = "List snapshots, newest first.")
public class ListCommand implements Callable<Integer> {

    @ParentCommand
    App app;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try (EventMonitor monitor = app.openStore()) {
            List<BackupRecord> backups = monitor.listBackups();
            if (backups.isEmpty()) {
                out.println("No backups found");
                return 0;
            }
            out.println("Backups (" + backups.size() + "):");
            for (BackupRecord b : backups) {
                out.println("  " + b.filename() + "  " + b.createdAt() + "  " + Formats.bytes(b.size())
                        + (b.compressed() ? "  gzip" : ""));
            }
        }
        return 0;
    }
}
