package com.p14n.pollevent.cli;

import java.util.concurrent.Callable;

import com.p14n.pollevent.App;
import com.p14n.pollevent.EventMonitor;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(name = "sweep", description = "Delete events older than the retention period.")
public class SweepCommand implements Callable<Integer> {

    @ParentCommand
    App app;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        try (EventMonitor monitor = app.openStore()) {
            int deleted = monitor.sweepRetention();
            spec.commandLine().getOut().println("Deleted " + deleted + " events older than "
                    + monitor.config().retentionDays() + " days");
        }
        return 0;
    }
}
