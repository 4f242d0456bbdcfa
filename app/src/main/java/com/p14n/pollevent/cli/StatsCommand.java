package com.p14n.pollevent.cli;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

import com.p14n.pollevent.App;
import com.p14n.pollevent.EventMonitor;
import com.p14n.pollevent.query.EventStatistics;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(name = "stats", description = "Show event store statistics.")
public class StatsCommand implements Callable<Integer> {

    @ParentCommand
    App app;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try (EventMonitor monitor = app.openStore()) {
            print(out, monitor.statistics());
        }
        return 0;
    }

    static void print(PrintWriter out, EventStatistics stats) {
        out.println("Events:          " + stats.totalEvents());
        out.println("Controls:        " + stats.distinctControls());
        out.println("Change groups:   " + stats.distinctGroups());
        out.println("Oldest event:    " + Formats.time(stats.oldestEvent()));
        out.println("Newest event:    " + Formats.time(stats.newestEvent()));
        out.println("Store size:      " + Formats.bytes(stats.storeSizeBytes()));
        out.println("Buffered:        " + stats.bufferedEvents() + "/" + stats.bufferCapacity());
        out.println("Overflow:        " + stats.overflowCount());
        out.println("Retention days:  " + stats.retentionDays());
    }
}
