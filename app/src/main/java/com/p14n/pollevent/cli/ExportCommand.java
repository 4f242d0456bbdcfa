package com.p14n.pollevent.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;

import com.p14n.pollevent.App;
import com.p14n.pollevent.EventMonitor;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(name = "export", description = "Export events to a JSON document in the backup directory.")
public class ExportCommand implements Callable<Integer> {

    @ParentCommand
    App app;

    @Spec
    CommandSpec spec;

    @Option(names = { "-s", "--start" }, description = "Inclusive start (epoch millis or ISO-8601)")
    String start;

    @Option(names = { "-e", "--end" }, description = "Exclusive end (epoch millis or ISO-8601)")
    String end;

    @Override
    public Integer call() {
        Long from = Formats.parseTime(start, "--start");
        Long to = Formats.parseTime(end, "--end");
        try (EventMonitor monitor = app.openStore()) {
            Path file = monitor.exportData(from, to);
            spec.commandLine().getOut().println("Exported to " + file);
        }
        return 0;
    }
}
