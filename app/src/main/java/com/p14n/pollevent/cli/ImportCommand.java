package com.p14n.pollevent.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;

import com.p14n.pollevent.App;
import com.p14n.pollevent.EventMonitor;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(name = "import", description = "Append the events of an export document to the store.")
public class ImportCommand implements Callable<Integer> {

    @ParentCommand
    App app;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "Export document")
    Path file;

    @Override
    public Integer call() {
        try (EventMonitor monitor = app.openStore()) {
            int imported = monitor.importData(file);
            spec.commandLine().getOut().println("Imported " + imported + " events from " + file);
        }
        return 0;
    }
}
