package com.p14n.pollevent.cli;

import java.util.concurrent.Callable;

import com.p14n.pollevent.App;
import com.p14n.pollevent.EventMonitor;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(name = "verify", description = "Check that every stored event can be read back.")
public class VerifyCommand implements Callable<Integer> {

    @ParentCommand
    App app;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        try (EventMonitor monitor = app.openStore()) {
            long checked = monitor.verifyStore();
            spec.commandLine().getOut().println("Store OK, " + checked + " events checked");
        }
        return 0;
    }
}
