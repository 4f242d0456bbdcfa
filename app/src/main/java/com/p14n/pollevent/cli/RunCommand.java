package com.p14n.pollevent.cli;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

import com.p14n.pollevent.App;
import com.p14n.pollevent.EventMonitor;
import com.p14n.pollevent.broker.MessageSubscriber;
import com.p14n.pollevent.broker.MonitorNotification;
import com.p14n.pollevent.group.AddControlsResult;
import com.p14n.pollevent.group.RejectedControl;
import com.p14n.pollevent.simulator.SimulatedControlPort;
import com.p14n.pollevent.telemetry.DefaultTelemetryConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(name = "run", description = "Poll a simulated device and record its change events.")
public class RunCommand implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(RunCommand.class);

    @ParentCommand
    App app;

    @Spec
    CommandSpec spec;

    @Option(names = { "-g", "--group" }, defaultValue = "simulated", description = "Change group id")
    String group;

    @Option(names = { "-c", "--controls" }, split = ",",
            defaultValue = "Mixer.gain,Mixer.mute,Mixer.level,Router.input",
            description = "Comma separated control paths")
    List<String> controls;

    @Option(names = { "-r", "--rate" }, defaultValue = "1.0", description = "Poll interval in seconds")
    double rate;

    @Option(names = { "-d", "--duration" }, defaultValue = "10", description = "Seconds to run, 0 runs until interrupted")
    double duration;

    @Override
    public Integer call() throws InterruptedException {
        PrintWriter out = spec.commandLine().getOut();
        MessageSubscriber<MonitorNotification> printer = n -> {
            out.println("[" + n.type() + "] " + n.message());
            out.flush();
        };
        try (DefaultTelemetryConfig telemetry = new DefaultTelemetryConfig("pollevent");
                EventMonitor monitor = new EventMonitor(app.config(), new SimulatedControlPort(), telemetry)) {
            Thread hook = closeOnShutdown(monitor);
            monitor.subscribe(printer);
            monitor.start();
            monitor.createGroup(group, rate);
            AddControlsResult added = monitor.addControls(group, controls);
            for (RejectedControl r : added.rejected()) {
                out.println("Skipped " + r.reference() + ": " + r.reason());
            }
            out.println("Polling " + added.accepted().size() + " controls in group " + group + " every " + rate + "s");
            out.flush();

            if (duration > 0) {
                Thread.sleep((long) (duration * 1000));
            } else {
                Thread.currentThread().join();
            }

            monitor.flush();
            out.println("Health: " + monitor.health().tier());
            if (monitor.config().monitoringEnabled()) {
                StatsCommand.print(out, monitor.statistics());
            }
            Runtime.getRuntime().removeShutdownHook(hook);
        }
        return 0;
    }

    /**
     * Closes the monitor when the JVM is stopped, so buffered events are
     * written and the store is shut down on interrupt.
     */
    static Thread closeOnShutdown(EventMonitor monitor) {
        Thread hook = new Thread(() -> {
            logger.atInfo().log("Shutting down event monitor since JVM is shutting down");
            monitor.close();
        }, "pollevent-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        return hook;
    }
}
