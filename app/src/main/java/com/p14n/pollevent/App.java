package com.p14n.pollevent;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.pollevent.cli.BackupCommand;
import com.p14n.pollevent.cli.ExportCommand;
import com.p14n.pollevent.cli.ImportCommand;
import com.p14n.pollevent.cli.ListCommand;
import com.p14n.pollevent.cli.RestoreCommand;
import com.p14n.pollevent.cli.RunCommand;
import com.p14n.pollevent.cli.StatsCommand;
import com.p14n.pollevent.cli.SweepCommand;
import com.p14n.pollevent.cli.VerifyCommand;
import com.p14n.pollevent.config.EnvironmentConfig;
import com.p14n.pollevent.data.ConfigData;
import com.p14n.pollevent.simulator.SimulatedControlPort;

import io.opentelemetry.api.OpenTelemetry;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(name = "pollevent", mixinStandardHelpOptions = true, version = "1.0.0",
        description = "Records change events from a poll-only control plane and manages the event store.",
        subcommands = {
                RunCommand.class,
                BackupCommand.class,
                RestoreCommand.class,
                ListCommand.class,
                ExportCommand.class,
                ImportCommand.class,
                StatsCommand.class,
                SweepCommand.class,
                VerifyCommand.class
        })
public class App implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(App.class);

    private final Map<String, String> env;

    @Spec
    CommandSpec spec;

    public App() {
        this(System.getenv());
    }

    public App(Map<String, String> env) {
        this.env = Map.copyOf(env);
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    /**
     * @return configuration as given by the environment
     */
    public ConfigData config() {
        return EnvironmentConfig.load(env);
    }

    /**
     * Opens the configured store for maintenance commands: monitoring is
     * forced on and automatic backups are off.
     */
    public EventMonitor openStore() {
        ConfigData cfg = config().toBuilder()
                .monitoringEnabled(true)
                .backupIntervalMillis(0)
                .build();
        return new EventMonitor(cfg, new SimulatedControlPort(), OpenTelemetry.noop());
    }

    public static CommandLine commandLine(App app) {
        return new CommandLine(app)
                .setExecutionExceptionHandler((ex, cl, parseResult) -> {
                    logger.atDebug().setCause(ex).log("Command failed");
                    cl.getErr().println("error: " + ex.getMessage());
                    return 1;
                });
    }

    public static void main(String[] args) {
        System.exit(commandLine(new App()).execute(args));
    }
}
