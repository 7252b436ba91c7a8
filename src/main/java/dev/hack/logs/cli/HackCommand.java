package dev.hack.logs.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

@CommandLine.Command(
    name = "hack",
    description = "Local development helper: stream and pretty-print project logs.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = { LogsCommand.class, LogPipeCommand.class }
)
final class HackCommand implements Runnable {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = "--verbose",
        description = "Print debug diagnostics (backend choice, spawned commands) on stderr."
    )
    void setVerbose(boolean verbose) {
        configureLogging(verbose);
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    static void configureLogging(boolean verbose) {
        var root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof Logger logback) {
            logback.setLevel(verbose ? Level.DEBUG : Level.WARN);
        }
    }
}
