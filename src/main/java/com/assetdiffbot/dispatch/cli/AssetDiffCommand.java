package com.assetdiffbot.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command.
 * Routes to subcommands: serve, enqueue, cleanup, queue.
 */
@Command(
        name = "assetdiffbot",
        mixinStandardHelpOptions = true,
        version = "Asset Diff Bot 0.1.0",
        description = "Renders visual diffs of sprite sheets and tile maps changed in pull requests",
        subcommands = {
                ServeCommand.class,
                EnqueueCommand.class,
                CleanupCommand.class,
                QueueCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AssetDiffCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
