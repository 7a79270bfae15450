package org.dbsync.cli;

import picocli.CommandLine;

/**
 * Main CLI entry point for dbsync.
 * Compares two MariaDB/MySQL schemas and generates a reviewed synchronization script.
 */
@CommandLine.Command(
        name = "dbsync",
        mixinStandardHelpOptions = true,
        version = "dbsync 1.0",
        description = "Compares two MariaDB/MySQL schemas and generates a synchronization script",
        subcommands = {
                CompareCommand.class,
                SyncCommand.class,
                SnapshotCommand.class
        }
)
public class DbSyncCli {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new DbSyncCli()).execute(args);
        System.exit(exitCode);
    }
}
