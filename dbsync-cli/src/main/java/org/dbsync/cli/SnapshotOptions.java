package org.dbsync.cli;

import picocli.CommandLine;

import java.nio.file.Path;

/**
 * Snapshot files that replace a live connection for one or both sides.
 */
public class SnapshotOptions {

    @CommandLine.Option(names = "--source-snapshot", description = "Source snapshot JSON; the configured source connection is used when absent")
    Path sourceSnapshot;

    @CommandLine.Option(names = "--target-snapshot", description = "Target snapshot JSON; the configured target connection is used when absent")
    Path targetSnapshot;
}
