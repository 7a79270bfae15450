package org.dbsync.cli;

import org.dbsync.config.ConfigurationLoader;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.Map;

/**
 * Options that select the configuration file and profile.
 */
public class ProfileOptions {

    @CommandLine.Option(names = "--profile", description = "Configuration profile to use (dev, prod, test ...)")
    String profile;

    @CommandLine.Option(names = "--config-dir", description = "Directory to start the dbsync.yaml search from (default: working directory)")
    Path configDir;

    Map<String, String> loadConfiguration() {
        ConfigurationLoader loader = configDir == null
                ? new ConfigurationLoader()
                : new ConfigurationLoader(configDir.toAbsolutePath());
        return loader.loadConfiguration(profile);
    }
}
