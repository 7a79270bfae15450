package org.dbsync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.dbsync.options.DbSyncOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static org.dbsync.options.DbSyncOptions.Connection.key;

@Slf4j
public class ConfigurationLoader {

    private static final String CONFIG_FILE_NAME = DbSyncOptions.Profile.CONFIG_FILE;
    private static final String DEFAULT_PROFILE = DbSyncOptions.Profile.DEFAULT;
    private static final String PROFILE_ENV_VAR = DbSyncOptions.Profile.ENV_VAR;

    private final ObjectMapper yamlMapper;
    private final Path startDirectory;
    private final Function<String, String> environment;

    public ConfigurationLoader() {
        this(Paths.get("").toAbsolutePath());
    }

    public ConfigurationLoader(Path startDirectory) {
        this(startDirectory, System::getenv);
    }

    ConfigurationLoader(Path startDirectory, Function<String, String> environment) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.startDirectory = startDirectory;
        this.environment = environment;
    }

    /**
     * Loads dbsync.yaml and flattens the active profile into a key/value map
     * keyed by the {@link DbSyncOptions} constants.
     *
     * Profile precedence: CLI > environment variable > default (dev)
     *
     * @param cliProfile profile given on the command line, may be null
     */
    public Map<String, String> loadConfiguration(String cliProfile) {
        String activeProfile = resolveActiveProfile(cliProfile);

        Optional<DbSyncConfiguration> config = findAndLoadConfiguration();
        if (config.isEmpty()) {
            return createDefaultConfiguration();
        }

        return extractConfigurationForProfile(config.get(), activeProfile);
    }

    String resolveActiveProfile(String cliProfile) {
        if (cliProfile != null && !cliProfile.trim().isEmpty()) {
            return cliProfile.trim();
        }

        String envProfile = environment.apply(PROFILE_ENV_VAR);
        if (envProfile != null && !envProfile.trim().isEmpty()) {
            return envProfile.trim();
        }

        return DEFAULT_PROFILE;
    }

    /**
     * Walks from the start directory up to the filesystem root looking for dbsync.yaml.
     */
    private Optional<DbSyncConfiguration> findAndLoadConfiguration() {
        Path currentDir = startDirectory;

        while (currentDir != null) {
            Path configFile = currentDir.resolve(CONFIG_FILE_NAME);
            if (Files.exists(configFile)) {
                try {
                    return Optional.of(yamlMapper.readValue(configFile.toFile(), DbSyncConfiguration.class));
                } catch (IOException e) {
                    log.warn("Failed to parse {}: {}", configFile, e.getMessage());
                    return Optional.empty();
                }
            }
            currentDir = currentDir.getParent();
        }

        return Optional.empty();
    }

    private Map<String, String> extractConfigurationForProfile(DbSyncConfiguration config, String profile) {
        var profileConfig = config.getProfiles().get(profile);
        if (profileConfig == null) {
            log.warn("Profile '{}' not found in {}. Using defaults.", profile, CONFIG_FILE_NAME);
            return createDefaultConfiguration();
        }

        var configMap = new HashMap<>(createDefaultConfiguration());

        putConnection(configMap, DbSyncOptions.Connection.SOURCE, profileConfig.getSource());
        putConnection(configMap, DbSyncOptions.Connection.TARGET, profileConfig.getTarget());

        if (profileConfig.getSync() != null && profileConfig.getSync().getRowCountThreshold() != null) {
            configMap.put(DbSyncOptions.Sync.ROW_COUNT_THRESHOLD_KEY,
                    String.valueOf(profileConfig.getSync().getRowCountThreshold()));
        }

        var output = profileConfig.getOutput();
        if (output != null) {
            putIfPresent(configMap, DbSyncOptions.Output.DIRECTORY_KEY, output.getDirectory());
            putIfPresent(configMap, DbSyncOptions.Output.BASE_NAME_KEY, output.getBaseName());
        }

        return configMap;
    }

    private void putConnection(Map<String, String> map, String side,
                               DbSyncConfiguration.ConnectionConfiguration connection) {
        if (connection == null) {
            return;
        }
        putIfPresent(map, key(side, DbSyncOptions.Connection.HOST), connection.getHost());
        if (connection.getPort() != null) {
            map.put(key(side, DbSyncOptions.Connection.PORT), String.valueOf(connection.getPort()));
        }
        putIfPresent(map, key(side, DbSyncOptions.Connection.USER), connection.getUser());
        putIfPresent(map, key(side, DbSyncOptions.Connection.PASSWORD), connection.getPassword());
        putIfPresent(map, key(side, DbSyncOptions.Connection.DATABASE), connection.getDatabase());
    }

    private static void putIfPresent(Map<String, String> map, String key, String value) {
        if (value != null && !value.isBlank()) {
            map.put(key, value);
        }
    }

    private Map<String, String> createDefaultConfiguration() {
        return Map.of(
            DbSyncOptions.Sync.ROW_COUNT_THRESHOLD_KEY, String.valueOf(DbSyncOptions.Sync.ROW_COUNT_THRESHOLD_DEFAULT),
            key(DbSyncOptions.Connection.SOURCE, DbSyncOptions.Connection.PORT), String.valueOf(DbSyncOptions.Connection.PORT_DEFAULT),
            key(DbSyncOptions.Connection.TARGET, DbSyncOptions.Connection.PORT), String.valueOf(DbSyncOptions.Connection.PORT_DEFAULT),
            DbSyncOptions.Output.DIRECTORY_KEY, DbSyncOptions.Output.DIRECTORY_DEFAULT,
            DbSyncOptions.Output.BASE_NAME_KEY, DbSyncOptions.Output.BASE_NAME_DEFAULT
        );
    }
}
