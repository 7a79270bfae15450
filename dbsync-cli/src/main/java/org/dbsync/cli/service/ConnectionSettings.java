package org.dbsync.cli.service;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import org.dbsync.options.DbSyncOptions;

import java.util.Map;

import static org.dbsync.options.DbSyncOptions.Connection.key;

@Value
@Builder
public class ConnectionSettings {
    String host;
    @Builder.Default int port = DbSyncOptions.Connection.PORT_DEFAULT;
    String user;
    @ToString.Exclude String password;
    String database;

    public String jdbcUrl() {
        return "jdbc:mariadb://" + host + ":" + port + "/" + database;
    }

    public String describe() {
        return database + " at " + host + ":" + port;
    }

    /**
     * Reads one side ("source" or "target") from a flattened configuration map.
     *
     * @throws IllegalArgumentException when host or database is missing or the port is not a number
     */
    public static ConnectionSettings fromConfiguration(Map<String, String> config, String side) {
        String host = config.get(key(side, DbSyncOptions.Connection.HOST));
        String database = config.get(key(side, DbSyncOptions.Connection.DATABASE));
        if (host == null || database == null) {
            throw new IllegalArgumentException("No " + side + " connection configured: set "
                    + key(side, DbSyncOptions.Connection.HOST) + " and "
                    + key(side, DbSyncOptions.Connection.DATABASE) + " in "
                    + DbSyncOptions.Profile.CONFIG_FILE + " or pass a snapshot file");
        }
        String port = config.getOrDefault(key(side, DbSyncOptions.Connection.PORT),
                String.valueOf(DbSyncOptions.Connection.PORT_DEFAULT));
        try {
            return ConnectionSettings.builder()
                    .host(host)
                    .port(Integer.parseInt(port.trim()))
                    .user(config.get(key(side, DbSyncOptions.Connection.USER)))
                    .password(config.get(key(side, DbSyncOptions.Connection.PASSWORD)))
                    .database(database)
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + side + " port: " + port, e);
        }
    }
}
