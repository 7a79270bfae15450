package org.dbsync.options;

/**
 * Configuration keys shared by the configuration loader and the CLI.
 */
public final class DbSyncOptions {

    private DbSyncOptions() {
    }

    public static final class Profile {
        private Profile() {}

        public static final String DEFAULT = "dev";

        public static final String ENV_VAR = "DBSYNC_PROFILE";

        public static final String CONFIG_FILE = "dbsync.yaml";
    }

    /**
     * Connection keys, one set per side. Build them with {@link #key(String, String)}.
     */
    public static final class Connection {
        private Connection() {}

        public static final String SOURCE = "source";
        public static final String TARGET = "target";

        public static final String HOST = "host";
        public static final String PORT = "port";
        public static final String USER = "user";
        public static final String PASSWORD = "password";
        public static final String DATABASE = "database";

        public static final int PORT_DEFAULT = 3306;

        public static String key(String side, String attribute) {
            return "dbsync." + side + "." + attribute;
        }
    }

    public static final class Sync {
        private Sync() {}

        /**
         * Source row count above which data guidance recommends an external bulk export.
         * Default: 50,000
         */
        public static final String ROW_COUNT_THRESHOLD_KEY = "dbsync.sync.rowCountThreshold";
        public static final long ROW_COUNT_THRESHOLD_DEFAULT = 50_000L;
    }

    public static final class Output {
        private Output() {}

        public static final String DIRECTORY_KEY = "dbsync.output.directory";
        public static final String DIRECTORY_DEFAULT = ".";

        public static final String BASE_NAME_KEY = "dbsync.output.baseName";
        public static final String BASE_NAME_DEFAULT = "sync_database";
    }
}
