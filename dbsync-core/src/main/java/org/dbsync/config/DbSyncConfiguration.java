package org.dbsync.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.ToString;

import java.util.HashMap;
import java.util.Map;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DbSyncConfiguration {

    @JsonProperty("profiles")
    private Map<String, ProfileConfiguration> profiles = new HashMap<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProfileConfiguration {

        @JsonProperty("source")
        private ConnectionConfiguration source;

        @JsonProperty("target")
        private ConnectionConfiguration target;

        @JsonProperty("sync")
        private SyncConfiguration sync;

        @JsonProperty("output")
        private OutputConfiguration output;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ConnectionConfiguration {

        @JsonProperty("host")
        private String host;

        @JsonProperty("port")
        private Integer port;

        @JsonProperty("user")
        private String user;

        @ToString.Exclude
        @JsonProperty("password")
        private String password;

        @JsonProperty("database")
        private String database;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SyncConfiguration {

        @JsonProperty("rowCountThreshold")
        private Long rowCountThreshold;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OutputConfiguration {

        @JsonProperty("directory")
        private String directory;

        @JsonProperty("baseName")
        private String baseName;
    }
}
