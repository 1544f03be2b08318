package org.schemasync.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
public class SchemaSyncConfiguration {

    /**
     * Settings per profile name.
     */
    @JsonProperty("profiles")
    private Map<String, ProfileConfiguration> profiles = new HashMap<>();

    @Data
    public static class ProfileConfiguration {

        @JsonProperty("exclude")
        private ExcludeConfiguration exclude;

        @JsonProperty("output")
        private OutputConfiguration output;

        @JsonProperty("dialect")
        private String dialect;
    }

    /**
     * Tables hidden from reports and "select all" selections.
     */
    @Data
    public static class ExcludeConfiguration {

        @JsonProperty("tables")
        private List<String> tables = new ArrayList<>();
    }

    @Data
    public static class OutputConfiguration {

        @JsonProperty("directory")
        private String directory;
    }
}
