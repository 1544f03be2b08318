package org.schemasync.options;

/**
 * Configuration keys and defaults shared by the configuration loader and the CLI.
 */
public final class SchemaSyncOptions {

    private SchemaSyncOptions() {
    }

    /**
     * Profile-related settings.
     */
    public static final class Profile {
        private Profile() {}

        /**
         * Default profile name.
         */
        public static final String DEFAULT = "dev";

        /**
         * Profile environment variable name.
         */
        public static final String ENV_VAR = "SCHEMASYNC_PROFILE";

        /**
         * Configuration file name.
         */
        public static final String CONFIG_FILE = "schemasync.yaml";
    }

    /**
     * Table exclusion settings.
     */
    public static final class Exclude {
        private Exclude() {}

        /**
         * Comma separated exclusion patterns, e.g. {@code logs,users_backup_*}.
         */
        public static final String TABLES_KEY = "schemasync.exclude.tables";
    }

    public static final class Output {
        private Output() {}

        public static final String DIRECTORY_KEY = "schemasync.output.directory";
    }

    public static final class Dialect {
        private Dialect() {}

        public static final String KEY = "schemasync.dialect";
        public static final String DEFAULT = "mysql";
    }
}
