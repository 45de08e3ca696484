package io.txnbox.standalone.config;

/**
 * Settings of the configuration checker.
 *
 * <p>
 * All fields have defaults except {@code configFile}, which is required.
 * Use {@link #builder()} to construct instances.
 *
 * @param configFile    YAML configuration file to compile
 * @param keyPath       dot separated key path of the directives in the file,
 *                      {@code "."} for the document root
 * @param remap         compile as a remap rule instead of global hooks
 * @param dump          print the compiled tree as JSON
 * @param loggingFormat json or text
 * @param loggingLevel  root log level
 */
public record CheckerSettings(
        String configFile, String keyPath, boolean remap, boolean dump, String loggingFormat, String loggingLevel) {

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link CheckerSettings}. */
    public static final class Builder {
        private String configFile;
        private String keyPath = ".";
        private boolean remap;
        private boolean dump;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder configFile(String configFile) {
            this.configFile = configFile;
            return this;
        }

        public Builder keyPath(String keyPath) {
            this.keyPath = keyPath;
            return this;
        }

        public Builder remap(boolean remap) {
            this.remap = remap;
            return this;
        }

        public Builder dump(boolean dump) {
            this.dump = dump;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * Builds the {@link CheckerSettings}.
         *
         * @throws SettingsLoadException if no configuration file was given
         */
        public CheckerSettings build() {
            if (configFile == null || configFile.isBlank()) {
                throw new SettingsLoadException(
                        "No configuration file given. Use --config <path> or set TXNBOX_CONFIG.");
            }
            return new CheckerSettings(configFile, keyPath, remap, dump, loggingFormat, loggingLevel);
        }
    }
}
