package io.flowrules.cli.config;

/**
 * Configuration for the dry-run tool. Use {@link #builder()} for the
 * documented defaults.
 *
 * @param engine        active rule engine: {@code strict} or {@code legacy}
 * @param parseCache    memoize parsed rule text in the strict engine
 * @param flowsFile     YAML flow catalog to load
 * @param defaultFlow   flow evaluated when {@code --flow} is absent
 * @param loggingFormat {@code text} or {@code json}
 * @param loggingLevel  root log level
 */
public record RulesConfig(
        String engine,
        boolean parseCache,
        String flowsFile,
        String defaultFlow,
        String loggingFormat,
        String loggingLevel) {

    public static final String ENGINE_STRICT = "strict";
    public static final String ENGINE_LEGACY = "legacy";

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder pre-populated with this config's values. */
    public Builder toBuilder() {
        return new Builder()
                .engine(engine)
                .parseCache(parseCache)
                .flowsFile(flowsFile)
                .defaultFlow(defaultFlow)
                .loggingFormat(loggingFormat)
                .loggingLevel(loggingLevel);
    }

    /** Builder for {@link RulesConfig}. Every field has a default. */
    public static final class Builder {
        private String engine = ENGINE_STRICT;
        private boolean parseCache = true;
        private String flowsFile = "flows.yaml";
        private String defaultFlow = "welcome";
        private String loggingFormat = "text";
        private String loggingLevel = "WARN";

        Builder() {}

        public Builder engine(String engine) {
            this.engine = engine;
            return this;
        }

        public Builder parseCache(boolean parseCache) {
            this.parseCache = parseCache;
            return this;
        }

        public Builder flowsFile(String flowsFile) {
            this.flowsFile = flowsFile;
            return this;
        }

        public Builder defaultFlow(String defaultFlow) {
            this.defaultFlow = defaultFlow;
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
         * Builds the config.
         *
         * @throws ConfigLoadException if the engine is not {@code strict} or
         *                             {@code legacy}
         */
        public RulesConfig build() {
            String normalized = engine == null ? "" : engine.trim().toLowerCase(java.util.Locale.ROOT);
            if (!ENGINE_STRICT.equals(normalized) && !ENGINE_LEGACY.equals(normalized)) {
                throw new ConfigLoadException(
                        "Invalid rules engine '" + engine + "': expected 'strict' or 'legacy'");
            }
            return new RulesConfig(normalized, parseCache, flowsFile, defaultFlow, loggingFormat, loggingLevel);
        }
    }
}
