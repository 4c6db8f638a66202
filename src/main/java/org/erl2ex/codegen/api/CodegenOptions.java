package org.erl2ex.codegen.api;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Options fixed for the duration of a render.
 *
 * @param definePrefix Prefix prepended to macro names to build the environment or
 *                     configuration key of a macro presence flag.
 * @param definesFromConfig Application whose configuration holds the macro presence
 *                          flags, or {@code null} to read process environment variables.
 */
public record CodegenOptions(String definePrefix, String definesFromConfig) {

    private static final Logger LOG = LoggerFactory.getLogger(CodegenOptions.class);

    /** Default value of {@link #definePrefix()}. */
    public static final String DEFAULT_DEFINE_PREFIX = "DEFINE_";

    private static final String ROOT_PATH = "erl2ex.codegen";
    private static final String DEFINE_PREFIX_KEY = "define-prefix";
    private static final String DEFINES_FROM_CONFIG_KEY = "defines-from-config";

    public CodegenOptions {
        if (definePrefix == null) {
            throw new IllegalArgumentException("definePrefix must not be null");
        }
        if (definesFromConfig != null && definesFromConfig.isBlank()) {
            definesFromConfig = null;
        }
    }

    /**
     * @return The options used when nothing is configured.
     */
    public static CodegenOptions defaults() {
        return new CodegenOptions(DEFAULT_DEFINE_PREFIX, null);
    }

    /**
     * Reads the options from the {@code erl2ex.codegen} section of the given configuration.
     * Missing keys fall back to the defaults.
     *
     * @param config The configuration.
     * @return The parsed options.
     */
    public static CodegenOptions fromConfig(Config config) {
        if (!config.hasPath(ROOT_PATH)) {
            return defaults();
        }
        Config section = config.getConfig(ROOT_PATH);
        String prefix = section.hasPath(DEFINE_PREFIX_KEY)
                ? section.getString(DEFINE_PREFIX_KEY)
                : DEFAULT_DEFINE_PREFIX;
        String app = section.hasPath(DEFINES_FROM_CONFIG_KEY)
                ? section.getString(DEFINES_FROM_CONFIG_KEY)
                : null;
        return new CodegenOptions(prefix, app);
    }

    /**
     * Loads the options, respecting the precedence order:
     * 1. CLI arguments as Java System Properties (e.g., -Derl2ex.codegen.define-prefix=X_)
     * 2. Default values (from reference.conf on the classpath)
     *
     * @return The resolved options.
     */
    public static CodegenOptions load() {
        Config config = ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
        CodegenOptions options = fromConfig(config);
        LOG.info("Codegen options: define prefix '{}', flags read from {}", options.definePrefix(),
                options.definesFromConfig() != null ? "application config :" + options.definesFromConfig() : "environment");
        return options;
    }
}
