package org.minikconfig.config;

import com.typesafe.config.Config;

/**
 * Typed view of the <code>minikconfig</code> section of the configuration.
 *
 * <pre>
 * minikconfig {
 *   input = "Kconfig"
 *   output = ".config"
 *   select-defaults = true
 *   strict = false
 * }
 * </pre>
 *
 * @param input Default root description file.
 * @param output Default output file.
 * @param selectDefaults Whether <code>default y</code> symbols are selected.
 * @param strict Whether error diagnostics make the run fail.
 */
public record MiniKconfigSettings(String input, String output, boolean selectDefaults, boolean strict) {

    private static final String SECTION = "minikconfig";

    /**
     * Reads the settings from a loaded configuration.
     * @param config The configuration, with reference defaults merged in.
     * @return The settings.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     */
    public static MiniKconfigSettings from(final Config config) {
        final Config section = config.getConfig(SECTION);
        return new MiniKconfigSettings(
                section.getString("input"),
                section.getString("output"),
                section.getBoolean("select-defaults"),
                section.getBoolean("strict"));
    }
}
