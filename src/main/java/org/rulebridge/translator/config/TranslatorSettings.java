package org.rulebridge.translator.config;

import com.typesafe.config.Config;

/**
 * Translator options read from the {@code translator} block of the HOCON configuration.
 * <pre>
 * translator {
 *   strict-mode = false      # fail on the first skipped statement
 *   output {
 *     include = "icv.rh"     # header included by the generated deck
 *     unit = "um"            # unit suffix in check descriptions
 *   }
 * }
 * </pre>
 *
 * @param strictMode Whether a skipped statement aborts the translation.
 * @param includeFile The header file named in the generated {@code #include}.
 * @param unitSuffix The unit appended to thresholds in check descriptions.
 */
public record TranslatorSettings(boolean strictMode, String includeFile, String unitSuffix) {

    private static final String ROOT = "translator";

    /**
     * @return The built-in defaults, matching {@code reference.conf}.
     */
    public static TranslatorSettings defaults() {
        return new TranslatorSettings(false, "icv.rh", "um");
    }

    /**
     * Reads the settings, falling back to {@link #defaults()} for every missing key.
     * @param config The application configuration.
     * @return The settings.
     */
    public static TranslatorSettings fromConfig(Config config) {
        TranslatorSettings defaults = defaults();
        if (!config.hasPath(ROOT)) {
            return defaults;
        }
        Config translator = config.getConfig(ROOT);
        return new TranslatorSettings(
                translator.hasPath("strict-mode") ? translator.getBoolean("strict-mode") : defaults.strictMode(),
                translator.hasPath("output.include") ? translator.getString("output.include") : defaults.includeFile(),
                translator.hasPath("output.unit") ? translator.getString("output.unit") : defaults.unitSuffix());
    }

    /**
     * @param strict The new strict-mode flag.
     * @return A copy with strict mode replaced.
     */
    public TranslatorSettings withStrictMode(boolean strict) {
        return new TranslatorSettings(strict, includeFile, unitSuffix);
    }
}
