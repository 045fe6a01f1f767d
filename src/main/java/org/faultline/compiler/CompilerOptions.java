package org.faultline.compiler;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Settings of the taxonomy compiler, read from the {@code faultline.compiler} configuration block.
 * Default values live in {@code reference.conf}.
 *
 * @param rejectDuplicateCodes Whether two variants sharing a code fail the compilation instead of warning.
 * @param dumpEnabled Whether the compiled artifact is written to the dump directory.
 * @param dumpDirectory The directory artifact dumps are written to.
 * @param defaultFileName The logical file name used for sources compiled from memory.
 */
public record CompilerOptions(
        boolean rejectDuplicateCodes,
        boolean dumpEnabled,
        String dumpDirectory,
        String defaultFileName
) {
    /** The configuration path of the compiler block. */
    public static final String CONFIG_PATH = "faultline.compiler";

    /**
     * @return The options defined by {@code reference.conf} alone.
     */
    public static CompilerOptions defaults() {
        return fromConfig(ConfigFactory.empty());
    }

    /**
     * Reads the options from a configuration.
     * Keys missing from the {@code faultline.compiler} block fall back to {@code reference.conf}.
     *
     * @param config The application configuration.
     * @return The compiler options.
     */
    public static CompilerOptions fromConfig(Config config) {
        Config c = config.withFallback(ConfigFactory.defaultReference()).getConfig(CONFIG_PATH);
        return new CompilerOptions(
                c.getBoolean("reject-duplicate-codes"),
                c.getBoolean("dump.enabled"),
                c.getString("dump.directory"),
                c.getString("default-file-name"));
    }
}
