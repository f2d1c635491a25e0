package com.usatiuk.fstreemap;

import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

/**
 * Settings of a {@link FsTreeMap}.
 *
 * @param failCreatingIfExists whether inserting a file next to a child with the same name fails,
 *                             otherwise the new file is appended and shadowed by the existing child
 * @param printIndent          number of spaces per level used by {@link TreePrinter}
 */
public record FsTreeMapConfig(boolean failCreatingIfExists, int printIndent) {
    public static final String FAIL_CREATING_IF_EXISTS = "fstreemap.fail_creating_if_exists";
    public static final String PRINT_INDENT = "fstreemap.print.indent";

    public FsTreeMapConfig {
        if (printIndent < 0)
            throw new IllegalArgumentException("Negative indent: " + printIndent);
    }

    public static FsTreeMapConfig defaults() {
        return new FsTreeMapConfig(true, 2);
    }

    /**
     * Read the settings from a config, using the defaults for missing keys.
     *
     * @param config the config to read
     * @return the settings
     */
    public static FsTreeMapConfig fromConfig(Config config) {
        var defaults = defaults();
        return new FsTreeMapConfig(
                config.getOptionalValue(FAIL_CREATING_IF_EXISTS, Boolean.class).orElse(defaults.failCreatingIfExists()),
                config.getOptionalValue(PRINT_INDENT, Integer.class).orElse(defaults.printIndent())
        );
    }

    /**
     * Read the settings from the config of the current classloader.
     *
     * @return the settings
     */
    public static FsTreeMapConfig load() {
        return fromConfig(ConfigProvider.getConfig());
    }
}
