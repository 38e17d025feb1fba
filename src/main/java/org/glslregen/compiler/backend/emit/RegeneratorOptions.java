package org.glslregen.compiler.backend.emit;

import com.typesafe.config.Config;

import java.util.Objects;

/**
 * Layout options for regenerated source.
 *
 * @param indentUnit       Text emitted once per nesting level.
 * @param versionDirective Value of a leading {@code #version} line; empty for none.
 */
public record RegeneratorOptions(String indentUnit, String versionDirective) {

    /** Two-space indent, no {@code #version} line. */
    public static final RegeneratorOptions DEFAULTS = new RegeneratorOptions("  ", "");

    public RegeneratorOptions {
        Objects.requireNonNull(indentUnit, "indentUnit");
        versionDirective = versionDirective == null ? "" : versionDirective.trim();
    }

    /**
     * Reads options from the {@code regen} section of the application config.
     *
     * @param config The resolved application config; missing keys fall back to {@link #DEFAULTS}.
     * @return The options.
     */
    public static RegeneratorOptions fromConfig(Config config) {
        String indent = config.hasPath("regen.indent")
                ? config.getString("regen.indent")
                : DEFAULTS.indentUnit();
        String version = config.hasPath("regen.version-directive")
                ? config.getString("regen.version-directive")
                : DEFAULTS.versionDirective();
        return new RegeneratorOptions(indent, version);
    }

    public RegeneratorOptions withVersionDirective(String version) {
        return new RegeneratorOptions(indentUnit, version);
    }

    /**
     * @return {@code depth} copies of the indent unit; empty for depth zero or below.
     */
    String indent(int depth) {
        return depth <= 0 ? "" : indentUnit.repeat(depth);
    }
}
