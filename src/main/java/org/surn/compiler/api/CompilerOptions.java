package org.surn.compiler.api;

import com.typesafe.config.Config;
import org.surn.compiler.frontend.parser.OperatorPolicy;

/**
 * The switches of a compiler run, read from the {@code surn.compiler} section of the configuration.
 *
 * @param semanticChecks Run the pre-parse token analyzer.
 * @param optimize Passed on to later compiler stages.
 * @param dumpAst Log the parsed tree at debug level.
 * @param postSemanticChecks Passed on to later compiler stages.
 * @param astOnly Stop once the tree is built.
 * @param operatorPolicy How trailing binary operators are attached.
 * @param verbosity The level of the {@link org.surn.compiler.diagnostics.CompilerLogger}.
 */
public record CompilerOptions(
        boolean semanticChecks,
        boolean optimize,
        boolean dumpAst,
        boolean postSemanticChecks,
        boolean astOnly,
        OperatorPolicy.Kind operatorPolicy,
        int verbosity
) {

    /** The configuration path the options are read from. */
    public static final String CONFIG_PATH = "surn.compiler";

    /**
     * @return The options used when no configuration is given.
     */
    public static CompilerOptions defaults() {
        return new CompilerOptions(true, false, false, false, false, OperatorPolicy.Kind.LEGACY, 2);
    }

    /**
     * Reads the options from a configuration. Missing keys keep their default.
     * @param config The resolved application configuration.
     * @return The options.
     * @throws com.typesafe.config.ConfigException.BadValue if the operator policy is unknown.
     */
    public static CompilerOptions fromConfig(Config config) {
        CompilerOptions defaults = defaults();
        if (!config.hasPath(CONFIG_PATH)) {
            return defaults;
        }
        Config section = config.getConfig(CONFIG_PATH);
        return new CompilerOptions(
                bool(section, "semantic-checks", defaults.semanticChecks()),
                bool(section, "optimize", defaults.optimize()),
                bool(section, "dump-ast", defaults.dumpAst()),
                bool(section, "post-semantic-checks", defaults.postSemanticChecks()),
                bool(section, "ast-only", defaults.astOnly()),
                section.hasPath("operator-precedence")
                        ? section.getEnum(OperatorPolicy.Kind.class, "operator-precedence")
                        : defaults.operatorPolicy(),
                section.hasPath("verbosity") ? section.getInt("verbosity") : defaults.verbosity());
    }

    /**
     * @param kind The operator policy to use.
     * @return A copy of these options with another operator policy.
     */
    public CompilerOptions withOperatorPolicy(OperatorPolicy.Kind kind) {
        return new CompilerOptions(semanticChecks, optimize, dumpAst, postSemanticChecks, astOnly, kind, verbosity);
    }

    /**
     * @param enabled Whether to dump the tree.
     * @return A copy of these options with AST dumping switched.
     */
    public CompilerOptions withDumpAst(boolean enabled) {
        return new CompilerOptions(semanticChecks, optimize, enabled, postSemanticChecks, astOnly, operatorPolicy, verbosity);
    }

    private static boolean bool(Config section, String key, boolean fallback) {
        return section.hasPath(key) ? section.getBoolean(key) : fallback;
    }
}
