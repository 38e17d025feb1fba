package org.glslregen.compiler.backend.emit;

import org.glslregen.compiler.ir.FunctionId;
import org.glslregen.compiler.ir.Pack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a {@link Pack} back into shading-language source.
 * <p>
 * All prototypes are emitted first, in {@link Pack#functionPrototypes()} order, followed by all
 * definitions in {@link Pack#functionDefinitionOrder()} order, so every callee is declared before
 * any body that calls it. Neither list is reordered or deduplicated.
 *
 * <p>The regenerator keeps no state between calls; one instance may serve any number of
 * concurrent regenerations. A {@link org.glslregen.compiler.api.RegenerationException} aborts the
 * whole call and leaves the output buffer in an unspecified state.</p>
 */
public class GlslRegenerator {

    private static final Logger log = LoggerFactory.getLogger(GlslRegenerator.class);

    private final RegeneratorOptions options;

    public GlslRegenerator() {
        this(RegeneratorOptions.DEFAULTS);
    }

    public GlslRegenerator(RegeneratorOptions options) {
        this.options = options;
    }

    /**
     * @param pack The program to regenerate.
     * @return The generated source.
     */
    public String regenerate(Pack pack) {
        StringBuilder out = new StringBuilder();
        regenerate(pack, out);
        return out.toString();
    }

    /**
     * Appends the generated source for {@code pack} to {@code out}.
     */
    public void regenerate(Pack pack, StringBuilder out) {
        int start = out.length();
        TypePrinter typePrinter = new TypePrinter(pack);
        SymbolPrinter symbolPrinter = new SymbolPrinter(pack, typePrinter);
        ExpressionEmitter expressions = new ExpressionEmitter(pack, symbolPrinter);
        BlockEmitter blocks = new BlockEmitter(pack, expressions, options);
        FunctionEmitter functions = new FunctionEmitter(pack, typePrinter, symbolPrinter, blocks, options);

        if (!options.versionDirective().isEmpty()) {
            out.append("#version ").append(options.versionDirective()).append('\n');
        }

        int prototypes = 0;
        for (FunctionId functionId : pack.functionPrototypes()) {
            if (functions.emitFunction(functionId, false, out)) {
                prototypes++;
            } else {
                log.debug("Pruned prototype {} without a definition", functionId);
            }
        }
        for (FunctionId functionId : pack.functionDefinitionOrder()) {
            functions.emitFunction(functionId, true, out);
        }

        log.debug("Regenerated {} prototypes and {} definitions ({} chars)",
                prototypes, pack.functionDefinitionOrder().size(), out.length() - start);
    }
}
